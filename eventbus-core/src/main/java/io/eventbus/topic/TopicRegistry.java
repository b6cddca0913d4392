package io.eventbus.topic;

import java.util.Set;

/**
 * Registry of the topics the bus accepts events for.
 *
 * <p>Registering a topic creates its storage and observation partitions; unregistering
 * drops both, discarding events that were still awaiting dispositions.
 *
 * @see DefaultTopicRegistry
 */
public interface TopicRegistry {

  /**
   * Registers a topic. No-op if already registered.
   */
  void register(String topic);

  /**
   * Unregisters a topic and discards its events. No-op if not registered.
   */
  void unregister(String topic);

  boolean exists(String topic);

  /**
   * Returns a snapshot of the registered topics. Registrations made while the snapshot is
   * taken may or may not be included.
   */
  Set<String> all();
}
