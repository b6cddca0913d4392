package io.eventbus.store;

import io.eventbus.Event;
import io.eventbus.EventNotFoundException;
import io.eventbus.TopicNotRegisteredException;

import java.util.Optional;

/**
 * Keyed storage of event payloads, partitioned per topic.
 *
 * <p>Partitions are created and dropped by the {@link io.eventbus.topic.TopicRegistry}.
 * Deletion of individual events is driven by the
 * {@link io.eventbus.observation.ObservationTracker} once no listener holds the event.
 *
 * @see InMemoryEventStore
 */
public interface EventStore {

  /**
   * Creates the partition for a topic if absent.
   */
  void createPartition(String topic);

  /**
   * Drops the partition for a topic together with every event it holds. No-op if absent.
   */
  void dropPartition(String topic);

  boolean hasPartition(String topic);

  /**
   * Inserts or replaces the event stored under {@code (event.topic(), event.id())}.
   *
   * @throws TopicNotRegisteredException if the topic has no partition
   */
  void put(Event event);

  /**
   * Returns the stored event.
   *
   * @throws EventNotFoundException if no event is stored under {@code (topic, id)}
   */
  Event get(String topic, String id);

  /**
   * Returns the stored event, or empty if absent.
   */
  Optional<Event> find(String topic, String id);

  /**
   * Removes the event stored under {@code (topic, id)}. No-op if absent.
   */
  void delete(String topic, String id);

  /**
   * Returns the number of events held for a topic, or {@code 0} if it has no partition.
   */
  int size(String topic);
}
