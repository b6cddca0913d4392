package io.eventbus.topic;

import io.eventbus.observation.ObservationTracker;
import io.eventbus.store.EventStore;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe topic registry that owns the lifecycle of per-topic partitions in the
 * {@link EventStore} and the {@link ObservationTracker}.
 *
 * <p>Register and unregister calls for the same topic are serialized on this registry;
 * {@link #exists(String)} and {@link #all()} read without locking.
 */
public final class DefaultTopicRegistry implements TopicRegistry {
  private static final Logger logger = Logger.getLogger(DefaultTopicRegistry.class.getName());

  private final Set<String> topics = ConcurrentHashMap.newKeySet();
  private final EventStore eventStore;
  private final ObservationTracker observationTracker;

  public DefaultTopicRegistry(EventStore eventStore, ObservationTracker observationTracker) {
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    this.observationTracker = Objects.requireNonNull(observationTracker, "observationTracker");
  }

  @Override
  public synchronized void register(String topic) {
    Objects.requireNonNull(topic, "topic");
    if (topic.isEmpty()) {
      throw new IllegalArgumentException("topic cannot be empty");
    }
    if (topics.contains(topic)) {
      return;
    }
    eventStore.createPartition(topic);
    observationTracker.createPartition(topic);
    topics.add(topic);
    logger.log(Level.FINE, "Registered topic {0}", topic);
  }

  @Override
  public synchronized void unregister(String topic) {
    Objects.requireNonNull(topic, "topic");
    if (!topics.remove(topic)) {
      return;
    }
    // observations before store
    observationTracker.dropPartition(topic);
    eventStore.dropPartition(topic);
    logger.log(Level.FINE, "Unregistered topic {0}", topic);
  }

  @Override
  public boolean exists(String topic) {
    return topic != null && topics.contains(topic);
  }

  @Override
  public Set<String> all() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(topics));
  }
}
