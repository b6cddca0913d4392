package io.eventbus.observation;

import io.eventbus.Disposition;
import io.eventbus.Event;
import io.eventbus.ListenerKey;
import io.eventbus.TopicNotRegisteredException;
import io.eventbus.spi.MetricsExporter;
import io.eventbus.store.EventStore;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConcurrentHashMap}-based observation tracker.
 *
 * <p>Each topic owns a map from event id to its {@link Observation}. Every read and write of
 * an observation runs inside a single {@code compute}/{@code computeIfPresent} call, so
 * removing a listener and testing the pending set for emptiness is one atomic step per key,
 * and {@link #observation} hands out copies taken under the same lock. The store write on
 * {@link #init} and the store delete for a drained event happen inside that same step: an
 * event is stored exactly while it has a pending set, exactly one reporter collects it, and
 * later reports find no entry.
 *
 * <p>The pending-event count is pushed to {@link MetricsExporter#recordPendingEvents} after
 * every change to it.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultObservationTracker implements ObservationTracker {
  private static final Logger logger = Logger.getLogger(DefaultObservationTracker.class.getName());

  private final Map<String, ConcurrentMap<String, Observation>> partitions = new ConcurrentHashMap<>();
  private final EventStore eventStore;
  private final MetricsExporter metrics;

  public DefaultObservationTracker(EventStore eventStore) {
    this(eventStore, MetricsExporter.NOOP);
  }

  public DefaultObservationTracker(EventStore eventStore, MetricsExporter metrics) {
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  @Override
  public void createPartition(String topic) {
    Objects.requireNonNull(topic, "topic");
    partitions.computeIfAbsent(topic, ignored -> new ConcurrentHashMap<>());
  }

  @Override
  public void dropPartition(String topic) {
    Objects.requireNonNull(topic, "topic");
    ConcurrentMap<String, Observation> removed = partitions.remove(topic);
    if (removed != null && !removed.isEmpty()) {
      logger.log(Level.INFO, "Discarded {0} pending observations for topic {1}",
          new Object[]{removed.size(), topic});
      publishPendingCount();
    }
  }

  @Override
  public InitResult init(Event event, List<ListenerKey> listeners) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(listeners, "listeners");
    String topic = event.topic();
    ConcurrentMap<String, Observation> partition = partitions.get(topic);
    if (partition == null) {
      throw new TopicNotRegisteredException(topic);
    }
    InitResult[] result = new InitResult[1];
    partition.compute(event.id(), (key, existing) -> {
      if (existing != null) {
        eventStore.put(event);
        result[0] = InitResult.ALREADY_TRACKED;
        return existing;
      }
      if (listeners.isEmpty()) {
        result[0] = InitResult.DRAINED;
        return null;
      }
      eventStore.put(event);
      result[0] = InitResult.TRACKING;
      return Observation.start(listeners, Instant.now());
    });
    if (result[0] == InitResult.TRACKING) {
      publishPendingCount();
    }
    return result[0];
  }

  @Override
  public boolean report(ListenerKey listener, String topic, String id, Disposition disposition) {
    Objects.requireNonNull(listener, "listener");
    Objects.requireNonNull(disposition, "disposition");
    ConcurrentMap<String, Observation> partition = partitions.get(topic);
    if (partition == null) {
      logger.log(Level.FINE, "Ignoring {0} report for unregistered topic {1}",
          new Object[]{disposition, topic});
      return false;
    }
    boolean[] recorded = new boolean[1];
    boolean[] drained = new boolean[1];
    partition.computeIfPresent(id, (key, observation) -> {
      if (!observation.isPending(listener)) {
        return observation;
      }
      recorded[0] = true;
      observation.report(listener, disposition);
      if (observation.pending().isEmpty()) {
        eventStore.delete(topic, id);
        drained[0] = true;
        return null;
      }
      return observation;
    });

    if (recorded[0]) {
      if (disposition == Disposition.COMPLETED) {
        metrics.incrementCompleted();
      } else {
        metrics.incrementSkipped();
      }
    }
    if (drained[0]) {
      metrics.incrementCollected();
      publishPendingCount();
      logger.log(Level.FINE, "Collected event topic={0}, id={1}", new Object[]{topic, id});
    }
    return drained[0];
  }

  @Override
  public Optional<Observation> observation(String topic, String id) {
    ConcurrentMap<String, Observation> partition = partitions.get(topic);
    if (partition == null) {
      return Optional.empty();
    }
    Observation[] snapshot = new Observation[1];
    partition.computeIfPresent(id, (key, observation) -> {
      snapshot[0] = observation.snapshot();
      return observation;
    });
    return Optional.ofNullable(snapshot[0]);
  }

  @Override
  public int pendingCount() {
    int total = 0;
    for (ConcurrentMap<String, Observation> partition : partitions.values()) {
      total += partition.size();
    }
    return total;
  }

  @Override
  public int evictOlderThan(Instant cutoff) {
    Objects.requireNonNull(cutoff, "cutoff");
    int evicted = 0;
    for (Map.Entry<String, ConcurrentMap<String, Observation>> entry : partitions.entrySet()) {
      String topic = entry.getKey();
      ConcurrentMap<String, Observation> partition = entry.getValue();
      for (String id : partition.keySet()) {
        Observation[] stale = new Observation[1];
        partition.computeIfPresent(id, (key, observation) -> {
          if (!observation.createdAt().isBefore(cutoff)) {
            return observation;
          }
          eventStore.delete(topic, id);
          stale[0] = observation;
          return null;
        });
        if (stale[0] != null) {
          evicted++;
          logger.log(Level.WARNING, "Evicted event topic={0}, id={1} created at {2}; "
              + "listeners never reported: {3}",
              new Object[]{topic, id, stale[0].createdAt(), stale[0].pending()});
        }
      }
    }
    if (evicted > 0) {
      publishPendingCount();
    }
    return evicted;
  }

  private void publishPendingCount() {
    metrics.recordPendingEvents(pendingCount());
  }
}
