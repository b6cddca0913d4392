package io.eventbus.observation;

import io.eventbus.Disposition;
import io.eventbus.Event;
import io.eventbus.ListenerKey;
import io.eventbus.TopicNotRegisteredException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Tracks, per {@code (topic, id)}, which listeners still owe a disposition and collects the
 * event from the {@link io.eventbus.store.EventStore} as soon as none do.
 *
 * <p>The tracker is the only component that writes or deletes individual events in the
 * store, so an event is retained exactly while it has a pending set.
 *
 * @see DefaultObservationTracker
 */
public interface ObservationTracker {

  /** Outcome of {@link #init}. */
  enum InitResult {
    /** The event was stored and a pending set created; listeners should be notified. */
    TRACKING,
    /** No listener matched; the event was not retained. */
    DRAINED,
    /** The event is already tracked; its payload was replaced and its pending set left untouched. */
    ALREADY_TRACKED
  }

  void createPartition(String topic);

  /**
   * Drops every observation for the topic. Reports arriving afterwards are no-ops.
   */
  void dropPartition(String topic);

  /**
   * Stores an event and starts observing it, in one atomic step per {@code (topic, id)}.
   *
   * @param event     the event to publish
   * @param listeners listeners that matched the topic at notify time
   * @return what the caller should do next
   * @throws TopicNotRegisteredException if the topic has no partition
   */
  InitResult init(Event event, List<ListenerKey> listeners);

  /**
   * Records a listener's disposition for an event.
   *
   * <p>Safe to call for unknown or already collected events, for a listener that already
   * reported, and concurrently from several listeners of the same event.
   *
   * @return {@code true} if this call released the last pending listener and collected the event
   */
  boolean report(ListenerKey listener, String topic, String id, Disposition disposition);

  /**
   * Returns a detached copy of an event's observation state, or empty if it is not tracked.
   */
  Optional<Observation> observation(String topic, String id);

  /**
   * Returns the number of events awaiting at least one disposition, across all topics.
   */
  int pendingCount();

  /**
   * Force-collects every observation created before {@code cutoff}, regardless of pending
   * listeners.
   *
   * @return number of evicted observations
   */
  int evictOlderThan(Instant cutoff);
}
