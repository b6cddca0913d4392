package io.eventbus.observation;

import io.eventbus.Disposition;
import io.eventbus.ListenerKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Disposition state of one event.
 *
 * <p>{@code pending} holds the listeners that matched the event's topic at notify time and
 * have not reported yet. {@code completers} and {@code skippers} record, in report order,
 * the listeners that already reported.
 *
 * <p>The tracker updates its own instances in place, under the per-key lock of its map, so a
 * report costs O(1) whatever the fan-out. Instances handed to callers are detached copies
 * and never change.
 */
public final class Observation {
  private final Set<ListenerKey> pending;
  private final List<ListenerKey> completers;
  private final List<ListenerKey> skippers;
  private final Instant createdAt;

  private Observation(Set<ListenerKey> pending, List<ListenerKey> completers,
      List<ListenerKey> skippers, Instant createdAt) {
    this.pending = pending;
    this.completers = completers;
    this.skippers = skippers;
    this.createdAt = createdAt;
  }

  static Observation start(Collection<ListenerKey> listeners, Instant createdAt) {
    return new Observation(new LinkedHashSet<>(listeners), new ArrayList<>(), new ArrayList<>(),
        Objects.requireNonNull(createdAt, "createdAt"));
  }

  /**
   * Moves {@code listener} from pending to the list matching {@code disposition}. The caller
   * must hold the key's lock and check {@link #isPending(ListenerKey)} first.
   */
  void report(ListenerKey listener, Disposition disposition) {
    pending.remove(listener);
    if (disposition == Disposition.COMPLETED) {
      completers.add(listener);
    } else {
      skippers.add(listener);
    }
  }

  /** Returns a detached, unmodifiable copy. The caller must hold the key's lock. */
  Observation snapshot() {
    return new Observation(
        Collections.unmodifiableSet(new LinkedHashSet<>(pending)),
        List.copyOf(completers), List.copyOf(skippers), createdAt);
  }

  public boolean isPending(ListenerKey listener) {
    return pending.contains(listener);
  }

  public Set<ListenerKey> pending() {
    return Collections.unmodifiableSet(pending);
  }

  public List<ListenerKey> completers() {
    return Collections.unmodifiableList(completers);
  }

  public List<ListenerKey> skippers() {
    return Collections.unmodifiableList(skippers);
  }

  public Instant createdAt() {
    return createdAt;
  }

  @Override
  public String toString() {
    return "Observation{pending=" + pending + ", completers=" + completers
        + ", skippers=" + skippers + ", createdAt=" + createdAt + '}';
  }
}
