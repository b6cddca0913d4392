package io.eventbus.micrometer;

import io.eventbus.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventbus.events.notified}: events accepted by {@code notify}</li>
 *   <li>{@code eventbus.events.drained.on.arrival}: events with no matching listener</li>
 *   <li>{@code eventbus.events.collected}: events removed after their last report</li>
 *   <li>{@code eventbus.delivery.success}: listener calls that returned normally</li>
 *   <li>{@code eventbus.delivery.failure}: listener calls that threw or were rejected</li>
 *   <li>{@code eventbus.reports.completed} / {@code eventbus.reports.skipped}</li>
 *   <li>{@code eventbus.observations.swept}: observations force-evicted by the sweeper</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventbus.events.pending}: events awaiting at least one disposition</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code eventbus.delivery.listener.duration.ms}: listener execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter notified;
  private final Counter drainedOnArrival;
  private final Counter collected;
  private final Counter delivered;
  private final Counter deliveryFailure;
  private final Counter completed;
  private final Counter skipped;
  private final Counter swept;
  private final Gauge pendingGauge;
  private final DistributionSummary listenerDuration;

  private final AtomicInteger pending = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventbus"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventbus");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.eventbus"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.notified = Counter.builder(namePrefix + ".events.notified")
        .description("Events accepted by notify")
        .register(registry);
    this.drainedOnArrival = Counter.builder(namePrefix + ".events.drained.on.arrival")
        .description("Events collected immediately because no listener matched")
        .register(registry);
    this.collected = Counter.builder(namePrefix + ".events.collected")
        .description("Events collected after their last listener reported")
        .register(registry);
    this.delivered = Counter.builder(namePrefix + ".delivery.success")
        .description("Listener deliveries that returned normally")
        .register(registry);
    this.deliveryFailure = Counter.builder(namePrefix + ".delivery.failure")
        .description("Listener deliveries that threw or were rejected")
        .register(registry);
    this.completed = Counter.builder(namePrefix + ".reports.completed")
        .description("Dispositions reported as completed")
        .register(registry);
    this.skipped = Counter.builder(namePrefix + ".reports.skipped")
        .description("Dispositions reported as skipped")
        .register(registry);
    this.swept = Counter.builder(namePrefix + ".observations.swept")
        .description("Observations force-evicted by the sweeper")
        .register(registry);

    this.pendingGauge = Gauge.builder(namePrefix + ".events.pending", pending, AtomicInteger::get)
        .register(registry);

    this.listenerDuration = DistributionSummary.builder(namePrefix + ".delivery.listener.duration.ms")
        .description("Listener execution time in milliseconds")
        .register(registry);
  }

  @Override
  public void incrementNotified() {
    if (closed) return;
    notified.increment();
  }

  @Override
  public void incrementDrainedOnArrival() {
    if (closed) return;
    drainedOnArrival.increment();
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementCompleted() {
    if (closed) return;
    completed.increment();
  }

  @Override
  public void incrementSkipped() {
    if (closed) return;
    skipped.increment();
  }

  @Override
  public void incrementCollected() {
    if (closed) return;
    collected.increment();
  }

  @Override
  public void recordSwept(int count) {
    if (closed || count <= 0) return;
    swept.increment(count);
  }

  @Override
  public void recordPendingEvents(int pending) {
    if (closed) return;
    this.pending.set(pending);
  }

  @Override
  public void recordListenerDurationMs(long durationMs) {
    if (closed) return;
    listenerDuration.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link io.eventbus.EventBus#close()} calls this when the exporter was
   * handed to its builder.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(notified, drainedOnArrival, collected,
        delivered, deliveryFailure, completed, skipped, swept,
        pendingGauge, listenerDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
