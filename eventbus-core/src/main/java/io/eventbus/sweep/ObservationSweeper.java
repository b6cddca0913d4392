package io.eventbus.sweep;

import io.eventbus.observation.ObservationTracker;
import io.eventbus.spi.MetricsExporter;
import io.eventbus.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that force-evicts observations older than a configurable age,
 * together with their events.
 *
 * <p>Listeners that crash or never report keep their events alive indefinitely. The
 * sweeper bounds that growth, at the cost of stragglers losing the ability to fetch the
 * event. Each evicted entry is logged at {@code WARNING} by the tracker.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see ObservationSweeper.Builder
 * @see ObservationTracker#evictOlderThan(Instant)
 */
public final class ObservationSweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ObservationSweeper.class.getName());

  private final ObservationTracker tracker;
  private final MetricsExporter metrics;
  private final Duration maxAge;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private ObservationSweeper(Builder builder) {
    this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.maxAge != null && (builder.maxAge.isZero() || builder.maxAge.isNegative())) {
      throw new IllegalArgumentException("maxAge must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }

    this.maxAge = builder.maxAge != null ? builder.maxAge : Duration.ofHours(1);
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled sweep loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ObservationSweeper has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("eventbus-sweeper-"));
    sweepTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single sweep cycle.
   *
   * <p>May be invoked directly for testing or one-off sweeps.
   *
   * @return number of evicted observations
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      Instant cutoff = Instant.now().minus(maxAge);
      int evicted = tracker.evictOlderThan(cutoff);
      metrics.recordSwept(evicted);
      metrics.recordPendingEvents(tracker.pendingCount());
      if (evicted > 0) {
        logger.log(Level.INFO, "Swept {0} observations older than {1}",
            new Object[]{evicted, cutoff});
      }
      return evicted;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Sweep cycle failed", e);
      return 0;
    }
  }

  public Duration maxAge() {
    return maxAge;
  }

  /** Cancels the sweep schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link ObservationSweeper}. */
  public static final class Builder {
    private ObservationTracker tracker;
    private MetricsExporter metrics;
    private Duration maxAge;
    private long intervalSeconds = 60;

    private Builder() {}

    /**
     * Sets the tracker whose stale observations are evicted.
     *
     * <p><b>Required.</b>
     *
     * @param tracker the observation tracker
     * @return this builder
     */
    public Builder tracker(ObservationTracker tracker) {
      this.tracker = tracker;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the age after which an observation is evicted regardless of pending listeners.
     *
     * <p>Optional. Defaults to {@code 1 hour}. Must be &gt; 0.
     *
     * @param maxAge the maximum observation age
     * @return this builder
     */
    public Builder maxAge(Duration maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    /**
     * Sets the interval in seconds between sweep cycles.
     *
     * <p>Optional. Defaults to {@code 60}. Must be &gt; 0.
     *
     * @param intervalSeconds sweep interval in seconds
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * Builds the sweeper. Call {@link ObservationSweeper#start()} to begin.
     *
     * @return a new {@link ObservationSweeper} instance
     * @throws NullPointerException if {@code tracker} is null
     * @throws IllegalArgumentException if {@code maxAge} is not positive or
     *     {@code intervalSeconds <= 0}
     */
    public ObservationSweeper build() {
      return new ObservationSweeper(this);
    }
  }
}
