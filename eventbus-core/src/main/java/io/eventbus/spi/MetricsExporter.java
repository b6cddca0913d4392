package io.eventbus.spi;

/**
 * Observability hook for exporting event bus counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events accepted by {@code notify}.
     */
    void incrementNotified();

    /**
     * Increments the count of events collected on arrival because no listener matched.
     */
    void incrementDrainedOnArrival();

    /**
     * Increments the count of listener deliveries that returned normally.
     */
    void incrementDelivered();

    /**
     * Increments the count of listener deliveries that threw or were rejected by the pool.
     */
    void incrementDeliveryFailure();

    /**
     * Increments the count of dispositions reported as completed.
     */
    void incrementCompleted();

    /**
     * Increments the count of dispositions reported as skipped.
     */
    void incrementSkipped();

    /**
     * Increments the count of events collected after their last listener reported.
     */
    void incrementCollected();

    /**
     * Records the number of observations force-evicted by one sweep cycle.
     *
     * @param count evicted observations (always non-negative)
     */
    default void recordSwept(int count) {
    }

    /**
     * Records the number of events currently awaiting at least one disposition.
     *
     * @param pending number of live observations
     */
    void recordPendingEvents(int pending);

    /**
     * Records the time spent executing a listener's {@code process} call.
     *
     * @param durationMs listener execution time in milliseconds (always non-negative)
     */
    default void recordListenerDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementNotified() {
        }

        @Override
        public void incrementDrainedOnArrival() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementDeliveryFailure() {
        }

        @Override
        public void incrementCompleted() {
        }

        @Override
        public void incrementSkipped() {
        }

        @Override
        public void incrementCollected() {
        }

        @Override
        public void recordPendingEvents(int pending) {
        }
    }
}
