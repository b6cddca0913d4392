package io.eventbus.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the event bus.
 *
 * @see EventBusAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventbus")
public class EventBusProperties {

    /**
     * Topics registered when the bus is created.
     */
    private List<String> topics = new ArrayList<>();

    private final Dispatcher dispatcher = new Dispatcher();
    private final Sweeper sweeper = new Sweeper();
    private final Metrics metrics = new Metrics();

    public List<String> getTopics() {
        return topics;
    }

    public void setTopics(List<String> topics) {
        this.topics = topics;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Sweeper getSweeper() {
        return sweeper;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Dispatcher {
        private int workerCount = 4;
        private long drainTimeoutMs = 5000;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    /**
     * Periodic eviction of observations whose listeners never reported.
     */
    public static class Sweeper {
        private boolean enabled = false;
        private Duration maxAge = Duration.ofHours(1);
        private long intervalSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventbus";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
