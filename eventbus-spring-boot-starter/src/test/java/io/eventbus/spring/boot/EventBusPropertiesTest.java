package io.eventbus.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(EventBusProperties.class);
            assertTrue(props.getTopics().isEmpty());
            assertEquals(4, props.getDispatcher().getWorkerCount());
            assertEquals(5000, props.getDispatcher().getDrainTimeoutMs());
            assertFalse(props.getSweeper().isEnabled());
            assertEquals(Duration.ofHours(1), props.getSweeper().getMaxAge());
            assertEquals(60, props.getSweeper().getIntervalSeconds());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("eventbus", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "eventbus.topics=orders,alerts",
                "eventbus.dispatcher.worker-count=8",
                "eventbus.dispatcher.drain-timeout-ms=10000",
                "eventbus.sweeper.enabled=true",
                "eventbus.sweeper.max-age=PT30M",
                "eventbus.sweeper.interval-seconds=15",
                "eventbus.metrics.enabled=false",
                "eventbus.metrics.name-prefix=billing.eventbus"
        ).run(ctx -> {
            var props = ctx.getBean(EventBusProperties.class);
            assertEquals(List.of("orders", "alerts"), props.getTopics());
            assertEquals(8, props.getDispatcher().getWorkerCount());
            assertEquals(10000, props.getDispatcher().getDrainTimeoutMs());
            assertTrue(props.getSweeper().isEnabled());
            assertEquals(Duration.ofMinutes(30), props.getSweeper().getMaxAge());
            assertEquals(15, props.getSweeper().getIntervalSeconds());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("billing.eventbus", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(EventBusProperties.class)
    static class PropsConfig {
    }
}
