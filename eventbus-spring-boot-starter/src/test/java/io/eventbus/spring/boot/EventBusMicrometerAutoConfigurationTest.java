package io.eventbus.spring.boot;

import io.eventbus.Event;
import io.eventbus.EventBus;
import io.eventbus.micrometer.MicrometerMetricsExporter;
import io.eventbus.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class EventBusMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          EventBusMicrometerAutoConfiguration.class,
          EventBusAutoConfiguration.class))
      .withPropertyValues("eventbus.topics=metrics");

  @Test
  void createsExporterWhenRegistryPresent() {
    runner.withUserConfiguration(RegistryConfig.class).run(ctx -> {
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void busReportsThroughExporter() {
    runner.withUserConfiguration(RegistryConfig.class).run(ctx -> {
      ctx.getBean(EventBus.class).notify(Event.of("metrics", "1", 0.5));

      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertEquals(1.0, registry.find("eventbus.events.notified").counter().count());
      assertEquals(1.0, registry.find("eventbus.events.drained.on.arrival").counter().count());
    });
  }

  @Test
  void customNamePrefix() {
    runner.withUserConfiguration(RegistryConfig.class)
        .withPropertyValues("eventbus.metrics.name-prefix=billing.eventbus")
        .run(ctx -> {
          ctx.getBean(EventBus.class).notify(Event.of("metrics", "1", 0.5));

          MeterRegistry registry = ctx.getBean(MeterRegistry.class);
          assertNotNull(registry.find("billing.eventbus.events.notified").counter());
        });
  }

  @Test
  void disabledByProperty() {
    runner.withUserConfiguration(RegistryConfig.class)
        .withPropertyValues("eventbus.metrics.enabled=false")
        .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Test
  void notLoadedWithoutRegistry() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(EventBus.class, ctx.getBean(EventBus.class));
    });
  }

  @Test
  void respectsCustomExporter() {
    runner.withUserConfiguration(RegistryConfig.class, CustomExporterConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
      assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class));
    });
  }

  @Configuration
  static class RegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customExporter() {
      return MetricsExporter.NOOP;
    }
  }
}
