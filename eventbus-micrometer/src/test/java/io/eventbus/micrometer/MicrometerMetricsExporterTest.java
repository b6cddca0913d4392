package io.eventbus.micrometer;

import io.eventbus.Event;
import io.eventbus.EventBus;
import io.eventbus.EventShadow;
import io.eventbus.ListenerKey;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementNotified() {
    exporter.incrementNotified();
    exporter.incrementNotified();
    assertEquals(2.0, counter("eventbus.events.notified").count());
  }

  @Test
  void incrementDrainedOnArrival() {
    exporter.incrementDrainedOnArrival();
    assertEquals(1.0, counter("eventbus.events.drained.on.arrival").count());
  }

  @Test
  void deliveryCounters() {
    exporter.incrementDelivered();
    exporter.incrementDelivered();
    exporter.incrementDeliveryFailure();
    assertEquals(2.0, counter("eventbus.delivery.success").count());
    assertEquals(1.0, counter("eventbus.delivery.failure").count());
  }

  @Test
  void reportCounters() {
    exporter.incrementCompleted();
    exporter.incrementSkipped();
    exporter.incrementSkipped();
    exporter.incrementCollected();
    assertEquals(1.0, counter("eventbus.reports.completed").count());
    assertEquals(2.0, counter("eventbus.reports.skipped").count());
    assertEquals(1.0, counter("eventbus.events.collected").count());
  }

  @Test
  void recordSwept() {
    exporter.recordSwept(3);
    exporter.recordSwept(0);
    assertEquals(3.0, counter("eventbus.observations.swept").count());
  }

  @Test
  void recordPendingEvents() {
    exporter.recordPendingEvents(42);
    assertEquals(42.0, gauge("eventbus.events.pending").value());

    exporter.recordPendingEvents(0);
    assertEquals(0.0, gauge("eventbus.events.pending").value());
  }

  @Test
  void recordListenerDuration() {
    exporter.recordListenerDurationMs(15);
    exporter.recordListenerDurationMs(25);

    DistributionSummary summary = registry.find("eventbus.delivery.listener.duration.ms").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(40.0, summary.totalAmount());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "billing.eventbus");
    custom.incrementNotified();
    custom.recordPendingEvents(10);

    assertEquals(1.0, counter("billing.eventbus.events.notified").count());
    assertEquals(10.0, gauge("billing.eventbus.events.pending").value());
  }

  @Test
  void closeRemovesMeters() {
    exporter.incrementNotified();
    exporter.close();

    assertNull(registry.find("eventbus.events.notified").counter());
    assertNull(registry.find("eventbus.events.pending").gauge());
    assertDoesNotThrow(() -> exporter.incrementNotified());
  }

  @Test
  void wiredIntoEventBus() {
    EventBus bus = EventBus.builder()
        .topics("orders", "metrics")
        .metrics(exporter)
        .build();
    try {
      ListenerKey key = bus.subscribe(shadow -> {}, "orders");
      bus.notify(Event.of("orders", "1", "x"));
      bus.notify(Event.of("metrics", "2", 1));
      bus.markAsCompleted(new EventShadow(key, "orders", "1"));

      assertEquals(2.0, counter("eventbus.events.notified").count());
      assertEquals(1.0, counter("eventbus.events.drained.on.arrival").count());
      assertEquals(1.0, counter("eventbus.reports.completed").count());
      assertEquals(1.0, counter("eventbus.events.collected").count());
    } finally {
      bus.close();
    }
    assertNull(registry.find("eventbus.events.notified").counter());
  }

  @Test
  void pendingGaugeFollowsBusWithoutSweeper() {
    EventBus bus = EventBus.builder()
        .topics("orders")
        .metrics(exporter)
        .build();
    try {
      ListenerKey silent = bus.subscribe(shadow -> {}, "orders");
      bus.notify(Event.of("orders", "1", "x"));
      bus.notify(Event.of("orders", "2", "y"));
      assertEquals(2.0, gauge("eventbus.events.pending").value());

      bus.markAsSkipped(new EventShadow(silent, "orders", "1"));
      assertEquals(1.0, gauge("eventbus.events.pending").value());

      bus.unregisterTopic("orders");
      assertEquals(0.0, gauge("eventbus.events.pending").value());
    } finally {
      bus.close();
    }
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "eventbus."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
