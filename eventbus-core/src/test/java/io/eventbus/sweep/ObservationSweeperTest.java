package io.eventbus.sweep;

import io.eventbus.Event;
import io.eventbus.EventListener;
import io.eventbus.ListenerKey;
import io.eventbus.observation.DefaultObservationTracker;
import io.eventbus.spi.MetricsExporter;
import io.eventbus.store.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ObservationSweeperTest {

  private InMemoryEventStore store;
  private DefaultObservationTracker tracker;
  private final EventListener straggler = shadow -> {};

  @BeforeEach
  void setUp() {
    store = new InMemoryEventStore();
    tracker = new DefaultObservationTracker(store);
    store.createPartition("orders");
    tracker.createPartition("orders");
  }

  private void publish(String id) {
    tracker.init(Event.of("orders", id, "x"), List.of(ListenerKey.of(straggler)));
  }

  @Test
  void builderRejectsMissingTracker() {
    assertThrows(NullPointerException.class, () -> ObservationSweeper.builder().build());
  }

  @Test
  void builderRejectsNonPositiveMaxAge() {
    assertThrows(IllegalArgumentException.class, () ->
        ObservationSweeper.builder().tracker(tracker).maxAge(Duration.ZERO).build());
  }

  @Test
  void builderRejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class, () ->
        ObservationSweeper.builder().tracker(tracker).intervalSeconds(0).build());
  }

  @Test
  void defaultMaxAgeIsOneHour() {
    ObservationSweeper sweeper = ObservationSweeper.builder().tracker(tracker).build();

    assertEquals(Duration.ofHours(1), sweeper.maxAge());
  }

  @Test
  void runOnceEvictsStaleObservations() throws InterruptedException {
    SweepRecorder metrics = new SweepRecorder();
    publish("1");
    publish("2");
    Thread.sleep(30);

    try (ObservationSweeper sweeper = ObservationSweeper.builder()
        .tracker(tracker)
        .metrics(metrics)
        .maxAge(Duration.ofMillis(10))
        .build()) {
      assertEquals(2, sweeper.runOnce());
    }

    assertEquals(2, metrics.swept.get());
    assertEquals(0, metrics.lastPending.get());
    assertEquals(0, tracker.pendingCount());
    assertTrue(store.find("orders", "1").isEmpty());
  }

  @Test
  void runOnceKeepsYoungObservations() {
    publish("1");

    try (ObservationSweeper sweeper = ObservationSweeper.builder().tracker(tracker).build()) {
      assertEquals(0, sweeper.runOnce());
    }

    assertTrue(store.find("orders", "1").isPresent());
  }

  @Test
  void runOnceAfterCloseIsNoOp() throws InterruptedException {
    publish("1");
    Thread.sleep(30);
    ObservationSweeper sweeper = ObservationSweeper.builder()
        .tracker(tracker)
        .maxAge(Duration.ofMillis(10))
        .build();
    sweeper.close();

    assertEquals(0, sweeper.runOnce());
    assertEquals(1, tracker.pendingCount());
  }

  @Test
  void startAfterCloseThrows() {
    ObservationSweeper sweeper = ObservationSweeper.builder().tracker(tracker).build();
    sweeper.close();

    assertThrows(IllegalStateException.class, sweeper::start);
  }

  @Test
  void startIsIdempotent() {
    try (ObservationSweeper sweeper = ObservationSweeper.builder().tracker(tracker).build()) {
      assertDoesNotThrow(() -> {
        sweeper.start();
        sweeper.start();
      });
    }
  }

  private static final class SweepRecorder implements MetricsExporter {
    final AtomicInteger swept = new AtomicInteger();
    final AtomicInteger lastPending = new AtomicInteger(-1);

    @Override public void incrementNotified() {}
    @Override public void incrementDrainedOnArrival() {}
    @Override public void incrementDelivered() {}
    @Override public void incrementDeliveryFailure() {}
    @Override public void incrementCompleted() {}
    @Override public void incrementSkipped() {}
    @Override public void incrementCollected() {}

    @Override
    public void recordPendingEvents(int pending) {
      lastPending.set(pending);
    }

    @Override
    public void recordSwept(int count) {
      swept.addAndGet(count);
    }
  }
}
