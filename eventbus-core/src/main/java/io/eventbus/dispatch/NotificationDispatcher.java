package io.eventbus.dispatch;

import io.eventbus.Event;
import io.eventbus.EventShadow;
import io.eventbus.ListenerKey;
import io.eventbus.TopicNotRegisteredException;
import io.eventbus.observation.ObservationTracker;
import io.eventbus.spi.MetricsExporter;
import io.eventbus.subscription.SubscriptionManager;
import io.eventbus.topic.TopicRegistry;
import io.eventbus.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes events: hands them to the {@link ObservationTracker}, which stores them and starts
 * their observation, and fans them out to the listeners whose patterns match the event's topic.
 *
 * <p>{@link #notify(Event)} runs through these steps on the caller's thread:
 * <ol>
 *   <li>reject the event if its topic is not registered;</li>
 *   <li>snapshot the matching listeners;</li>
 *   <li>store the event and initialize its pending set in one atomic tracker step. When no
 *       listener matched the event is not retained; when the id is already tracked only the
 *       payload is replaced;</li>
 *   <li>submit one independent delivery task per listener to the worker pool and return.</li>
 * </ol>
 *
 * <p>Deliveries never block the producer or one another: when every worker is busy the pool
 * starts another thread instead of queueing, so listeners that hang cannot hold back their
 * siblings. Idle threads beyond {@code workerCount} exit after a minute. A listener that
 * throws, or a delivery the pool rejects, is logged and counted; nothing is retried and no
 * disposition is recorded on the listener's behalf.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see NotificationDispatcher.Builder
 * @see EventInterceptor
 */
public final class NotificationDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(NotificationDispatcher.class.getName());

  private final TopicRegistry topicRegistry;
  private final SubscriptionManager subscriptionManager;
  private final ObservationTracker observationTracker;
  private final MetricsExporter metrics;
  private final List<EventInterceptor> interceptors;
  private final long drainTimeoutMs;
  private final ExecutorService workers;
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private NotificationDispatcher(Builder builder) {
    this.topicRegistry = Objects.requireNonNull(builder.topicRegistry, "topicRegistry");
    this.subscriptionManager = Objects.requireNonNull(builder.subscriptionManager, "subscriptionManager");
    this.observationTracker = Objects.requireNonNull(builder.observationTracker, "observationTracker");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));

    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.workers = new ThreadPoolExecutor(builder.workerCount, Integer.MAX_VALUE,
        60L, TimeUnit.SECONDS, new SynchronousQueue<>(),
        new DaemonThreadFactory("eventbus-dispatcher-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Publishes an event. Returns once the event is stored and its pending set initialized;
   * listener deliveries happen asynchronously.
   *
   * @param event the event to publish
   * @throws TopicNotRegisteredException if the event's topic is not registered, including
   *     when it is unregistered while this call is in progress
   * @throws IllegalStateException if the dispatcher has been closed
   */
  public void notify(Event event) {
    Objects.requireNonNull(event, "event");
    if (!accepting.get()) {
      throw new IllegalStateException("NotificationDispatcher has been closed");
    }
    String topic = event.topic();
    if (!topicRegistry.exists(topic)) {
      throw new TopicNotRegisteredException(topic);
    }

    List<ListenerKey> listeners = subscriptionManager.subscribers(topic);
    ObservationTracker.InitResult result = observationTracker.init(event, listeners);
    metrics.incrementNotified();
    switch (result) {
      case DRAINED:
        metrics.incrementDrainedOnArrival();
        return;
      case ALREADY_TRACKED:
        logger.log(Level.FINE, "Event topic={0}, id={1} already tracked; payload replaced",
            new Object[]{topic, event.id()});
        return;
      default:
        break;
    }

    for (ListenerKey listener : listeners) {
      EventShadow shadow = new EventShadow(listener, topic, event.id());
      try {
        workers.execute(() -> deliver(shadow));
      } catch (RejectedExecutionException e) {
        metrics.incrementDeliveryFailure();
        logger.log(Level.WARNING, "Delivery rejected for " + listener
            + " on topic=" + topic + ", id=" + event.id(), e);
      }
    }
  }

  private void deliver(EventShadow shadow) {
    int completedBefore = 0;
    long start = System.nanoTime();
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeDispatch(shadow);
        completedBefore = i + 1;
      }
      shadow.listenerKey().listener().process(shadow);
      metrics.recordListenerDurationMs(
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
      metrics.incrementDelivered();
      runAfterDispatch(shadow, null, completedBefore);
    } catch (Exception e) {
      metrics.incrementDeliveryFailure();
      logger.log(Level.WARNING, "Listener " + shadow.listenerKey() + " failed on topic="
          + shadow.topic() + ", id=" + shadow.id(), e);
      runAfterDispatch(shadow, e, completedBefore);
    }
  }

  private void runAfterDispatch(EventShadow shadow, Exception error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(shadow, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
      }
    }
  }

  /**
   * Initiates graceful shutdown: stops accepting new events, lets already submitted
   * deliveries run within the configured drain timeout, then interrupts worker threads.
   */
  @Override
  public void close() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        List<Runnable> dropped = workers.shutdownNow();
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. "
            + "Undelivered: " + dropped.size());
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link NotificationDispatcher}. */
  public static final class Builder {
    private TopicRegistry topicRegistry;
    private SubscriptionManager subscriptionManager;
    private ObservationTracker observationTracker;
    private int workerCount = 4;
    private MetricsExporter metrics;
    private final List<EventInterceptor> interceptors = new ArrayList<>();
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the registry used to validate event topics.
     *
     * <p><b>Required.</b>
     *
     * @param topicRegistry the topic registry
     * @return this builder
     */
    public Builder topicRegistry(TopicRegistry topicRegistry) {
      this.topicRegistry = topicRegistry;
      return this;
    }

    /**
     * Sets the subscription manager queried for the listeners of each topic.
     *
     * <p><b>Required.</b>
     *
     * @param subscriptionManager the subscription manager
     * @return this builder
     */
    public Builder subscriptionManager(SubscriptionManager subscriptionManager) {
      this.subscriptionManager = subscriptionManager;
      return this;
    }

    /**
     * Sets the tracker that stores events and initializes their pending sets.
     *
     * <p><b>Required.</b>
     *
     * @param observationTracker the observation tracker
     * @return this builder
     */
    public Builder observationTracker(ObservationTracker observationTracker) {
      this.observationTracker = observationTracker;
      return this;
    }

    /**
     * Sets the number of delivery threads kept alive while idle. Bursts beyond it get extra
     * threads, so a delivery never waits for a busy worker.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1.
     *
     * @param workerCount number of resident delivery threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
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
     * Appends a single delivery interceptor.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public Builder interceptor(EventInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Appends several delivery interceptors, preserving their order.
     *
     * @param interceptors the interceptors to add
     * @return this builder
     */
    public Builder interceptors(List<EventInterceptor> interceptors) {
      Objects.requireNonNull(interceptors, "interceptors");
      for (EventInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
      return this;
    }

    /**
     * Sets the maximum time in milliseconds to wait for submitted deliveries during shutdown.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the dispatcher and starts its worker pool.
     *
     * @return a new {@link NotificationDispatcher}
     * @throws NullPointerException if a required collaborator is missing
     * @throws IllegalArgumentException if {@code workerCount < 1} or {@code drainTimeoutMs < 0}
     */
    public NotificationDispatcher build() {
      return new NotificationDispatcher(this);
    }
  }
}
