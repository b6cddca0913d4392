package io.eventbus;

import io.eventbus.dispatch.EventInterceptor;
import io.eventbus.dispatch.NotificationDispatcher;
import io.eventbus.observation.DefaultObservationTracker;
import io.eventbus.observation.Observation;
import io.eventbus.observation.ObservationTracker;
import io.eventbus.spi.MetricsExporter;
import io.eventbus.store.EventStore;
import io.eventbus.store.InMemoryEventStore;
import io.eventbus.subscription.DefaultSubscriptionManager;
import io.eventbus.subscription.SubscriptionManager;
import io.eventbus.sweep.ObservationSweeper;
import io.eventbus.topic.DefaultTopicRegistry;
import io.eventbus.topic.TopicRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the topic registry, subscription manager, event store,
 * observation tracker, notification dispatcher and optional sweeper into a single
 * {@link AutoCloseable} unit.
 *
 * <p>Every operation forwards to the component that owns it.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EventBus bus = EventBus.builder()
 *     .topics("orders", "alerts")
 *     .workerCount(8)
 *     .sweepMaxAge(Duration.ofMinutes(30))
 *     .build()) {
 *   bus.subscribe(shadow -> {
 *     Event event = bus.fetch(shadow.topic(), shadow.id());
 *     handle(event);
 *     bus.markAsCompleted(shadow);
 *   }, "orders");
 *   bus.notify(Event.of("orders", "1", order));
 * }
 * }</pre>
 *
 * @see NotificationDispatcher
 * @see ObservationTracker
 */
public final class EventBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventBus.class.getName());

  private final TopicRegistry topicRegistry;
  private final SubscriptionManager subscriptionManager;
  private final EventStore eventStore;
  private final ObservationTracker observationTracker;
  private final NotificationDispatcher dispatcher;
  private final ObservationSweeper sweeper;
  private final MetricsExporter metrics;

  private EventBus(TopicRegistry topicRegistry, SubscriptionManager subscriptionManager,
      EventStore eventStore, ObservationTracker observationTracker,
      NotificationDispatcher dispatcher, ObservationSweeper sweeper, MetricsExporter metrics) {
    this.topicRegistry = topicRegistry;
    this.subscriptionManager = subscriptionManager;
    this.eventStore = eventStore;
    this.observationTracker = observationTracker;
    this.dispatcher = dispatcher;
    this.sweeper = sweeper;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Publishing ──────────────────────────────────────────────────

  /**
   * Publishes an event to every listener subscribed to its topic.
   *
   * @throws TopicNotRegisteredException if the event's topic is not registered
   * @see NotificationDispatcher#notify(Event)
   */
  public void notify(Event event) {
    dispatcher.notify(event);
  }

  // ── Topics ──────────────────────────────────────────────────────

  public void registerTopic(String topic) {
    topicRegistry.register(topic);
  }

  /**
   * Unregisters a topic, discarding events still awaiting dispositions.
   */
  public void unregisterTopic(String topic) {
    topicRegistry.unregister(topic);
  }

  public boolean topicExists(String topic) {
    return topicRegistry.exists(topic);
  }

  public Set<String> topics() {
    return topicRegistry.all();
  }

  // ── Subscriptions ───────────────────────────────────────────────

  /**
   * Subscribes a bare listener to the topics matching any of the given patterns.
   *
   * @return the key identifying the subscription
   * @throws InvalidPatternException if a pattern does not compile
   */
  public ListenerKey subscribe(EventListener listener, String... patterns) {
    ListenerKey key = ListenerKey.of(listener);
    subscribe(key, Arrays.asList(patterns));
    return key;
  }

  /**
   * Subscribes a listener key, replacing any patterns it was subscribed with before.
   *
   * @throws InvalidPatternException if a pattern does not compile
   */
  public void subscribe(ListenerKey listenerKey, Collection<String> patterns) {
    subscriptionManager.subscribe(listenerKey, patterns);
  }

  public void unsubscribe(ListenerKey listenerKey) {
    subscriptionManager.unsubscribe(listenerKey);
  }

  public void unsubscribe(EventListener listener) {
    unsubscribe(ListenerKey.of(listener));
  }

  /**
   * Returns {@code true} iff the listener is subscribed with exactly these patterns.
   */
  public boolean isSubscribed(ListenerKey listenerKey, Collection<String> patterns) {
    return subscriptionManager.isSubscribed(listenerKey, patterns);
  }

  public List<ListenerKey> subscribers() {
    return subscriptionManager.subscribers();
  }

  public List<ListenerKey> subscribers(String topic) {
    return subscriptionManager.subscribers(topic);
  }

  // ── Events ──────────────────────────────────────────────────────

  /**
   * Returns a retained event.
   *
   * @throws EventNotFoundException if the event was never published or has been collected
   */
  public Event fetch(String topic, String id) {
    return eventStore.get(topic, id);
  }

  /**
   * Returns the payload of a retained event.
   *
   * @throws EventNotFoundException if the event was never published or has been collected
   */
  public Object fetchData(String topic, String id) {
    return fetch(topic, id).data();
  }

  public Optional<Observation> observation(String topic, String id) {
    return observationTracker.observation(topic, id);
  }

  // ── Dispositions ────────────────────────────────────────────────

  /**
   * Reports that the shadow's listener has processed the event.
   *
   * @return {@code true} if this report collected the event
   */
  public boolean markAsCompleted(EventShadow shadow) {
    return report(shadow, Disposition.COMPLETED);
  }

  /**
   * Reports that the shadow's listener chose to ignore the event.
   *
   * @return {@code true} if this report collected the event
   */
  public boolean markAsSkipped(EventShadow shadow) {
    return report(shadow, Disposition.SKIPPED);
  }

  private boolean report(EventShadow shadow, Disposition disposition) {
    Objects.requireNonNull(shadow, "shadow");
    return observationTracker.report(shadow.listenerKey(), shadow.topic(), shadow.id(), disposition);
  }

  /**
   * Shuts down components in order: sweeper, dispatcher, metrics exporter.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (sweeper != null) {
      try {
        sweeper.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link EventBus}. */
  public static final class Builder {
    private EventStore eventStore;
    private ObservationTracker observationTracker;
    private TopicRegistry topicRegistry;
    private SubscriptionManager subscriptionManager;
    private MetricsExporter metrics;
    private final List<EventInterceptor> interceptors = new ArrayList<>();
    private final List<String> topics = new ArrayList<>();
    private int workerCount = 4;
    private long drainTimeoutMs = 5000;
    private Duration sweepMaxAge;
    private long sweepIntervalSeconds = 60;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the event store.
     *
     * <p>Optional. Defaults to {@link InMemoryEventStore}.
     */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * Sets the observation tracker. A custom tracker must delete from the same store
     * passed to {@link #eventStore(EventStore)}.
     *
     * <p>Optional. Defaults to {@link DefaultObservationTracker}.
     */
    public Builder observationTracker(ObservationTracker observationTracker) {
      this.observationTracker = observationTracker;
      return this;
    }

    /**
     * Sets the topic registry.
     *
     * <p>Optional. Defaults to {@link DefaultTopicRegistry} over the bus's store and tracker.
     */
    public Builder topicRegistry(TopicRegistry topicRegistry) {
      this.topicRegistry = topicRegistry;
      return this;
    }

    /**
     * Sets the subscription manager.
     *
     * <p>Optional. Defaults to {@link DefaultSubscriptionManager}.
     */
    public Builder subscriptionManager(SubscriptionManager subscriptionManager) {
      this.subscriptionManager = subscriptionManager;
      return this;
    }

    /**
     * Sets the metrics exporter. It is closed with the bus when it implements
     * {@link AutoCloseable}.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder interceptor(EventInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Registers topics when the bus is built.
     */
    public Builder topics(String... topics) {
      this.topics.addAll(Arrays.asList(topics));
      return this;
    }

    /**
     * Sets the number of delivery threads kept alive while idle. Defaults to {@code 4}.
     * Busy workers never delay a delivery; extra threads are started instead.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets how long {@link EventBus#close()} waits for submitted deliveries.
     * Defaults to {@code 5000} ms.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Enables the {@link ObservationSweeper} with the given maximum observation age.
     *
     * <p>Optional. The sweeper is disabled when not set.
     */
    public Builder sweepMaxAge(Duration sweepMaxAge) {
      this.sweepMaxAge = sweepMaxAge;
      return this;
    }

    /**
     * Sets the interval between sweeps. Defaults to {@code 60} seconds.
     */
    public Builder sweepIntervalSeconds(long sweepIntervalSeconds) {
      this.sweepIntervalSeconds = sweepIntervalSeconds;
      return this;
    }

    /**
     * Builds the bus, registers the configured topics and starts the sweeper if enabled.
     *
     * @throws IllegalStateException if build() was already called on this builder
     * @throws IllegalArgumentException if a numeric setting is out of range or a topic is empty
     */
    public EventBus build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      MetricsExporter metrics = this.metrics != null ? this.metrics : MetricsExporter.NOOP;
      EventStore store = eventStore != null ? eventStore : new InMemoryEventStore();
      ObservationTracker tracker = observationTracker != null
          ? observationTracker : new DefaultObservationTracker(store, metrics);
      TopicRegistry registry = topicRegistry != null
          ? topicRegistry : new DefaultTopicRegistry(store, tracker);
      SubscriptionManager subscriptions = subscriptionManager != null
          ? subscriptionManager : new DefaultSubscriptionManager();
      // no executor exists yet if a topic is rejected
      for (String topic : topics) {
        registry.register(topic);
      }

      ObservationSweeper sweeper = null;
      if (sweepMaxAge != null) {
        sweeper = ObservationSweeper.builder()
            .tracker(tracker)
            .metrics(metrics)
            .maxAge(sweepMaxAge)
            .intervalSeconds(sweepIntervalSeconds)
            .build();
      }

      NotificationDispatcher dispatcher = NotificationDispatcher.builder()
          .topicRegistry(registry)
          .subscriptionManager(subscriptions)
          .observationTracker(tracker)
          .workerCount(workerCount)
          .drainTimeoutMs(drainTimeoutMs)
          .metrics(metrics)
          .interceptors(interceptors)
          .build();

      if (sweeper != null) {
        sweeper.start();
        logger.log(Level.INFO, "Observation sweeper started with maxAge {0}", sweepMaxAge);
      }
      return new EventBus(registry, subscriptions, store, tracker, dispatcher, sweeper, metrics);
    }
  }
}
