package io.eventbus.subscription;

import io.eventbus.ListenerKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Copy-on-write subscription manager.
 *
 * <p>Subscriptions live in an immutable map published through a {@code volatile} field.
 * Lookups, which run once per notify, read the current map without locking; subscribe and
 * unsubscribe are serialized and publish a new copy. A notify that races a subscribe sees
 * either the map before or the map after it.
 *
 * <h2>Matching</h2>
 * <p>Each pattern is a {@link java.util.regex.Pattern} searched for anywhere in the topic
 * name ({@link java.util.regex.Matcher#find()}). Use {@code ".*"} to receive every topic
 * and anchors ({@code "^orders$"}) for an exact name.
 *
 * <pre>{@code
 * SubscriptionManager subscriptions = new DefaultSubscriptionManager();
 * subscriptions.subscribe(ListenerKey.of(auditor), List.of(".*"));
 * subscriptions.subscribe(ListenerKey.of(mailer, Map.of("from", "ops")), List.of("^alerts$"));
 * }</pre>
 */
public final class DefaultSubscriptionManager implements SubscriptionManager {
  private static final Logger logger = Logger.getLogger(DefaultSubscriptionManager.class.getName());

  private final Object writeLock = new Object();
  private volatile Map<ListenerKey, Subscription> subscriptions = Collections.emptyMap();

  @Override
  public void subscribe(ListenerKey listenerKey, Collection<String> patterns) {
    Subscription subscription = Subscription.compile(listenerKey, patterns);
    synchronized (writeLock) {
      Map<ListenerKey, Subscription> next = new LinkedHashMap<>(subscriptions);
      next.put(listenerKey, subscription);
      subscriptions = Collections.unmodifiableMap(next);
    }
    logger.log(Level.FINE, "Subscribed {0} to {1}",
        new Object[]{listenerKey, subscription.patterns()});
  }

  @Override
  public void unsubscribe(ListenerKey listenerKey) {
    Objects.requireNonNull(listenerKey, "listenerKey");
    synchronized (writeLock) {
      if (!subscriptions.containsKey(listenerKey)) {
        return;
      }
      Map<ListenerKey, Subscription> next = new LinkedHashMap<>(subscriptions);
      next.remove(listenerKey);
      subscriptions = Collections.unmodifiableMap(next);
    }
    logger.log(Level.FINE, "Unsubscribed {0}", listenerKey);
  }

  @Override
  public boolean isSubscribed(ListenerKey listenerKey, Collection<String> patterns) {
    Objects.requireNonNull(listenerKey, "listenerKey");
    Subscription subscription = subscriptions.get(listenerKey);
    if (subscription == null || patterns == null || patterns.isEmpty()) {
      return false;
    }
    Set<String> expected = Subscription.toPatternSet(patterns);
    return subscription.patterns().equals(expected);
  }

  @Override
  public List<ListenerKey> subscribers() {
    return List.copyOf(subscriptions.keySet());
  }

  @Override
  public List<ListenerKey> subscribers(String topic) {
    Objects.requireNonNull(topic, "topic");
    List<ListenerKey> result = new ArrayList<>();
    for (Subscription subscription : subscriptions.values()) {
      if (subscription.matches(topic)) {
        result.add(subscription.listenerKey());
      }
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Returns the subscription for a listener, or {@code null} if it is not subscribed.
   */
  public Subscription subscription(ListenerKey listenerKey) {
    return subscriptions.get(listenerKey);
  }
}
