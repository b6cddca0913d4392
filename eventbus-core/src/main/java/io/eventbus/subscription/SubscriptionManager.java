package io.eventbus.subscription;

import io.eventbus.InvalidPatternException;
import io.eventbus.ListenerKey;

import java.util.Collection;
import java.util.List;

/**
 * Maps listener keys to the topic patterns they subscribed with and answers which
 * listeners are interested in a topic.
 *
 * @see DefaultSubscriptionManager
 */
public interface SubscriptionManager {

  /**
   * Subscribes a listener, replacing any previous pattern set it had.
   *
   * @param listenerKey the subscriber
   * @param patterns    regular expressions matched against topic names
   * @throws InvalidPatternException  if any pattern does not compile; the previous
   *                                  subscription, if any, is kept
   * @throws IllegalArgumentException if {@code patterns} is empty
   */
  void subscribe(ListenerKey listenerKey, Collection<String> patterns);

  /**
   * Removes a listener's subscription. No-op if it has none.
   */
  void unsubscribe(ListenerKey listenerKey);

  /**
   * Returns {@code true} iff the listener is subscribed with exactly this set of patterns.
   */
  boolean isSubscribed(ListenerKey listenerKey, Collection<String> patterns);

  /**
   * Returns every subscribed listener in subscription order.
   */
  List<ListenerKey> subscribers();

  /**
   * Returns the listeners with at least one pattern matching {@code topic}.
   */
  List<ListenerKey> subscribers(String topic);
}
