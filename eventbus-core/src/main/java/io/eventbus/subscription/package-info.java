/**
 * Pattern-based subscriptions of listeners to topics.
 *
 * @see io.eventbus.subscription.SubscriptionManager
 * @see io.eventbus.subscription.DefaultSubscriptionManager
 */
package io.eventbus.subscription;
