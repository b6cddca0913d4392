/**
 * Event publication and asynchronous fan-out to listeners.
 *
 * <p>{@link io.eventbus.dispatch.NotificationDispatcher} has the observation tracker store
 * each published event and start its observation, then hands one
 * {@link io.eventbus.EventShadow} per matching listener to a worker pool that grows rather
 * than queue behind busy listeners. {@link io.eventbus.dispatch.EventInterceptor}s wrap each
 * delivery.
 *
 * @see io.eventbus.dispatch.NotificationDispatcher
 * @see io.eventbus.dispatch.EventInterceptor
 */
package io.eventbus.dispatch;
