/**
 * Pending-listener accounting and observation-driven collection of events.
 *
 * <p>An event stays in the {@link io.eventbus.store.EventStore} while its
 * {@link io.eventbus.observation.Observation} has pending listeners. The
 * {@link io.eventbus.observation.ObservationTracker} writes it in the same atomic step that
 * creates the pending set, and deletes it in the same atomic step that removes the last one.
 *
 * @see io.eventbus.observation.ObservationTracker
 * @see io.eventbus.observation.DefaultObservationTracker
 */
package io.eventbus.observation;
