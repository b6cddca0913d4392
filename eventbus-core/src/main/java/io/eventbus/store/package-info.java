/**
 * Per-topic event payload storage.
 *
 * @see io.eventbus.store.EventStore
 * @see io.eventbus.store.InMemoryEventStore
 */
package io.eventbus.store;
