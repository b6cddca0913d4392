/**
 * In-process event bus with observation-driven event collection.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * EventBus bus = EventBus.builder().topics("orders").build();
 *
 * bus.subscribe(shadow -> {
 *   Order order = bus.fetch(shadow.topic(), shadow.id()).data(Order.class);
 *   inventory.reserve(order);
 *   bus.markAsCompleted(shadow);
 * }, "^orders$");
 *
 * bus.notify(Event.of("orders", "1", order));
 * }</pre>
 *
 * <h2>Lifecycle of an event</h2>
 * <ol>
 *   <li>{@link io.eventbus.EventBus#notify} stores the event and records which listeners
 *       matched its topic.</li>
 *   <li>Each listener receives an {@link io.eventbus.EventShadow} asynchronously.</li>
 *   <li>Each listener reports {@link io.eventbus.EventBus#markAsCompleted} or
 *       {@link io.eventbus.EventBus#markAsSkipped}.</li>
 *   <li>When the last one reports, the event is deleted from the store. An event with no
 *       matching listener is never retained.</li>
 * </ol>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>An event is fetchable until every listener that matched at notify time reported.</li>
 *   <li>Reports are idempotent and safe to race; exactly one report collects the event.</li>
 *   <li>No retries, no ordering across listeners, no persistence.</li>
 * </ul>
 *
 * @see io.eventbus.EventBus
 * @see io.eventbus.EventListener
 */
package io.eventbus;
