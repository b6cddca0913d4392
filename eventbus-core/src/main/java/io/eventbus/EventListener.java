package io.eventbus;

/**
 * Listener that receives events published on topics matching its subscription patterns.
 *
 * <h2>Execution Model</h2>
 * <p>{@link #process(EventShadow)} is invoked <b>asynchronously</b> on a dispatcher worker
 * thread, once per matching event. The bus does not wait for it and never retries it.
 *
 * <h2>Disposition</h2>
 * <p>After handling the event (or deciding to ignore it) the listener must call exactly one of
 * {@link EventBus#markAsCompleted(EventShadow)} or {@link EventBus#markAsSkipped(EventShadow)}.
 * The event stays fetchable until every interested listener has reported. A listener that
 * never reports keeps the event alive until the
 * {@linkplain io.eventbus.sweep.ObservationSweeper sweeper} evicts it.
 *
 * <h2>Errors</h2>
 * <p>Exceptions thrown from {@code process} are logged by the dispatcher and otherwise
 * ignored. They do not count as a disposition.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventListener inventory = shadow -> {
 *   Event event = bus.fetch(shadow.topic(), shadow.id());
 *   reserve(event.data(Order.class));
 *   bus.markAsCompleted(shadow);
 * };
 * bus.subscribe(inventory, "orders");
 * }</pre>
 *
 * @see ListenerKey
 */
@FunctionalInterface
public interface EventListener {

  /**
   * Receives an event.
   *
   * @param shadow handle naming this listener and the event's topic and id
   * @throws Exception if processing fails; logged by the dispatcher, not retried
   */
  void process(EventShadow shadow) throws Exception;
}
