package io.eventbus;

import java.util.Objects;

/**
 * Handle delivered to a listener for one event: the listener's own key plus the
 * {@code (topic, id)} of the event. Listeners echo it back through
 * {@link EventBus#markAsCompleted(EventShadow)} or {@link EventBus#markAsSkipped(EventShadow)}.
 *
 * <p>A shadow does not hold the payload; use {@link EventBus#fetch(String, String)} to read it
 * while the event is still retained.
 */
public record EventShadow(ListenerKey listenerKey, String topic, String id) {

  public EventShadow {
    Objects.requireNonNull(listenerKey, "listenerKey");
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(id, "id");
  }
}
