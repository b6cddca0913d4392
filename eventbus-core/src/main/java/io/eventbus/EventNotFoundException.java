package io.eventbus;

/**
 * Thrown when fetching an event that was never stored or has already been collected.
 *
 * <p>Callers that poll for an event should expect this once every interested listener
 * has reported a disposition.
 */
public class EventNotFoundException extends EventBusException {
  private final String topic;
  private final String id;

  public EventNotFoundException(String topic, String id) {
    super("Event not found: topic=" + topic + ", id=" + id);
    this.topic = topic;
    this.id = id;
  }

  public String topic() {
    return topic;
  }

  public String id() {
    return id;
  }
}
