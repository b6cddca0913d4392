package io.eventbus;

/**
 * Thrown when an event is published or stored under a topic that is not registered.
 */
public class TopicNotRegisteredException extends EventBusException {
  private final String topic;

  public TopicNotRegisteredException(String topic) {
    super("Topic not registered: " + topic);
    this.topic = topic;
  }

  public String topic() {
    return topic;
  }
}
