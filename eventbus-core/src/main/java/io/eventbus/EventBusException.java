package io.eventbus;

/**
 * Base class for errors raised by the event bus.
 */
public class EventBusException extends RuntimeException {

  public EventBusException(String message) {
    super(message);
  }

  public EventBusException(String message, Throwable cause) {
    super(message, cause);
  }
}
