package io.eventbus;

import java.util.Objects;

/**
 * Identity of a subscriber.
 *
 * <p>A key is either a bare {@link EventListener} reference, or a listener paired with a
 * configuration object. The same listener instance may be subscribed several times with
 * different configurations; each pairing is a distinct subscriber. Configuration takes part
 * in equality through {@link Object#equals(Object)}, so value types such as maps and records
 * compare structurally.
 */
public final class ListenerKey {
  private final EventListener listener;
  private final Object config;

  private ListenerKey(EventListener listener, Object config) {
    this.listener = Objects.requireNonNull(listener, "listener");
    this.config = config;
  }

  /**
   * Creates a key for a listener without configuration.
   */
  public static ListenerKey of(EventListener listener) {
    return new ListenerKey(listener, null);
  }

  /**
   * Creates a key for a listener with configuration.
   *
   * @throws NullPointerException if {@code listener} or {@code config} is null
   */
  public static ListenerKey of(EventListener listener, Object config) {
    return new ListenerKey(listener, Objects.requireNonNull(config, "config"));
  }

  public EventListener listener() {
    return listener;
  }

  /**
   * Returns the configuration, or {@code null} for a bare listener.
   */
  public Object config() {
    return config;
  }

  public boolean isConfigured() {
    return config != null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ListenerKey other)) return false;
    return listener.equals(other.listener) && Objects.equals(config, other.config);
  }

  @Override
  public int hashCode() {
    return Objects.hash(listener, config);
  }

  @Override
  public String toString() {
    String name = listener.getClass().getName();
    return config == null ? name : "{" + name + ", " + config + "}";
  }
}
