package io.eventbus;

/**
 * Terminal report a listener makes for an event it received.
 *
 * <p>Both values release the listener's hold on the event in the same way; the distinction
 * is only visible through {@link io.eventbus.observation.Observation} and metrics.
 */
public enum Disposition {
  /** The listener handled the event. */
  COMPLETED,
  /** The listener decided to ignore the event. */
  SKIPPED
}
