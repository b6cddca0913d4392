package io.eventbus;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when a subscription pattern is not a valid regular expression.
 */
public class InvalidPatternException extends EventBusException {
  private final String pattern;

  public InvalidPatternException(String pattern, PatternSyntaxException cause) {
    super("Invalid subscription pattern: " + pattern, cause);
    this.pattern = pattern;
  }

  public String pattern() {
    return pattern;
  }
}
