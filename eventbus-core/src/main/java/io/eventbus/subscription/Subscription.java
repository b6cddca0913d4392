package io.eventbus.subscription;

import io.eventbus.InvalidPatternException;
import io.eventbus.ListenerKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A listener's subscription: its key, the pattern strings it registered, and their compiled
 * form. Patterns are compiled once, when the subscription is created.
 */
public final class Subscription {
  private final ListenerKey listenerKey;
  private final Set<String> patterns;
  private final List<Pattern> compiled;

  private Subscription(ListenerKey listenerKey, Set<String> patterns, List<Pattern> compiled) {
    this.listenerKey = listenerKey;
    this.patterns = patterns;
    this.compiled = compiled;
  }

  /**
   * Compiles the given patterns into a subscription.
   *
   * @throws InvalidPatternException  if any pattern is not a valid regular expression
   * @throws IllegalArgumentException if {@code patterns} is empty
   */
  static Subscription compile(ListenerKey listenerKey, Collection<String> patterns) {
    Objects.requireNonNull(listenerKey, "listenerKey");
    Set<String> ordered = toPatternSet(patterns);
    List<Pattern> compiled = new ArrayList<>(ordered.size());
    for (String pattern : ordered) {
      try {
        compiled.add(Pattern.compile(pattern));
      } catch (PatternSyntaxException e) {
        throw new InvalidPatternException(pattern, e);
      }
    }
    return new Subscription(listenerKey, Collections.unmodifiableSet(ordered),
        Collections.unmodifiableList(compiled));
  }

  static Set<String> toPatternSet(Collection<String> patterns) {
    Objects.requireNonNull(patterns, "patterns");
    if (patterns.isEmpty()) {
      throw new IllegalArgumentException("patterns cannot be empty");
    }
    Set<String> ordered = new LinkedHashSet<>();
    for (String pattern : patterns) {
      ordered.add(Objects.requireNonNull(pattern, "pattern"));
    }
    return ordered;
  }

  public ListenerKey listenerKey() {
    return listenerKey;
  }

  /**
   * Returns the registered patterns in registration order, without duplicates.
   */
  public Set<String> patterns() {
    return patterns;
  }

  /**
   * Returns {@code true} if any pattern finds a match in the topic name.
   */
  public boolean matches(String topic) {
    for (Pattern pattern : compiled) {
      if (pattern.matcher(topic).find()) {
        return true;
      }
    }
    return false;
  }
}
