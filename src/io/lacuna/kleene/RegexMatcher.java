package io.lacuna.kleene;

import io.lacuna.bifurcan.IList;

/**
 * @param <S> the symbols of the alphabet
 * @param <R> the regular expression type
 */
@FunctionalInterface
public interface RegexMatcher<S, R> {

  /**
   * @return true if {@code regex} matches the whole of {@code input}
   */
  boolean matches(R regex, IList<S> input);
}
