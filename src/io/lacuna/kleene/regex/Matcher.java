package io.lacuna.kleene.regex;

import io.lacuna.bifurcan.IList;

import java.util.IdentityHashMap;

/**
 * Matches expressions against a single input, by computing for each subexpression every span of the input it
 * matches.  Subexpressions which are shared between larger expressions are only evaluated once.
 */
final class Matcher<S> {

  private final IList<S> input;
  private final int length;
  private final IdentityHashMap<Regex<S>, boolean[][]> spans = new IdentityHashMap<>();

  Matcher(IList<S> input) {
    if (input.size() >= Integer.MAX_VALUE) {
      throw new IllegalArgumentException("input too long: " + input.size());
    }
    this.input = input;
    this.length = (int) input.size();
  }

  boolean matches(Regex<S> regex) {
    return spans(regex)[0][length];
  }

  boolean[][] spans(Regex<S> regex) {
    boolean[][] t = spans.get(regex);
    if (t == null) {
      t = regex.spans(this);
      spans.put(regex, t);
    }
    return t;
  }

  int length() {
    return length;
  }

  S signal(int idx) {
    return input.nth(idx);
  }

  boolean[][] table() {
    return new boolean[length + 1][length + 1];
  }
}
