package io.lacuna.kleene.regex;

import io.lacuna.bifurcan.IList;
import io.lacuna.kleene.RegexAlgebra;
import io.lacuna.kleene.RegexMatcher;

import java.util.Objects;

/**
 * An immutable regular expression over signals of type {@code S}.  Expressions are compared structurally, and are
 * never simplified: {@code union(zero(), x)} is not equal to {@code x}, even though both match the same sequences.
 *
 * @param <S> the signals being matched
 */
public abstract class Regex<S> {

  private static final int UNION = 0, CONCAT = 1, STAR = 2, ATOM = 3;

  private static final Zero ZERO = new Zero();
  private static final One ONE = new One();
  private static final Algebra ALGEBRA = new Algebra();

  private final int hash;

  private Regex(int hash) {
    this.hash = hash;
  }

  /// constructors

  /**
   * @return an expression which matches nothing
   */
  public static <S> Regex<S> zero() {
    return ZERO;
  }

  /**
   * @return an expression which matches only the empty sequence
   */
  public static <S> Regex<S> one() {
    return ONE;
  }

  public static <S> Regex<S> literal(S signal) {
    return new Literal<>(signal);
  }

  public static <S> Regex<S> union(Regex<S> a, Regex<S> b) {
    return new Union<>(a, b);
  }

  public static <S> Regex<S> concat(Regex<S> a, Regex<S> b) {
    return new Concat<>(a, b);
  }

  public static <S> Regex<S> star(Regex<S> a) {
    return new Star<>(a);
  }

  /**
   * @return the constructors above, as an algebra
   */
  public static <S> RegexAlgebra<S, Regex<S>> algebra() {
    return ALGEBRA;
  }

  public static <S> RegexMatcher<S, Regex<S>> matcher() {
    return Regex::matches;
  }

  ///

  /**
   * @return true if this expression matches the whole of {@code input}
   */
  public boolean matches(IList<S> input) {
    return new Matcher<>(input).matches(this);
  }

  /**
   * @return a table where {@code [i][j]} is true if this expression matches the input from {@code i} up to {@code j}
   */
  abstract boolean[][] spans(Matcher<S> matcher);

  abstract int precedence();

  abstract void render(StringBuilder sb);

  private static void renderChild(StringBuilder sb, Regex<?> r, int precedence) {
    if (r.precedence() < precedence) {
      sb.append('(');
      r.render(sb);
      sb.append(')');
    } else {
      r.render(sb);
    }
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    render(sb);
    return sb.toString();
  }

  /// nodes

  public static final class Zero<S> extends Regex<S> {
    private Zero() {
      super(0);
    }

    @Override
    boolean[][] spans(Matcher<S> matcher) {
      return matcher.table();
    }

    @Override
    int precedence() {
      return ATOM;
    }

    @Override
    void render(StringBuilder sb) {
      sb.append('∅');
    }
  }

  public static final class One<S> extends Regex<S> {
    private One() {
      super(1);
    }

    @Override
    boolean[][] spans(Matcher<S> matcher) {
      boolean[][] t = matcher.table();
      for (int i = 0; i <= matcher.length(); i++) {
        t[i][i] = true;
      }
      return t;
    }

    @Override
    int precedence() {
      return ATOM;
    }

    @Override
    void render(StringBuilder sb) {
      sb.append('ε');
    }
  }

  public static final class Literal<S> extends Regex<S> {
    private final S signal;

    private Literal(S signal) {
      super(31 * signal.hashCode() + 2);
      this.signal = signal;
    }

    public S signal() {
      return signal;
    }

    @Override
    boolean[][] spans(Matcher<S> matcher) {
      boolean[][] t = matcher.table();
      for (int i = 0; i < matcher.length(); i++) {
        t[i][i + 1] = Objects.equals(signal, matcher.signal(i));
      }
      return t;
    }

    @Override
    int precedence() {
      return ATOM;
    }

    @Override
    void render(StringBuilder sb) {
      sb.append(signal);
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
              || (obj instanceof Literal && Objects.equals(signal, ((Literal<?>) obj).signal));
    }
  }

  public static final class Union<S> extends Regex<S> {
    private final Regex<S> left, right;

    private Union(Regex<S> left, Regex<S> right) {
      super(31 * (31 * left.hashCode() + right.hashCode()) + 3);
      this.left = left;
      this.right = right;
    }

    public Regex<S> left() {
      return left;
    }

    public Regex<S> right() {
      return right;
    }

    @Override
    boolean[][] spans(Matcher<S> matcher) {
      boolean[][] a = matcher.spans(left);
      boolean[][] b = matcher.spans(right);
      boolean[][] t = matcher.table();
      for (int i = 0; i <= matcher.length(); i++) {
        for (int j = i; j <= matcher.length(); j++) {
          t[i][j] = a[i][j] || b[i][j];
        }
      }
      return t;
    }

    @Override
    int precedence() {
      return UNION;
    }

    @Override
    void render(StringBuilder sb) {
      renderChild(sb, left, UNION);
      sb.append('|');
      renderChild(sb, right, UNION);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      } else if (obj instanceof Union && obj.hashCode() == hashCode()) {
        Union<?> u = (Union<?>) obj;
        return left.equals(u.left) && right.equals(u.right);
      }
      return false;
    }
  }

  public static final class Concat<S> extends Regex<S> {
    private final Regex<S> first, second;

    private Concat(Regex<S> first, Regex<S> second) {
      super(31 * (31 * first.hashCode() + second.hashCode()) + 4);
      this.first = first;
      this.second = second;
    }

    public Regex<S> first() {
      return first;
    }

    public Regex<S> second() {
      return second;
    }

    @Override
    boolean[][] spans(Matcher<S> matcher) {
      boolean[][] a = matcher.spans(first);
      boolean[][] b = matcher.spans(second);
      boolean[][] t = matcher.table();
      for (int i = 0; i <= matcher.length(); i++) {
        for (int k = i; k <= matcher.length(); k++) {
          if (a[i][k]) {
            for (int j = k; j <= matcher.length(); j++) {
              t[i][j] |= b[k][j];
            }
          }
        }
      }
      return t;
    }

    @Override
    int precedence() {
      return CONCAT;
    }

    @Override
    void render(StringBuilder sb) {
      renderChild(sb, first, CONCAT);
      renderChild(sb, second, CONCAT);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      } else if (obj instanceof Concat && obj.hashCode() == hashCode()) {
        Concat<?> c = (Concat<?>) obj;
        return first.equals(c.first) && second.equals(c.second);
      }
      return false;
    }
  }

  public static final class Star<S> extends Regex<S> {
    private final Regex<S> child;

    private Star(Regex<S> child) {
      super(31 * child.hashCode() + 5);
      this.child = child;
    }

    public Regex<S> child() {
      return child;
    }

    @Override
    boolean[][] spans(Matcher<S> matcher) {
      boolean[][] c = matcher.spans(child);
      boolean[][] t = matcher.table();

      // t[k][j] is complete for every k > i before row i is filled in
      for (int i = matcher.length(); i >= 0; i--) {
        t[i][i] = true;
        for (int k = i + 1; k <= matcher.length(); k++) {
          if (c[i][k]) {
            for (int j = k; j <= matcher.length(); j++) {
              t[i][j] |= t[k][j];
            }
          }
        }
      }
      return t;
    }

    @Override
    int precedence() {
      return STAR;
    }

    @Override
    void render(StringBuilder sb) {
      renderChild(sb, child, ATOM);
      sb.append('*');
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      } else if (obj instanceof Star && obj.hashCode() == hashCode()) {
        return child.equals(((Star<?>) obj).child);
      }
      return false;
    }
  }

  ///

  private static final class Algebra<S> implements RegexAlgebra<S, Regex<S>> {
    @Override
    public Regex<S> zero() {
      return Regex.zero();
    }

    @Override
    public Regex<S> one() {
      return Regex.one();
    }

    @Override
    public Regex<S> literal(S signal) {
      return Regex.literal(signal);
    }

    @Override
    public Regex<S> union(Regex<S> a, Regex<S> b) {
      return Regex.union(a, b);
    }

    @Override
    public Regex<S> concat(Regex<S> a, Regex<S> b) {
      return Regex.concat(a, b);
    }

    @Override
    public Regex<S> star(Regex<S> a) {
      return Regex.star(a);
    }
  }
}
