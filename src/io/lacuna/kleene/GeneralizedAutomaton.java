package io.lacuna.kleene;

import io.lacuna.bifurcan.*;

import java.util.Objects;

import static io.lacuna.kleene.Utils.checkIndex;
import static io.lacuna.kleene.Utils.tabulate;

/**
 * A generalized nondeterministic finite automaton: {@code n} internal states plus a distinguished start and accept
 * state, where every edge is labeled with an entire regular expression.  The transition table is total, so every
 * {@link Source} and {@link Target} pair has a label, and is never modified once built.
 *
 * @param <R> the regular expression type labeling each edge
 */
public class GeneralizedAutomaton<R> {

  private final int size;
  private final R startToAccept;
  private final IList<R> fromStart;
  private final IList<R> toAccept;
  private final IList<IList<R>> between;

  private GeneralizedAutomaton(int size, R startToAccept, IList<R> fromStart, IList<R> toAccept, IList<IList<R>> between) {
    this.size = size;
    this.startToAccept = startToAccept;
    this.fromStart = fromStart;
    this.toAccept = toAccept;
    this.between = between;
  }

  /**
   * Evaluates {@code transitions} once for every edge of an automaton with {@code size} internal states.
   *
   * @param size the number of internal states
   * @param transitions the label of every edge
   * @param <R> the regular expression type
   * @return the materialized automaton
   */
  public static <R> GeneralizedAutomaton<R> from(int size, Transitions<R> transitions) {
    if (size < 0) {
      throw new IllegalArgumentException("negative state count: " + size);
    }

    R startToAccept = Objects.requireNonNull(transitions.startToAccept(), "null label");
    IList<R> fromStart = tabulate(size, transitions::startTo);
    IList<R> toAccept = tabulate(size, transitions::toAccept);

    LinearList<IList<R>> between = new LinearList<>();
    for (int p = 0; p < size; p++) {
      int source = p;
      between.addLast(tabulate(size, q -> transitions.between(source, q)));
    }

    return new GeneralizedAutomaton<>(size, startToAccept, fromStart, toAccept, between);
  }

  /**
   * @return an automaton without internal states, which accepts exactly what {@code regex} matches
   */
  public static <R> GeneralizedAutomaton<R> of(R regex) {
    Objects.requireNonNull(regex, "null label");
    return new GeneralizedAutomaton<>(0, regex, new LinearList<>(), new LinearList<>(), new LinearList<>());
  }

  /**
   * @return the number of internal states
   */
  public int size() {
    return size;
  }

  /**
   * @return the label on the edge from {@code source} to {@code target}
   * @throws IndexOutOfBoundsException if either refers to an internal state outside this automaton
   */
  public R step(Source source, Target target) {
    if (source.isStart()) {
      return target.isAccept()
              ? startToAccept
              : fromStart.nth(checkIndex(target.index(), size));
    }

    int p = checkIndex(source.index(), size);
    return target.isAccept()
            ? toAccept.nth(p)
            : between.nth(p).nth(checkIndex(target.index(), size));
  }

  /**
   * @return the label on the only edge of an automaton without internal states
   * @throws IllegalStateException if there are internal states remaining
   */
  public R single() {
    if (size > 0) {
      throw new IllegalStateException(size + " internal states remain");
    }
    return startToAccept;
  }

  public Transitions<R> transitions() {
    return new Transitions<R>() {
      @Override
      public R startToAccept() {
        return startToAccept;
      }

      @Override
      public R startTo(int target) {
        return step(Source.START, Target.internal(target));
      }

      @Override
      public R toAccept(int source) {
        return step(Source.internal(source), Target.ACCEPT);
      }

      @Override
      public R between(int source, int target) {
        return step(Source.internal(source), Target.internal(target));
      }
    };
  }

  /**
   * Decides acceptance by following traces: paths from the start state to the accept state where each edge's label
   * matches the next contiguous piece of {@code input}, and the pieces together make up all of {@code input}.
   *
   * @param input the sequence of symbols
   * @param matcher decides whether a label matches a piece of the input
   * @return true if some trace consumes exactly {@code input}
   */
  public <S> boolean accepts(IList<S> input, RegexMatcher<S, R> matcher) {
    int length = (int) input.size();

    // node 0 is the start state, nodes 1..size are internal, node size + 1 is the accept state
    int accept = size + 1;
    boolean[][] visited = new boolean[size + 2][length + 1];
    LinearList<long[]> queue = LinearList.of(new long[]{0, 0});
    visited[0][0] = true;

    while (queue.size() > 0) {
      long[] node = queue.popLast();
      int state = (int) node[0];
      int offset = (int) node[1];

      if (state == accept) {
        if (offset == length) {
          return true;
        }
        continue;
      }

      Source source = state == 0 ? Source.START : Source.internal(state - 1);
      for (int next = 1; next <= accept; next++) {
        Target target = next == accept ? Target.ACCEPT : Target.internal(next - 1);
        R label = step(source, target);
        for (int end = offset; end <= length; end++) {
          if (!visited[next][end] && matcher.matches(label, input.slice(offset, end))) {
            visited[next][end] = true;
            queue.addLast(new long[]{next, end});
          }
        }
      }
    }

    return false;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("gnfa(" + size + ")[");
    sb.append(Source.START).append(" -> ").append(Target.ACCEPT).append(": ").append(startToAccept);
    for (int q = 0; q < size; q++) {
      sb.append(", ").append(Source.START).append(" -> ").append(Target.internal(q)).append(": ").append(fromStart.nth(q));
    }
    for (int p = 0; p < size; p++) {
      for (int q = 0; q < size; q++) {
        sb.append(", ").append(Source.internal(p)).append(" -> ").append(Target.internal(q)).append(": ").append(between.nth(p).nth(q));
      }
      sb.append(", ").append(Source.internal(p)).append(" -> ").append(Target.ACCEPT).append(": ").append(toAccept.nth(p));
    }
    sb.append("]");
    return sb.toString();
  }
}
