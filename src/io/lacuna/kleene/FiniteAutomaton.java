package io.lacuna.kleene;

import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * A nondeterministic finite automaton over the states {@code 0 .. size() - 1}, described by predicates.
 *
 * @param <S> the signals that trigger transitions between states
 */
public interface FiniteAutomaton<S> {

  @FunctionalInterface
  interface TransitionPredicate<S> {
    boolean test(int source, S signal, int target);
  }

  int size();

  boolean isStart(int state);

  boolean isAccept(int state);

  boolean hasTransition(int source, S signal, int target);

  /**
   * @return an automaton over {@code size} states, defined by the given predicates
   */
  static <S> FiniteAutomaton<S> of(int size, TransitionPredicate<S> transition, IntPredicate start, IntPredicate accept) {
    if (size < 0) {
      throw new IllegalArgumentException("negative state count: " + size);
    }
    Objects.requireNonNull(transition);
    Objects.requireNonNull(start);
    Objects.requireNonNull(accept);

    return new FiniteAutomaton<S>() {
      @Override
      public int size() {
        return size;
      }

      @Override
      public boolean isStart(int state) {
        return start.test(Utils.checkIndex(state, size));
      }

      @Override
      public boolean isAccept(int state) {
        return accept.test(Utils.checkIndex(state, size));
      }

      @Override
      public boolean hasTransition(int source, S signal, int target) {
        return transition.test(Utils.checkIndex(source, size), signal, Utils.checkIndex(target, size));
      }
    };
  }
}
