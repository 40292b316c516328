package io.lacuna.kleene;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Removes internal states from a {@link GeneralizedAutomaton} one at a time, relabeling the remaining edges so that
 * the accepted language doesn't change.
 *
 * @param <S> the symbols of the alphabet
 * @param <R> the regular expression type
 */
public class StateElimination<S, R> {

  private static final Logger log = LoggerFactory.getLogger(StateElimination.class);

  private final RegexAlgebra<S, R> algebra;

  public StateElimination(RegexAlgebra<S, R> algebra) {
    this.algebra = Objects.requireNonNull(algebra);
  }

  /**
   * Removes the internal state with the highest index.  Every path through it becomes a direct edge: for each
   * remaining source {@code p} and target {@code q}, the new label is
   * {@code p->q | (p->L)(L->L)*(L->q)}.  The remaining states keep their indices.
   *
   * @param automaton an automaton with at least one internal state
   * @return an automaton with one fewer internal state, accepting the same language
   * @throws IllegalArgumentException if {@code automaton} has no internal states
   */
  public GeneralizedAutomaton<R> rip(GeneralizedAutomaton<R> automaton) {
    if (automaton.size() == 0) {
      throw new IllegalArgumentException("no internal state to remove");
    }

    int size = automaton.size() - 1;
    Source ripSource = Source.internal(size);
    Target ripTarget = Target.internal(size);
    R loop = algebra.star(automaton.step(ripSource, ripTarget));

    log.debug("removing state {} of {}", size, automaton.size());

    // the old automaton is never modified, so every label below is read from the table as it was before this round
    return GeneralizedAutomaton.from(size, new Transitions<R>() {
      @Override
      public R startToAccept() {
        return bypass(Source.START, Target.ACCEPT);
      }

      @Override
      public R startTo(int target) {
        return bypass(Source.START, Target.internal(target));
      }

      @Override
      public R toAccept(int source) {
        return bypass(Source.internal(source), Target.ACCEPT);
      }

      @Override
      public R between(int source, int target) {
        return bypass(Source.internal(source), Target.internal(target));
      }

      private R bypass(Source p, Target q) {
        return algebra.union(
                automaton.step(p, q),
                algebra.concat(
                        automaton.step(p, ripTarget),
                        algebra.concat(loop, automaton.step(ripSource, q))));
      }
    });
  }
}
