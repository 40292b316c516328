package io.lacuna.kleene;

import io.lacuna.bifurcan.IList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the {@link GeneralizedAutomaton} equivalent to a {@link FiniteAutomaton}.
 * <p>
 * The transition predicate can't be inverted, so the edges between internal states are found by testing every
 * signal in an explicitly supplied alphabet.  <b>The alphabet must contain every signal the automaton has a
 * transition on.</b>  Transitions on any other signal are silently left out, and the result accepts only a subset of
 * the automaton's language.
 *
 * @param <S> the signals that trigger transitions between states
 * @param <R> the regular expression type
 */
public class NfaToGnfa<S, R> {

  private static final Logger log = LoggerFactory.getLogger(NfaToGnfa.class);

  private final RegexAlgebra<S, R> algebra;

  public NfaToGnfa(RegexAlgebra<S, R> algebra) {
    this.algebra = Objects.requireNonNull(algebra);
  }

  /**
   * @param automaton the source automaton
   * @param alphabet every signal {@code automaton} can transition on; duplicates are ignored
   * @return a generalized automaton with the same internal states, accepting the same language
   */
  public GeneralizedAutomaton<R> apply(FiniteAutomaton<S> automaton, Iterable<S> alphabet) {
    IList<S> signals = Utils.distinct(Objects.requireNonNull(alphabet, "null alphabet"));
    int size = automaton.size();

    log.debug("building generalized automaton over {} states and {} signals", size, signals.size());

    return GeneralizedAutomaton.from(size, new Transitions<R>() {
      @Override
      public R startToAccept() {
        return algebra.zero();
      }

      @Override
      public R startTo(int target) {
        return automaton.isStart(target) ? algebra.one() : algebra.zero();
      }

      @Override
      public R toAccept(int source) {
        return automaton.isAccept(source) ? algebra.one() : algebra.zero();
      }

      @Override
      public R between(int source, int target) {
        R label = null;
        for (S signal : signals) {
          if (automaton.hasTransition(source, signal, target)) {
            R literal = algebra.literal(signal);
            label = label == null ? literal : algebra.union(label, literal);
          }
        }
        return label == null ? algebra.zero() : label;
      }
    });
  }
}
