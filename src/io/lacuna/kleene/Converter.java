package io.lacuna.kleene;

import io.lacuna.kleene.regex.Regex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Converts finite automata into equivalent regular expressions, by removing internal states from a
 * {@link GeneralizedAutomaton} until only the edge from the start state to the accept state remains.
 * <p>
 * Each removal can roughly double the size of the labels, so the result may be exponentially larger than the
 * automaton.  No simplification is performed.
 *
 * @param <S> the signals that trigger transitions between states
 * @param <R> the regular expression type
 */
public class Converter<S, R> {

  private static final Logger log = LoggerFactory.getLogger(Converter.class);

  private final StateElimination<S, R> elimination;
  private final NfaToGnfa<S, R> adapter;

  public Converter(RegexAlgebra<S, R> algebra) {
    Objects.requireNonNull(algebra);
    this.elimination = new StateElimination<>(algebra);
    this.adapter = new NfaToGnfa<>(algebra);
  }

  /**
   * @return a converter producing {@link Regex} values
   */
  public static <S> Converter<S, Regex<S>> create() {
    return new Converter<>(Regex.algebra());
  }

  /**
   * @return the label left after removing every internal state of {@code automaton}, or its only label if it has
   * no internal states
   */
  public R toRegex(GeneralizedAutomaton<R> automaton) {
    log.debug("converting generalized automaton with {} internal states", automaton.size());

    GeneralizedAutomaton<R> g = automaton;
    while (g.size() > 0) {
      if (log.isTraceEnabled()) {
        log.trace("{}", g);
      }
      g = elimination.rip(g);
    }

    return g.single();
  }

  /**
   * @param automaton the source automaton
   * @param alphabet every signal {@code automaton} can transition on, see {@link NfaToGnfa}
   * @return a regular expression matching exactly the sequences {@code automaton} accepts
   */
  public R toRegex(FiniteAutomaton<S> automaton, Iterable<S> alphabet) {
    return toRegex(adapter.apply(automaton, alphabet));
  }

  /**
   * @return a regular expression matching exactly the sequences {@code automaton} accepts
   */
  public R toRegex(Nfa<S> automaton) {
    return toRegex(automaton, automaton.alphabet());
  }
}
