package io.lacuna.kleene;

import io.lacuna.bifurcan.*;

/**
 * An explicit nondeterministic finite automaton, created by an {@link NfaBuilder}.  Unlike a predicate-based
 * {@link FiniteAutomaton}, it knows its own alphabet.
 *
 * @param <S> the signals that trigger transitions between states
 */
public class Nfa<S> implements FiniteAutomaton<S> {

  private final ISet<Integer> start;
  private final ISet<Integer> accept;
  private final IList<IMap<S, ISet<Integer>>> transitions;
  private final IList<S> alphabet;

  Nfa(ISet<Integer> start, ISet<Integer> accept, IList<IMap<S, ISet<Integer>>> transitions) {
    this.start = start;
    this.accept = accept;
    this.transitions = transitions;

    LinearList<S> signals = new LinearList<>();
    for (IMap<S, ISet<Integer>> m : transitions) {
      m.keys().forEach(signals::addLast);
    }
    this.alphabet = Utils.distinct(signals);
  }

  @Override
  public int size() {
    return (int) transitions.size();
  }

  @Override
  public boolean isStart(int state) {
    return start.contains(Utils.checkIndex(state, size()));
  }

  @Override
  public boolean isAccept(int state) {
    return accept.contains(Utils.checkIndex(state, size()));
  }

  @Override
  public boolean hasTransition(int source, S signal, int target) {
    Utils.checkIndex(target, size());
    return transitions(source, signal).contains(target);
  }

  /**
   * @return the states reachable from {@code source} on {@code signal}, which must not be modified
   */
  public ISet<Integer> transitions(int source, S signal) {
    return transitions.nth(Utils.checkIndex(source, size()))
            .get(signal)
            .orElseGet(LinearSet::new);
  }

  /**
   * @return every signal with at least one transition
   */
  public IList<S> alphabet() {
    return alphabet;
  }

  /**
   * @return true if some run over {@code input} ends in an accept state
   */
  public boolean accepts(IList<S> input) {
    ISet<Integer> current = start;
    for (S signal : input) {
      LinearSet<Integer> next = new LinearSet<>();
      for (int state : current) {
        transitions(state, signal).forEach(next::add);
      }
      if (next.size() == 0) {
        return false;
      }
      current = next;
    }

    for (int state : current) {
      if (accept.contains(state)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("nfa(" + size() + ")[start=" + start + ", accept=" + accept);
    for (int p = 0; p < size(); p++) {
      for (S signal : transitions.nth(p).keys()) {
        sb.append(", ").append(p).append(" -").append(signal).append("-> ").append(transitions(p, signal));
      }
    }
    sb.append("]");
    return sb.toString();
  }
}
