package io.lacuna.kleene;

import io.lacuna.bifurcan.*;

import java.util.Objects;

/**
 * Accumulates states and transitions into an {@link Nfa}.
 *
 * @param <S> the signals that trigger transitions between states
 */
public class NfaBuilder<S> {

  private final LinearSet<Integer> start = new LinearSet<>();
  private final LinearSet<Integer> accept = new LinearSet<>();
  private final LinearList<LinearMap<S, LinearSet<Integer>>> transitions = new LinearList<>();

  /**
   * @return the index of a newly added state
   */
  public int state() {
    transitions.addLast(new LinearMap<>());
    return (int) transitions.size() - 1;
  }

  /**
   * @return the current builder, with {@code count} more states
   */
  public NfaBuilder<S> states(int count) {
    for (int i = 0; i < count; i++) {
      state();
    }
    return this;
  }

  /**
   * @return the current builder, with {@code state} marked as a start state
   */
  public NfaBuilder<S> start(int state) {
    start.add(Utils.checkIndex(state, size()));
    return this;
  }

  /**
   * @return the current builder, with {@code state} marked as an accept state
   */
  public NfaBuilder<S> accept(int state) {
    accept.add(Utils.checkIndex(state, size()));
    return this;
  }

  /**
   * @return the current builder, extended to move from {@code source} to {@code target} on {@code signal}
   */
  public NfaBuilder<S> transition(int source, S signal, int target) {
    Objects.requireNonNull(signal, "null signal");
    Utils.checkIndex(target, size());

    LinearMap<S, LinearSet<Integer>> m = transitions.nth(Utils.checkIndex(source, size()));
    LinearSet<Integer> targets = m.get(signal).orElse(null);
    if (targets == null) {
      targets = new LinearSet<>();
      m.put(signal, targets);
    }
    targets.add(target);

    return this;
  }

  public int size() {
    return (int) transitions.size();
  }

  /**
   * @return an automaton reflecting the builder's current contents, unaffected by later changes to the builder
   */
  public Nfa<S> build() {
    LinearList<IMap<S, ISet<Integer>>> copy = new LinearList<>();
    for (LinearMap<S, LinearSet<Integer>> m : transitions) {
      LinearMap<S, ISet<Integer>> c = new LinearMap<>();
      for (S signal : m.keys()) {
        c.put(signal, Utils.toSet(m.get(signal).get()));
      }
      copy.addLast(c);
    }

    return new Nfa<>(Utils.toSet(start), Utils.toSet(accept), copy);
  }
}
