package io.lacuna.kleene;

/**
 * A total transition function over a generalized automaton with {@code n} internal states, split into the four
 * shapes an edge can take.  Every method must return a label; the absence of an edge is the algebra's {@code zero}.
 *
 * @param <R> the regular expression type labeling each edge
 */
public interface Transitions<R> {

  R startToAccept();

  R startTo(int target);

  R toAccept(int source);

  R between(int source, int target);
}
