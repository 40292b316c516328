package io.lacuna.kleene;

/**
 * The origin of a transition in a {@link GeneralizedAutomaton}: either the start state or an internal state.  There
 * is no source for the accept state, which has no outgoing transitions.
 */
public final class Source {

  public static final Source START = new Source(-1);

  private final int index;

  private Source(int index) {
    this.index = index;
  }

  public static Source internal(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("negative state index: " + index);
    }
    return new Source(index);
  }

  public boolean isStart() {
    return index < 0;
  }

  /**
   * @return the index of the internal state
   * @throws IllegalStateException if this is the start state
   */
  public int index() {
    if (isStart()) {
      throw new IllegalStateException("the start state has no index");
    }
    return index;
  }

  @Override
  public int hashCode() {
    return index;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Source && ((Source) obj).index == index;
  }

  @Override
  public String toString() {
    return isStart() ? "start" : "q" + index;
  }
}
