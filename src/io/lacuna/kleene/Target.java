package io.lacuna.kleene;

/**
 * The destination of a transition in a {@link GeneralizedAutomaton}: either the accept state or an internal state.
 * There is no target for the start state, which has no incoming transitions.
 */
public final class Target {

  public static final Target ACCEPT = new Target(-1);

  private final int index;

  private Target(int index) {
    this.index = index;
  }

  public static Target internal(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("negative state index: " + index);
    }
    return new Target(index);
  }

  public boolean isAccept() {
    return index < 0;
  }

  /**
   * @return the index of the internal state
   * @throws IllegalStateException if this is the accept state
   */
  public int index() {
    if (isAccept()) {
      throw new IllegalStateException("the accept state has no index");
    }
    return index;
  }

  @Override
  public int hashCode() {
    return ~index;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Target && ((Target) obj).index == index;
  }

  @Override
  public String toString() {
    return isAccept() ? "accept" : "q" + index;
  }
}
