package io.lacuna.kleene;

/**
 * The constructors of a regular expression type, as consumed by the conversion.
 *
 * @param <S> the symbols of the alphabet
 * @param <R> the regular expression type
 */
public interface RegexAlgebra<S, R> {

  /**
   * @return an expression which matches nothing
   */
  R zero();

  /**
   * @return an expression which matches only the empty sequence
   */
  R one();

  /**
   * @return an expression which matches exactly {@code symbol}
   */
  R literal(S symbol);

  R union(R a, R b);

  R concat(R a, R b);

  R star(R a);
}
