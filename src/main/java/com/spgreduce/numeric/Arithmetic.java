package com.spgreduce.numeric;

import java.util.Comparator;

/**
 * Operations on probability values of type {@code P}. Algorithms are written against this interface
 * so that they run unchanged over exact rationals and over doubles.
 */
public interface Arithmetic<P> extends Comparator<P> {
  static Arithmetic<Rational> exact() {
    return ExactArithmetic.INSTANCE;
  }

  static Arithmetic<Double> floating() {
    return FloatingArithmetic.INSTANCE;
  }

  NumericMode mode();

  P zero();

  P one();

  P add(P first, P second);

  P subtract(P first, P second);

  P multiply(P first, P second);

  default P complement(P probability) {
    return subtract(one(), probability);
  }

  @Override
  int compare(P first, P second);

  default P min(P first, P second) {
    return compare(first, second) <= 0 ? first : second;
  }

  /**
   * Whether the value is one, exactly or up to the rounding error this representation accumulates.
   */
  boolean isOne(P value);

  /**
   * Whether the value is a proper probability in (0, 1].
   */
  default boolean isProbability(P value) {
    return compare(value, zero()) > 0 && compare(value, one()) <= 0;
  }

  P fromRational(Rational value);

  /**
   * Exact rational value of the given probability.
   */
  Rational toRational(P value);

  double toDouble(P value);

  P parse(String string);
}
