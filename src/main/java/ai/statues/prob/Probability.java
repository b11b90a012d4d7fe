package ai.statues.prob;

import java.io.Serializable;

/**
 * A probability weight in one numeric domain. Every weight combination done by
 * the evaluation core goes through this interface, so the core never assumes a
 * concrete numeric type.
 * <p>
 * Operands must belong to the same {@link ProbabilityType}; mixing domains
 * raises {@link ai.statues.NumericCapabilityException} rather than coercing.
 */
public interface Probability extends Comparable<Probability>, Serializable {
  ProbabilityType type();

  Probability add(Probability other);

  Probability subtract(Probability other);

  Probability multiply(Probability other);

  Probability divide(Probability other);

  int signum();

  /**
   * An approximation of this probability as a double.
   */
  double doubleValue();

  default boolean isZero() {
    return signum() == 0;
  }

  default boolean isOne() {
    return compareTo(type().one()) == 0;
  }

  /**
   * The base 2 logarithm, computed on the double approximation.
   */
  default double log2() {
    return Math.log(doubleValue()) / Math.log(2);
  }
}
