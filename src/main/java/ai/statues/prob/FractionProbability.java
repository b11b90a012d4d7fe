package ai.statues.prob;

import java.math.BigInteger;

import org.apache.commons.math3.fraction.BigFraction;

/**
 * An exact rational probability backed by {@link BigFraction}.
 */
public record FractionProbability(BigFraction value) implements Probability {
  private static final long serialVersionUID = 1L;

  @Override
  public ProbabilityType type() {
    return ProbabilityType.FRACTION;
  }

  private static BigFraction operand(final Probability other) {
    return ProbabilityType.FRACTION.<FractionProbability>cast(other).value;
  }

  @Override
  public Probability add(final Probability other) {
    return new FractionProbability(value.add(operand(other)));
  }

  @Override
  public Probability subtract(final Probability other) {
    return new FractionProbability(value.subtract(operand(other)));
  }

  @Override
  public Probability multiply(final Probability other) {
    return new FractionProbability(value.multiply(operand(other)));
  }

  @Override
  public Probability divide(final Probability other) {
    return new FractionProbability(value.divide(operand(other)));
  }

  @Override
  public int signum() {
    return value.getNumerator().signum() * value.getDenominator().signum();
  }

  @Override
  public double doubleValue() {
    return value.doubleValue();
  }

  @Override
  public int compareTo(final Probability other) {
    return value.compareTo(operand(other));
  }

  @Override
  public String toString() {
    return value.getDenominator().equals(BigInteger.ONE) ? value.getNumerator().toString()
        : value.getNumerator() + "/" + value.getDenominator();
  }
}
