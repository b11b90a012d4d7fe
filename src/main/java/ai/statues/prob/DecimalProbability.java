package ai.statues.prob;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * An arbitrary precision decimal probability. Division rounds to
 * {@link MathContext#DECIMAL128}.
 */
public record DecimalProbability(BigDecimal value) implements Probability {
  private static final long serialVersionUID = 1L;
  public static final MathContext CONTEXT = MathContext.DECIMAL128;

  public DecimalProbability {
    // Keeps equals/hashCode consistent across scales.
    value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
  }

  @Override
  public ProbabilityType type() {
    return ProbabilityType.DECIMAL;
  }

  private static BigDecimal operand(final Probability other) {
    return ProbabilityType.DECIMAL.<DecimalProbability>cast(other).value;
  }

  @Override
  public Probability add(final Probability other) {
    return new DecimalProbability(value.add(operand(other)));
  }

  @Override
  public Probability subtract(final Probability other) {
    return new DecimalProbability(value.subtract(operand(other)));
  }

  @Override
  public Probability multiply(final Probability other) {
    return new DecimalProbability(value.multiply(operand(other)));
  }

  @Override
  public Probability divide(final Probability other) {
    return new DecimalProbability(value.divide(operand(other), CONTEXT));
  }

  @Override
  public int signum() {
    return value.signum();
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
    return value.toPlainString();
  }
}
