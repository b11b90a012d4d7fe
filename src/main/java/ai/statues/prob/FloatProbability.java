package ai.statues.prob;

public record FloatProbability(double value) implements Probability {
  private static final long serialVersionUID = 1L;

  @Override
  public ProbabilityType type() {
    return ProbabilityType.FLOAT;
  }

  private static double operand(final Probability other) {
    return ProbabilityType.FLOAT.<FloatProbability>cast(other).value;
  }

  @Override
  public Probability add(final Probability other) {
    return new FloatProbability(value + operand(other));
  }

  @Override
  public Probability subtract(final Probability other) {
    return new FloatProbability(value - operand(other));
  }

  @Override
  public Probability multiply(final Probability other) {
    return new FloatProbability(value * operand(other));
  }

  @Override
  public Probability divide(final Probability other) {
    return new FloatProbability(value / operand(other));
  }

  @Override
  public int signum() {
    return (int) Math.signum(value);
  }

  @Override
  public double doubleValue() {
    return value;
  }

  @Override
  public int compareTo(final Probability other) {
    return Double.compare(value, operand(other));
  }

  @Override
  public String toString() {
    return Double.toString(value);
  }
}
