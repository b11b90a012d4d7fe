package ai.statues.prob;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.base.Preconditions;

import ai.statues.NumericCapabilityException;

/**
 * Factory for the probabilities of one numeric domain.
 */
public enum ProbabilityType {
  FLOAT {
    @Override
    public Probability of(final long numerator, final long denominator) {
      return new FloatProbability((double) numerator / denominator);
    }

    @Override
    public Probability of(final double value) {
      return new FloatProbability(value);
    }

    @Override
    protected Probability of(final BigDecimal value) {
      return new FloatProbability(value.doubleValue());
    }
  },
  FRACTION {
    @Override
    public Probability of(final long numerator, final long denominator) {
      return new FractionProbability(new BigFraction(numerator, denominator));
    }

    @Override
    public Probability of(final double value) {
      // Exact binary expansion, so that doubleValue() gives the literal back.
      return new FractionProbability(new BigFraction(value));
    }

    @Override
    protected Probability of(final BigDecimal value) {
      final BigInteger unscaled = value.unscaledValue();
      final int scale = value.scale();
      return new FractionProbability(scale >= 0
          ? new BigFraction(unscaled, BigInteger.TEN.pow(scale))
          : new BigFraction(unscaled.multiply(BigInteger.TEN.pow(-scale))));
    }
  },
  DECIMAL {
    @Override
    public Probability of(final long numerator, final long denominator) {
      return new DecimalProbability(BigDecimal.valueOf(numerator)
          .divide(BigDecimal.valueOf(denominator), DecimalProbability.CONTEXT));
    }

    @Override
    public Probability of(final double value) {
      return new DecimalProbability(BigDecimal.valueOf(value));
    }

    @Override
    protected Probability of(final BigDecimal value) {
      return new DecimalProbability(value);
    }
  };

  public abstract Probability of(long numerator, long denominator);

  public abstract Probability of(double value);

  protected abstract Probability of(BigDecimal value);

  public Probability of(final long value) {
    return of(value, 1);
  }

  public Probability zero() {
    return of(0);
  }

  public Probability one() {
    return of(1);
  }

  /**
   * Parses a probability literal: a fraction ({@code "3/8"}), a decimal
   * ({@code "0.375"}) or a percentage ({@code "37.5%"}).
   */
  public Probability parse(final String literal) {
    Preconditions.checkNotNull(literal);
    final String text = literal.trim();
    try {
      if (text.endsWith("%")) {
        final BigDecimal percent = new BigDecimal(text.substring(0, text.length() - 1).trim());
        return of(percent).divide(of(100));
      }
      final int slash = text.indexOf('/');
      if (slash >= 0) {
        final Probability numerator = of(new BigDecimal(text.substring(0, slash).trim()));
        final Probability denominator = of(new BigDecimal(text.substring(slash + 1).trim()));
        return numerator.divide(denominator);
      }
      return of(new BigDecimal(text));
    } catch (final NumberFormatException | ArithmeticException e) {
      throw new NumericCapabilityException("cannot parse probability '" + literal + "'", e);
    }
  }

  /**
   * Converts a number, a literal or a probability of this type.
   */
  public Probability coerce(final Object value) {
    Preconditions.checkNotNull(value);
    if (value instanceof Probability p) {
      return cast(p);
    } else if (value instanceof String s) {
      return parse(s);
    } else if (value instanceof BigFraction f) {
      return of(new BigDecimal(f.getNumerator())).divide(of(new BigDecimal(f.getDenominator())));
    } else if (value instanceof BigDecimal d) {
      return of(d);
    } else if (value instanceof BigInteger i) {
      return of(new BigDecimal(i));
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      return of(((Number) value).longValue());
    } else if (value instanceof Number n) {
      return of(n.doubleValue());
    }
    throw new NumericCapabilityException("cannot use " + value.getClass().getSimpleName() + " '" + value
        + "' as a probability");
  }

  /**
   * Checks that {@code p} belongs to this domain.
   */
  @SuppressWarnings("unchecked")
  public <P extends Probability> P cast(final Probability p) {
    Preconditions.checkNotNull(p);
    if (p.type() != this) {
      throw new NumericCapabilityException("cannot combine " + p.type() + " probability " + p + " with " + this);
    }
    return (P) p;
  }
}
