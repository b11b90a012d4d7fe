package ai.statues;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.base.Strings;

import ai.statues.prob.DecimalProbability;
import ai.statues.prob.FloatProbability;
import ai.statues.prob.FractionProbability;
import ai.statues.prob.Probability;
import ai.statues.prob.ProbabilityType;

/**
 * Renders a distribution one value per line, right-aligned, followed by its
 * probability.
 */
public enum DisplayFormat {
  /** Probabilities as stored. */
  STORED(null, false),
  /** Fractions over a common denominator. */
  FRACTION("/", false),
  DECIMAL(".", false),
  PERCENT("%", false),
  /** A bar of dashes, 100 for certainty. */
  HISTOGRAM("-", false),
  FRACTION_HISTOGRAM("/", true),
  DECIMAL_HISTOGRAM(".", true),
  PERCENT_HISTOGRAM("%", true);

  public static final int DECIMALS = 6, HISTOGRAM_SIZE = 100;

  private final String kind;
  private final boolean histogram;

  private DisplayFormat(final String kind, final boolean histogram) {
    this.kind = kind;
    this.histogram = histogram;
  }

  public String symbol() {
    return kind == null ? "" : histogram ? kind + "-" : kind;
  }

  /**
   * Looks up a format by its symbol: {@code "/"}, {@code "."}, {@code "%"},
   * {@code "-"}, or one of the first three followed by {@code "-"}.
   */
  public static DisplayFormat of(final String symbol) {
    for (final DisplayFormat format : values()) {
      if (format.symbol().equals(symbol)) {
        return format;
      }
    }
    throw new IllegalArgumentException("invalid display format '" + symbol + "'");
  }

  static DisplayFormat defaultFor(final Leaf<?> leaf) {
    return leaf.probabilityType() == ProbabilityType.FRACTION ? FRACTION : STORED;
  }

  public String format(final Leaf<?> leaf) {
    return format(leaf, DECIMALS);
  }

  public String format(final Leaf<?> leaf, final int decimals) {
    final List<String> labels = new ArrayList<>();
    int width = 0;
    for (final Object value : leaf.values()) {
      final String label = String.valueOf(value);
      labels.add(label);
      width = Math.max(width, label.length());
    }

    final List<Probability> ps = leaf.probabilities();
    final List<String> numbers = numbers(ps, decimals);
    final StringBuilder text = new StringBuilder();
    for (int i = 0; i < labels.size(); ++i) {
      if (i > 0) {
        text.append('\n');
      }
      text.append(Strings.padStart(labels.get(i), width, ' ')).append(" : ").append(numbers.get(i));
      if (histogram) {
        text.append(' ');
      }
      if (histogram || "-".equals(kind)) {
        text.append(Strings.repeat("-", (int) (0.5 + ps.get(i).doubleValue() * HISTOGRAM_SIZE)));
      }
    }
    return text.toString();
  }

  private List<String> numbers(final List<Probability> ps, final int decimals) {
    final List<String> numbers = new ArrayList<>();
    if ("/".equals(kind)) {
      final List<BigFraction> fractions = new ArrayList<>();
      BigInteger denominator = BigInteger.ONE;
      for (final Probability p : ps) {
        final BigFraction f = toFraction(p);
        fractions.add(f);
        denominator = lcm(denominator, f.getDenominator());
      }
      int numeratorWidth = 0;
      final List<String> numerators = new ArrayList<>();
      for (final BigFraction f : fractions) {
        final String numerator = f.getNumerator().multiply(denominator.divide(f.getDenominator())).toString();
        numerators.add(numerator);
        numeratorWidth = Math.max(numeratorWidth, numerator.length());
      }
      final String suffix = denominator.equals(BigInteger.ONE) ? "" : "/" + denominator;
      for (final String numerator : numerators) {
        numbers.add(Strings.padStart(numerator, numeratorWidth, ' ') + suffix);
      }
    } else if (".".equals(kind)) {
      for (final Probability p : ps) {
        numbers.add(String.format(Locale.ROOT, "%." + decimals + "f", p.doubleValue()));
      }
    } else if ("%".equals(kind)) {
      for (final Probability p : ps) {
        numbers.add(String.format(Locale.ROOT, "%" + (4 + decimals) + "." + decimals + "f %%", 100 * p.doubleValue()));
      }
    } else if (kind == null) {
      for (final Probability p : ps) {
        numbers.add(p.toString());
      }
    } else {
      for (int i = 0; i < ps.size(); ++i) {
        numbers.add("");
      }
    }
    return numbers;
  }

  private static BigInteger lcm(final BigInteger a, final BigInteger b) {
    return a.divide(a.gcd(b)).multiply(b);
  }

  private static BigFraction toFraction(final Probability p) {
    if (p instanceof FractionProbability f) {
      return f.value();
    } else if (p instanceof DecimalProbability d) {
      final BigDecimal value = d.value();
      return value.scale() > 0 ? new BigFraction(value.unscaledValue(), BigInteger.TEN.pow(value.scale()))
          : new BigFraction(value.toBigInteger());
    } else if (p instanceof FloatProbability f) {
      return new BigFraction(f.value());
    }
    return new BigFraction(p.doubleValue());
  }
}
