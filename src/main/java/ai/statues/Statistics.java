package ai.statues;

import java.util.ArrayList;
import java.util.List;

import ai.statues.prob.Probability;
import ai.statues.util.Values;
import lombok.experimental.UtilityClass;

/**
 * Indicators and information measures over evaluated distributions.
 * Information quantities are in bits.
 */
@UtilityClass
public class Statistics {
  /**
   * @throws NumericCapabilityException if a value is not a number
   */
  public double mean(final Leaf<?> leaf) {
    double mean = 0;
    for (final Outcome<?> outcome : leaf.outcomes()) {
      mean += Values.toDouble(outcome.value()) * outcome.weight().doubleValue();
    }
    return mean;
  }

  public double variance(final Leaf<?> leaf) {
    final double mean = mean(leaf);
    double variance = 0;
    for (final Outcome<?> outcome : leaf.outcomes()) {
      final double deviation = Values.toDouble(outcome.value()) - mean;
      variance += deviation * deviation * outcome.weight().doubleValue();
    }
    return variance;
  }

  public double standardDeviation(final Leaf<?> leaf) {
    return Math.sqrt(variance(leaf));
  }

  /**
   * The values of highest probability, in value order.
   */
  public <V> List<V> mode(final Leaf<V> leaf) {
    Probability max = null;
    for (final Outcome<V> outcome : leaf.outcomes()) {
      if (max == null || outcome.weight().compareTo(max) > 0) {
        max = outcome.weight();
      }
    }
    final List<V> mode = new ArrayList<>();
    for (final Outcome<V> outcome : leaf.outcomes()) {
      if (outcome.weight().compareTo(max) == 0) {
        mode.add(outcome.value());
      }
    }
    return mode;
  }

  public double entropy(final Leaf<?> leaf) {
    double entropy = 0;
    for (final Outcome<?> outcome : leaf.outcomes()) {
      if (outcome.weight().signum() > 0) {
        entropy -= outcome.weight().doubleValue() * outcome.weight().log2();
      }
    }
    return entropy;
  }

  /**
   * The entropy relative to its maximum for the number of values, between 0
   * and 1. A certain distribution has relative entropy 0.
   */
  public double relativeEntropy(final Leaf<?> leaf) {
    final int n = leaf.size();
    if (n == 1) {
      return 0;
    }
    return Math.min(1, entropy(leaf) / (Math.log(n) / Math.log(2)));
  }

  public double redundancy(final Leaf<?> leaf) {
    return 1 - relativeEntropy(leaf);
  }

  /**
   * @throws DomainException if the value is impossible
   */
  public double informationOf(final Leaf<?> leaf, final Object value) {
    final Probability p = leaf.probability(value);
    if (p.isZero()) {
      throw new DomainException("no information from impossible value '" + value + "'");
    }
    return -p.log2();
  }

  /**
   * The information of a boolean distribution being true.
   */
  public double information(final Distribution<?> condition) {
    condition.P();
    return informationOf(condition.evaluate(), true);
  }

  public double jointEntropy(final Distribution<?>... args) {
    return entropy(Distribution.joint(args).evaluate());
  }

  /**
   * The entropy of {@code a} remaining once {@code b} is known.
   */
  public double conditionalEntropy(final Distribution<?> a, final Distribution<?> b) {
    return Math.max(0, jointEntropy(a, b) - entropy(b.evaluate()));
  }

  public double mutualInformation(final Distribution<?> a, final Distribution<?> b) {
    return Math.max(0, entropy(a.evaluate()) + entropy(b.evaluate()) - jointEntropy(a, b));
  }

  /**
   * P(e | h) / P(e | not h), where h is the conjunction of the hypotheses.
   *
   * @throws DomainException if the hypothesis is certainly true or certainly
   *                         false
   */
  public double likelihoodRatio(final Distribution<?> evidence, final Distribution<?>... hypotheses) {
    final Distribution<Boolean> hypothesis = hypotheses.length == 1 ? Distribution.<Boolean>coerce(hypotheses[0])
        : Distribution.reduce(Operation.AND, hypotheses).map(Values::toBoolean);
    final Probability pHypothesis = hypothesis.P();
    if (pHypothesis.isZero() || pHypothesis.isOne()) {
      throw new DomainException("likelihood ratio needs an uncertain hypothesis");
    }
    final double pGiven = evidence.given(hypothesis).P().doubleValue();
    final double pGivenNot = evidence.given(hypothesis.not()).P().doubleValue();
    return pGiven / pGivenNot;
  }
}
