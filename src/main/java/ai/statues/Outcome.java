package ai.statues;

import java.io.Serializable;

import ai.statues.prob.Probability;

/**
 * A value with its probability weight, as produced by a distribution's
 * enumeration.
 */
public record Outcome<V>(V value, Probability weight) implements Serializable {
  private static final long serialVersionUID = 1L;

  public Outcome<V> scaled(final Probability factor) {
    return new Outcome<>(value, factor.multiply(weight));
  }

  @Override
  public String toString() {
    return value + " : " + weight;
  }
}
