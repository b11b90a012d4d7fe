package ai.statues;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.google.common.base.Preconditions;

import lombok.Getter;

/**
 * One random draw through a distribution graph. Each node is sampled at most
 * once per draw, so shared nodes keep a single value, and a filter whose
 * guards are false rejects the whole draw.
 */
public final class SamplingPass {
  /**
   * Thrown by a node to reject the current draw. Carries no stack trace.
   */
  static final class Rejection extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private Rejection() {
      super("rejected draw", null, false, false);
    }
  }

  static final Rejection REJECTED = new Rejection();

  private final Map<Distribution<?>, Object> values = new IdentityHashMap<>();
  @Getter
  private final Random random;

  private SamplingPass(final Random random) {
    this.random = random;
  }

  @SuppressWarnings("unchecked")
  public <V> V sample(final Distribution<V> node) {
    Object value = values.get(node);
    if (value == null) {
      value = node.sample(this);
      values.put(node, value);
    }
    return (V) value;
  }

  /**
   * Draws {@code n} values of {@code root}, retrying rejected draws up to
   * {@code maxTries} times per value.
   *
   * @throws InfeasibleQueryException if a value could not be drawn within
   *                                  {@code maxTries} attempts
   */
  public static <V> List<V> draw(final Distribution<V> root, final int n, final int maxTries,
      final Evidence evidence, final Random random) {
    Preconditions.checkArgument(n >= 0, "negative sample size");
    Preconditions.checkArgument(maxTries > 0, "maxTries must be positive");
    final Distribution<V> conditioned = evidence == null || evidence.getConditions().isEmpty() ? root
        : new Filter<>(root, evidence.getConditions());
    final List<V> samples = new ArrayList<>(n);
    for (int i = 0; i < n; ++i) {
      samples.add(drawOne(conditioned, maxTries, evidence, random));
    }
    return samples;
  }

  private static <V> V drawOne(final Distribution<V> root, final int maxTries, final Evidence evidence,
      final Random random) {
    for (int tries = 0; tries < maxTries; ++tries) {
      final SamplingPass pass = new SamplingPass(random);
      if (evidence != null) {
        pass.values.putAll(evidence.getObservations());
      }
      try {
        return pass.sample(root);
      } catch (final Rejection e) {
        continue;
      }
    }
    throw new InfeasibleQueryException("no sample satisfies the conditions after " + maxTries + " tries");
  }
}
