package ai.statues;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;

import ai.statues.prob.Probability;
import ai.statues.util.Values;
import lombok.experimental.UtilityClass;

/**
 * Maximum and minimum of independent distributions in linear time, from their
 * cumulative tables.
 * <p>
 * The result is a fresh leaf computed from the evaluated arguments: it keeps
 * no dependency on them, so an expression that also refers to an argument
 * elsewhere treats the two as independent. {@link Distribution#max} and
 * {@link Distribution#min} keep the dependency at exponential cost.
 */
@UtilityClass
public class Extremum {
  public Leaf<Object> fastMax(final Distribution<?>... args) {
    return fold(args, true);
  }

  public Leaf<Object> fastMin(final Distribution<?>... args) {
    return fold(args, false);
  }

  @SuppressWarnings("unchecked")
  private Leaf<Object> fold(final Distribution<?>[] args, final boolean max) {
    Preconditions.checkArgument(args.length > 0, "no argument");
    Leaf<Object> result = (Leaf<Object>) args[0].evaluate();
    if (args.length == 1) {
      return result.clone();
    }
    for (int i = 1; i < args.length; ++i) {
      result = pair(result, args[i].evaluate(), max);
    }
    return result;
  }

  // P(X = v) = P(A = v) P(B ~ v) + (P(A ~ v) - P(A = v)) P(B = v), where ~ is <=
  // for the maximum and >= for the minimum.
  private Leaf<Object> pair(final Leaf<?> a, final Leaf<?> b, final boolean max) {
    final List<Object> values = Values.distinct(Iterables.concat(a.values(), b.values()));
    if (!Values.isSortable(values)) {
      throw new NumericCapabilityException("extremum needs ordered values");
    }
    final Map<Object, Probability> weights = new LinkedHashMap<>();
    for (final Object value : values) {
      final Probability pa = a.probability(value), pb = b.probability(value);
      final Probability ca = max ? a.probabilityAtMost(value) : a.probabilityAtLeast(value);
      final Probability cb = max ? b.probabilityAtMost(value) : b.probabilityAtLeast(value);
      weights.put(value, pa.multiply(cb).add(ca.subtract(pa).multiply(pb)));
    }
    return Leaf.of(weights, true, true);
  }
}
