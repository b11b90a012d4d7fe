package ai.statues;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import ai.statues.prob.Probability;
import ai.statues.util.Values;
import lombok.experimental.UtilityClass;

/**
 * Drains the enumeration of a root node into a distribution.
 */
@UtilityClass
public class Collector {
  /**
   * Sums the weights of every distinct value enumerated from {@code root},
   * in order of first occurrence, without normalizing. Values equal under
   * {@link Values#equal} are summed under the first one seen.
   */
  public <V> Map<V, Probability> accumulate(final Distribution<V> root, final Settings settings,
      final Evidence evidence) {
    final Distribution<V> conditioned = evidence == null || evidence.getConditions().isEmpty() ? root
        : new Filter<>(root, evidence.getConditions());
    final Map<Object, V> representatives = new LinkedHashMap<>();
    final Map<Object, Probability> sums = new HashMap<>();
    try (final EvaluationPass pass = evidence == null ? EvaluationPass.open(conditioned, settings)
        : EvaluationPass.open(conditioned, settings, evidence.getObservations())) {
      final Iterator<Outcome<V>> outcomes = pass.iterate(conditioned);
      while (outcomes.hasNext()) {
        final Outcome<V> outcome = outcomes.next();
        if (outcome.value() == null) {
          throw new EvaluationException("null value");
        }
        final Object key = Values.key(outcome.value());
        representatives.putIfAbsent(key, outcome.value());
        sums.merge(key, outcome.weight(), Probability::add);
      }
    }
    final Map<V, Probability> weights = new LinkedHashMap<>();
    representatives.forEach((key, value) -> weights.put(value, sums.get(key)));
    return weights;
  }

  /**
   * Evaluates {@code root} into a normalized leaf, sorted if the settings ask
   * for it and the values admit a natural order.
   *
   * @throws InfeasibleQueryException if no value has a positive weight
   */
  public <V> Leaf<V> collect(final Distribution<V> root, final Settings settings, final Evidence evidence) {
    final Map<V, Probability> weights = accumulate(root, settings, evidence);
    if (weights.values().stream().allMatch(Probability::isZero)) {
      throw new InfeasibleQueryException();
    }
    return Leaf.of(weights, settings.isSorting(), true);
  }
}
