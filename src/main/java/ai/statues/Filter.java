package ai.statues;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import ai.statues.prob.Probability;
import ai.statues.util.ExpandingIterator;
import lombok.Getter;

/**
 * A target distribution restricted to the cases where every guard is true.
 * Guards are enumerated in order, each one only once the previous ones are
 * true, and the target is enumerated under the bindings they establish.
 */
public class Filter<V> extends Distribution<V> {
  @Getter
  private final Distribution<V> target;
  private final ImmutableList<Distribution<?>> guards;

  public Filter(final Distribution<V> target, final List<? extends Distribution<?>> guards) {
    this.target = target;
    this.guards = ImmutableList.copyOf(guards);
  }

  public List<Distribution<?>> getGuards() {
    return guards;
  }

  @Override
  public List<Distribution<?>> children() {
    return ImmutableList.<Distribution<?>>builder().add(target).addAll(guards).build();
  }

  static boolean holds(final Object guardValue) {
    if (guardValue instanceof Boolean b) {
      return b;
    }
    throw new EvaluationException("condition value '" + guardValue + "' is not boolean");
  }

  @Override
  protected Iterator<Outcome<V>> generate(final EvaluationPass pass) {
    return guarded(pass, 0, null);
  }

  private Iterator<Outcome<V>> guarded(final EvaluationPass pass, final int index, final Probability weight) {
    if (index == guards.size()) {
      final Iterator<Outcome<V>> outcomes = pass.iterate(target);
      return weight == null ? outcomes : Iterators.transform(outcomes, o -> o.scaled(weight));
    }
    return new ExpandingIterator.Lambda<Outcome<?>, Outcome<V>>(pass.iterate(guards.get(index)), guard -> {
      if (!holds(guard.value())) {
        return Collections.emptyIterator();
      }
      return guarded(pass, index + 1, weight == null ? guard.weight() : weight.multiply(guard.weight()));
    });
  }

  @Override
  protected V sample(final SamplingPass pass) {
    for (final Distribution<?> guard : guards) {
      if (!holds(pass.sample(guard))) {
        throw SamplingPass.REJECTED;
      }
    }
    return pass.sample(target);
  }

  @Override
  protected Distribution<V> copy(final Cloner cloner) {
    return new Filter<>(cloner.of(target), cloner.all(guards));
  }
}
