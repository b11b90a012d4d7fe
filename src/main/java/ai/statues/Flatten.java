package ai.statues;

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import ai.statues.util.ExpandingIterator;

/**
 * The mixture of the distributions produced as values by an outer node. Plain
 * values are taken as certain.
 */
public class Flatten<V> extends Distribution<V> {
  private final Distribution<?> outer;

  public Flatten(final Distribution<?> outer) {
    this.outer = outer;
  }

  @Override
  public List<Distribution<?>> children() {
    return ImmutableList.<Distribution<?>>of(outer);
  }

  @SuppressWarnings("unchecked")
  @Override
  protected Iterator<Outcome<V>> generate(final EvaluationPass pass) {
    return new ExpandingIterator.Lambda<Outcome<?>, Outcome<V>>(pass.iterate(outer), o -> {
      if (o.value() instanceof Distribution<?> inner) {
        return Iterators.transform(pass.iterate((Distribution<V>) inner), i -> i.scaled(o.weight()));
      }
      return Iterators.singletonIterator(new Outcome<>((V) o.value(), o.weight()));
    });
  }

  @SuppressWarnings("unchecked")
  @Override
  protected V sample(final SamplingPass pass) {
    final Object value = pass.sample(outer);
    return value instanceof Distribution<?> inner ? pass.sample((Distribution<V>) inner) : (V) value;
  }

  @Override
  protected Distribution<V> copy(final Cloner cloner) {
    return new Flatten<>(cloner.of(outer));
  }
}
