package ai.statues;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The joint distribution of several nodes, as tuples of their values.
 */
public class Product extends Distribution<ImmutableList<Object>> {
  private final ImmutableList<Distribution<?>> factors;

  public Product(final List<? extends Distribution<?>> factors) {
    this.factors = ImmutableList.copyOf(factors);
  }

  @Override
  public List<Distribution<?>> children() {
    return factors;
  }

  @Override
  protected Iterator<Outcome<ImmutableList<Object>>> generate(final EvaluationPass pass) {
    return pass.iterateAll(factors);
  }

  @Override
  protected ImmutableList<Object> sample(final SamplingPass pass) {
    final List<Object> values = new ArrayList<>(factors.size());
    for (final Distribution<?> factor : factors) {
      values.add(pass.sample(factor));
    }
    return ImmutableList.copyOf(values);
  }

  @Override
  protected Distribution<ImmutableList<Object>> copy(final Cloner cloner) {
    return new Product(cloner.all(factors));
  }
}
