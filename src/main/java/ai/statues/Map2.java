package ai.statues;

import java.util.Iterator;
import java.util.function.BiFunction;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import ai.statues.util.ExpandingIterator;

/**
 * A binary {@link MapN}.
 */
public class Map2<A, B, R> extends MapN<R> {
  private final BiFunction<? super A, ? super B, ? extends R> binary;
  private final Distribution<A> left;
  private final Distribution<B> right;

  @SuppressWarnings("unchecked")
  public Map2(final String tag, final BiFunction<? super A, ? super B, ? extends R> function,
      final Distribution<A> left, final Distribution<B> right) {
    super(tag, values -> function.apply((A) values.get(0), (B) values.get(1)),
        ImmutableList.<Distribution<?>>of(left, right));
    this.binary = function;
    this.left = left;
    this.right = right;
  }

  @Override
  protected Iterator<Outcome<R>> generate(final EvaluationPass pass) {
    return new ExpandingIterator.Lambda<Outcome<A>, Outcome<R>>(pass.iterate(left),
        a -> Iterators.transform(pass.iterate(right), b -> new Outcome<>(
            result(ImmutableList.<Object>of(a.value(), b.value())), a.weight().multiply(b.weight()))));
  }

  @Override
  protected R sample(final SamplingPass pass) {
    return result(ImmutableList.<Object>of(pass.sample(left), pass.sample(right)));
  }

  @Override
  protected Distribution<R> copy(final Cloner cloner) {
    return new Map2<>(getTag(), binary, cloner.of(left), cloner.of(right));
  }
}
