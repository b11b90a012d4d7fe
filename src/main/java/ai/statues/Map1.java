package ai.statues;

import java.util.Iterator;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

/**
 * A unary {@link MapN}.
 */
public class Map1<T, R> extends MapN<R> {
  private final Function<? super T, ? extends R> unary;
  private final Distribution<T> argument;

  @SuppressWarnings("unchecked")
  public Map1(final String tag, final Function<? super T, ? extends R> function, final Distribution<T> argument) {
    super(tag, values -> function.apply((T) values.get(0)), ImmutableList.<Distribution<?>>of(argument));
    this.unary = function;
    this.argument = argument;
  }

  @Override
  protected Iterator<Outcome<R>> generate(final EvaluationPass pass) {
    return Iterators.transform(pass.iterate(argument),
        o -> new Outcome<>(result(ImmutableList.<Object>of(o.value())), o.weight()));
  }

  @Override
  protected R sample(final SamplingPass pass) {
    return result(ImmutableList.<Object>of(pass.sample(argument)));
  }

  @Override
  protected Distribution<R> copy(final Cloner cloner) {
    return new Map1<>(getTag(), unary, cloner.of(argument));
  }
}
