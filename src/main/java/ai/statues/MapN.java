package ai.statues;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import lombok.Getter;

/**
 * Applies a function to the values of its arguments. The tag names the
 * function, an operator symbol or {@code "f"} for an anonymous function.
 */
public class MapN<R> extends Distribution<R> {
  @Getter
  private final String tag;
  private final Function<? super List<Object>, ? extends R> function;
  private final ImmutableList<Distribution<?>> arguments;

  public MapN(final String tag, final Function<? super List<Object>, ? extends R> function,
      final List<? extends Distribution<?>> arguments) {
    this.tag = tag;
    this.function = function;
    this.arguments = ImmutableList.copyOf(arguments);
  }

  @Override
  public List<Distribution<?>> children() {
    return arguments;
  }

  protected R result(final List<Object> values) {
    final R result = function.apply(values);
    if (result == null) {
      throw new EvaluationException("'" + tag + "' gave no value for " + values);
    }
    return result;
  }

  @Override
  protected Iterator<Outcome<R>> generate(final EvaluationPass pass) {
    return Iterators.transform(pass.iterateAll(arguments), o -> new Outcome<>(result(o.value()), o.weight()));
  }

  @Override
  protected R sample(final SamplingPass pass) {
    final List<Object> values = new ArrayList<>(arguments.size());
    for (final Distribution<?> argument : arguments) {
      values.add(pass.sample(argument));
    }
    return result(values);
  }

  @Override
  protected Distribution<R> copy(final Cloner cloner) {
    return new MapN<>(tag, function, cloner.all(arguments));
  }
}
