package ai.statues;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import ai.statues.util.ExpandingIterator;
import ai.statues.util.Values;

/**
 * A conditional probability table: the branch selected by the value of the
 * discriminant, or the default branch for values missing from the table.
 * Keys match discriminant values under {@link Values#equal}.
 */
public class Switch<K, V> extends Distribution<V> {
  private final Distribution<K> discriminant;
  private final Map<K, Distribution<? extends V>> table;
  private final Distribution<? extends V> defaultBranch;
  private final Map<Object, Distribution<? extends V>> branches = new HashMap<>();

  /**
   * @param defaultBranch may be null, in which case values missing from the
   *                      table fail evaluation
   */
  public Switch(final Distribution<K> discriminant, final Map<? extends K, ? extends Distribution<? extends V>> table,
      final Distribution<? extends V> defaultBranch) {
    this.discriminant = discriminant;
    this.table = new LinkedHashMap<>(table);
    this.defaultBranch = defaultBranch;
    this.table.forEach((key, branch) -> branches.putIfAbsent(Values.key(key), branch));
  }

  @Override
  public List<Distribution<?>> children() {
    final ImmutableList.Builder<Distribution<?>> children = ImmutableList.builder();
    children.add(discriminant).addAll(table.values());
    if (defaultBranch != null) {
      children.add(defaultBranch);
    }
    return children.build();
  }

  private Distribution<? extends V> branch(final K key) {
    final Distribution<? extends V> branch = branches.get(Values.key(key));
    if (branch != null) {
      return branch;
    }
    if (defaultBranch == null) {
      throw new EvaluationException(String.format("missing value '%s' in CPT", key));
    }
    return defaultBranch;
  }

  @SuppressWarnings("unchecked")
  @Override
  protected Iterator<Outcome<V>> generate(final EvaluationPass pass) {
    return new ExpandingIterator.Lambda<Outcome<K>, Outcome<V>>(pass.iterate(discriminant),
        key -> Iterators.transform(pass.iterate((Distribution<V>) branch(key.value())),
            o -> o.scaled(key.weight())));
  }

  @Override
  protected V sample(final SamplingPass pass) {
    return pass.sample(branch(pass.sample(discriminant)));
  }

  @Override
  protected Distribution<V> copy(final Cloner cloner) {
    final Map<K, Distribution<? extends V>> copied = new LinkedHashMap<>();
    table.forEach((key, branch) -> copied.put(key, cloner.of(branch)));
    return new Switch<>(cloner.of(discriminant), copied, defaultBranch == null ? null : cloner.of(defaultBranch));
  }
}
