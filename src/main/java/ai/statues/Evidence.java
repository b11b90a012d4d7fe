package ai.statues;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * Caller-owned conditioning context: observed leaf values and conditions that
 * apply to every query evaluated under it. Each addition returns a
 * {@link Scope} that withdraws exactly that addition when closed.
 *
 * <pre>
 * try (Evidence.Scope scope = evidence.observe(die, 6)) {
 *   total.evaluate(evidence);
 * }
 * </pre>
 */
public class Evidence {
  /**
   * Withdraws an addition to the evidence.
   */
  public interface Scope extends AutoCloseable {
    @Override
    void close();
  }

  private final Map<Leaf<?>, Object> observations = new IdentityHashMap<>();
  private final List<Distribution<?>> conditions = new ArrayList<>();

  /**
   * Forces {@code leaf} to {@code value}.
   *
   * @throws DomainException if the value is impossible for the leaf
   */
  public <V> Scope observe(final Leaf<V> leaf, final V value) {
    Preconditions.checkNotNull(value);
    Preconditions.checkState(!observations.containsKey(leaf), "leaf already observed");
    if (leaf.probability(value).isZero()) {
      throw new DomainException("cannot observe impossible value '" + value + "'");
    }
    observations.put(leaf, value);
    return () -> observations.remove(leaf);
  }

  /**
   * Adds boolean conditions.
   */
  public Scope add(final Distribution<?>... added) {
    final List<Distribution<?>> batch = Arrays.asList(added);
    conditions.addAll(batch);
    return () -> {
      for (final Distribution<?> condition : batch) {
        removeIdentical(condition);
      }
    };
  }

  private void removeIdentical(final Distribution<?> condition) {
    for (int i = conditions.size() - 1; i >= 0; --i) {
      if (conditions.get(i) == condition) {
        conditions.remove(i);
        return;
      }
    }
  }

  public Map<Leaf<?>, Object> getObservations() {
    return Collections.unmodifiableMap(observations);
  }

  public List<Distribution<?>> getConditions() {
    return Collections.unmodifiableList(conditions);
  }

  public boolean isEmpty() {
    return observations.isEmpty() && conditions.isEmpty();
  }
}
