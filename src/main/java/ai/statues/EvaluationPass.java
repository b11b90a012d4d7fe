package ai.statues;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import ai.statues.prob.Probability;
import ai.statues.util.ExpandingIterator;
import lombok.Getter;

/**
 * One enumeration of a distribution graph. The pass owns the usage plan,
 * computed once from the root, and the binding slots that tie every shared
 * node to a single value while the outcomes derived from that value are
 * enumerated.
 * <p>
 * A node referenced once under the root is enumerated directly. A node
 * referenced more than once, or first met during enumeration (as the inner
 * distributions of a {@link Flatten}), binds each value before handing it out
 * and releases the binding when exhausted; any reference reached while it is
 * bound sees only that value, with unit weight. Since the inner distributions
 * of a flatten are only known during enumeration, a graph holding one binds
 * every node.
 * <p>
 * Passes are single use and not thread safe. {@link #close()} releases every
 * binding, so a pass that failed midway leaves nothing behind.
 */
public final class EvaluationPass implements AutoCloseable {
  private enum Usage {
    SINGLE, SHARED
  }

  private final Map<Distribution<?>, Usage> plan = new IdentityHashMap<>();
  private final Map<Distribution<?>, Outcome<?>> bindings = new IdentityHashMap<>();
  // Set when the graph holds a Flatten, whose inner nodes may alias any node.
  private boolean dynamic;
  @Getter
  private final Settings settings;

  private EvaluationPass(final Settings settings) {
    this.settings = settings;
  }

  public static EvaluationPass open(final Distribution<?> root, final Settings settings) {
    final EvaluationPass pass = new EvaluationPass(settings);
    pass.visit(root);
    return pass;
  }

  /**
   * Opens a pass in which the given leaves are bound to their observed values.
   */
  public static EvaluationPass open(final Distribution<?> root, final Settings settings,
      final Map<Leaf<?>, Object> observations) {
    final EvaluationPass pass = open(root, settings);
    for (final Map.Entry<Leaf<?>, Object> observation : observations.entrySet()) {
      final Probability one = observation.getKey().probabilityType().one();
      pass.bindings.put(observation.getKey(), new Outcome<>(observation.getValue(), one));
    }
    return pass;
  }

  private void visit(final Distribution<?> node) {
    if (plan.putIfAbsent(node, Usage.SINGLE) == null) {
      dynamic |= node instanceof Flatten;
      for (final Distribution<?> child : node.children()) {
        visit(child);
      }
    } else {
      plan.put(node, Usage.SHARED);
    }
  }

  public boolean isBound(final Distribution<?> node) {
    return bindings.containsKey(node);
  }

  /**
   * Number of nodes referenced more than once under the root.
   */
  public int sharedCount() {
    return (int) plan.values().stream().filter(u -> u == Usage.SHARED).count();
  }

  /**
   * Enumerates a node under the current bindings. The mode is decided when the
   * iterator is first advanced, not when it is created.
   */
  public <V> Iterator<Outcome<V>> iterate(final Distribution<V> node) {
    return new Binder<>(node);
  }

  /**
   * Enumerates the cartesian product of the given nodes, leftmost varying
   * slowest. Weights are multiplied.
   */
  public Iterator<Outcome<ImmutableList<Object>>> iterateAll(final List<? extends Distribution<?>> nodes) {
    if (nodes.isEmpty()) {
      return Iterators.singletonIterator(new Outcome<>(ImmutableList.of(), settings.getProbabilityType().one()));
    }
    return extend(nodes, 0, new ArrayList<>(), null);
  }

  private Iterator<Outcome<ImmutableList<Object>>> extend(final List<? extends Distribution<?>> nodes,
      final int index, final List<Object> prefix, final Probability weight) {
    return new ExpandingIterator.Lambda<Outcome<?>, Outcome<ImmutableList<Object>>>(iterate(nodes.get(index)),
        outcome -> {
          final Probability product = weight == null ? outcome.weight() : weight.multiply(outcome.weight());
          final List<Object> values = new ArrayList<>(prefix);
          values.add(outcome.value());
          if (index == nodes.size() - 1) {
            return Iterators.singletonIterator(new Outcome<>(ImmutableList.copyOf(values), product));
          }
          return extend(nodes, index + 1, values, product);
        });
  }

  @Override
  public void close() {
    bindings.clear();
  }

  private final class Binder<V> implements Iterator<Outcome<V>> {
    private final Distribution<V> node;
    private Iterator<Outcome<V>> raw;
    private boolean binds;
    private Outcome<V> next;
    private boolean needsAdvance = true, isTerminal = false;

    Binder(final Distribution<V> node) {
      this.node = node;
    }

    @SuppressWarnings("unchecked")
    private void start() {
      final Outcome<?> bound = bindings.get(node);
      if (bound != null) {
        raw = Iterators.singletonIterator(new Outcome<>((V) bound.value(), bound.weight().type().one()));
      } else {
        binds = dynamic || plan.get(node) != Usage.SINGLE;
        raw = node.generate(EvaluationPass.this);
      }
    }

    private void advance() {
      needsAdvance = false;
      if (raw == null) {
        start();
      }
      if (raw.hasNext()) {
        next = raw.next();
        if (binds) {
          bindings.put(node, next);
        }
      } else {
        if (binds) {
          bindings.remove(node);
        }
        isTerminal = true;
      }
    }

    @Override
    public boolean hasNext() {
      if (needsAdvance) {
        advance();
      }
      return !isTerminal;
    }

    @Override
    public Outcome<V> next() {
      if (needsAdvance) {
        advance();
      }
      if (isTerminal) {
        throw new NoSuchElementException();
      }

      needsAdvance = true;
      return next;
    }
  }
}
