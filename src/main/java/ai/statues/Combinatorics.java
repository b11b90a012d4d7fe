package ai.statues;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;

import org.apache.commons.math3.util.Combinations;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.math.BigIntegerMath;

import ai.statues.prob.Probability;
import ai.statues.prob.ProbabilityType;
import ai.statues.util.Values;
import lombok.experimental.UtilityClass;

/**
 * Repeated operations and draws over the evaluated distribution of a node.
 * Results are fresh leaves, independent of their input.
 */
@UtilityClass
public class Combinatorics {
  /**
   * Combines {@code n} independent copies of a distribution with {@code op},
   * by repeated doubling.
   *
   * @throws DomainException if {@code n} is not positive
   */
  public Leaf<Object> times(final Distribution<?> distribution, final int n, final BinaryOperator<Object> op) {
    if (n <= 0) {
      throw new DomainException("times requires a strictly positive count, got " + n);
    }
    return times(asObjects(distribution.evaluate()), n, op);
  }

  @SuppressWarnings("unchecked")
  private Leaf<Object> asObjects(final Leaf<?> leaf) {
    return (Leaf<Object>) leaf;
  }

  private Leaf<Object> times(final Leaf<Object> base, final int n, final BinaryOperator<Object> op) {
    if (n == 1) {
      return base.clone();
    }
    final Leaf<Object> half = times(base, n / 2, op);
    Distribution<Object> result = new Map2<>("times", op, half, half.clone());
    if (n % 2 == 1) {
      result = new Map2<>("times", op, result, base);
    }
    return result.evaluate(Distribution.settingsFor(base));
  }

  /**
   * The tuples of {@code n} independent draws, in draw order.
   *
   * @throws DomainException if {@code n} is negative
   */
  @SuppressWarnings("unchecked")
  public Leaf<ImmutableList<Object>> timesTuple(final Distribution<?> distribution, final int n) {
    if (n < 0) {
      throw new DomainException("timesTuple requires a non-negative count, got " + n);
    }
    final Leaf<?> base = distribution.evaluate();
    if (n == 0) {
      return Leaf.certain(ImmutableList.of(), Distribution.settingsFor(base));
    }
    final Leaf<Object> singletons = asObjects(base.map(v -> ImmutableList.of(v)).evaluate());
    return (Leaf<ImmutableList<Object>>) (Leaf<?>) times(singletons, n, Values::add);
  }

  /**
   * Draws {@code n} values.
   *
   * @throws DomainException if {@code n} is negative or, without replacement,
   *                         exceeds the number of values
   */
  public Leaf<ImmutableList<Object>> draw(final Distribution<?> distribution, final int n, final boolean sorted,
      final boolean replacement) {
    if (n < 0) {
      throw new DomainException("cannot draw a negative number of values");
    }
    final Leaf<Object> base = asObjects(distribution.evaluate());
    if (!replacement && n > base.size()) {
      throw new DomainException("number of values to draw exceeds the number of possible values");
    }
    if (n == 0) {
      return Leaf.certain(ImmutableList.of(), Distribution.settingsFor(base));
    }
    if (replacement) {
      return sorted ? selections(base, n, true) : timesTuple(base, n);
    }
    if (sorted) {
      return base.isUniform() ? selections(base, n, false) : sortTuples(orderedWithoutReplacement(base, n));
    }
    return orderedWithoutReplacement(base, n);
  }

  /**
   * Sorted draws weighted by the number of orders they can be drawn in,
   * {@code n!} over the factorials of the run lengths, times the product of
   * the drawn weights.
   */
  private Leaf<ImmutableList<Object>> selections(final Leaf<Object> base, final int n, final boolean replacement) {
    final BigInteger permutations = BigIntegerMath.factorial(n);
    final ProbabilityType type = base.probabilityType();
    final Iterator<int[]> selections = replacement ? combinationsWithReplacement(base.size(), n)
        : new Combinations(base.size(), n).iterator();
    final Map<ImmutableList<Object>, Probability> weights = new LinkedHashMap<>();
    while (selections.hasNext()) {
      final int[] selection = selections.next();
      BigInteger count = permutations;
      int runLength = 0, previous = -1;
      for (final int index : selection) {
        if (index != previous) {
          previous = index;
          runLength = 1;
        } else {
          ++runLength;
          count = count.divide(BigInteger.valueOf(runLength));
        }
      }
      Probability weight = type.coerce(count);
      final List<Object> tuple = new ArrayList<>(n);
      for (final int index : selection) {
        weight = weight.multiply(base.outcomes().get(index).weight());
        tuple.add(base.outcomes().get(index).value());
      }
      weights.put(ImmutableList.copyOf(tuple), weight);
    }
    return Leaf.of(weights, true, true);
  }

  /**
   * Non-decreasing index arrays of length {@code n} over {@code [0, k)}, in
   * lexicographic order.
   */
  private Iterator<int[]> combinationsWithReplacement(final int k, final int n) {
    return new AbstractIterator<int[]>() {
      private int[] current;

      @Override
      protected int[] computeNext() {
        if (current == null) {
          current = new int[n];
          return current.clone();
        }
        int i = n - 1;
        while (i >= 0 && current[i] == k - 1) {
          --i;
        }
        if (i < 0) {
          return endOfData();
        }
        final int next = current[i] + 1;
        for (int j = i; j < n; ++j) {
          current[j] = next;
        }
        return current.clone();
      }
    };
  }

  private Leaf<ImmutableList<Object>> orderedWithoutReplacement(final Leaf<Object> base, final int n) {
    final Map<ImmutableList<Object>, Probability> weights = new LinkedHashMap<>();
    drawRemaining(base.outcomes(), n, new ArrayList<>(), null, weights);
    return Leaf.of(weights, true, true);
  }

  private void drawRemaining(final List<Outcome<Object>> remaining, final int n, final List<Object> prefix,
      final Probability weight, final Map<ImmutableList<Object>, Probability> weights) {
    if (n == 0) {
      weights.put(ImmutableList.copyOf(prefix), weight);
      return;
    }
    Probability total = remaining.get(0).weight();
    for (int i = 1; i < remaining.size(); ++i) {
      total = total.add(remaining.get(i).weight());
    }
    for (int i = 0; i < remaining.size(); ++i) {
      final Outcome<Object> drawn = remaining.get(i);
      final Probability p = drawn.weight().divide(total);
      final List<Outcome<Object>> rest = new ArrayList<>(remaining);
      rest.remove(i);
      prefix.add(drawn.value());
      drawRemaining(rest, n - 1, prefix, weight == null ? p : weight.multiply(p), weights);
      prefix.remove(prefix.size() - 1);
    }
  }

  private Leaf<ImmutableList<Object>> sortTuples(final Leaf<ImmutableList<Object>> tuples) {
    final Map<ImmutableList<Object>, Probability> weights = new LinkedHashMap<>();
    for (final Outcome<ImmutableList<Object>> outcome : tuples.outcomes()) {
      final List<Object> sorted = new ArrayList<>(outcome.value());
      if (Values.isSortable(sorted)) {
        sorted.sort(Values.ORDER);
      }
      weights.merge(ImmutableList.copyOf(sorted), outcome.weight(), Probability::add);
    }
    return Leaf.of(weights, true, true);
  }
}
