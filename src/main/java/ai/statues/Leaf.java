package ai.statues;

import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.apache.commons.math3.util.CombinatoricsUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import ai.statues.prob.Probability;
import ai.statues.prob.ProbabilityType;
import ai.statues.util.Values;
import io.reactivex.Observable;
import lombok.val;

/**
 * An atomic distribution: a finite list of distinct values with their
 * probabilities, which sum to one. Every leaf is a random variable of its own,
 * even when numerically identical to another.
 * <p>
 * The cumulative tables and the random cursor are built lazily and are not
 * thread safe.
 */
public class Leaf<V> extends Distribution<V> implements Serializable {
  private static final long serialVersionUID = 4207265103402165387L;

  private final ImmutableList<Outcome<V>> outcomes;

  private transient Random random;
  private transient ImmutableList<V> values;
  private transient ImmutableList<Probability> probabilities, cumulative, inverseCumulative;
  private transient double[] cumulativeDoubles;
  private transient Map<Object, Probability> index;
  private transient Boolean sorted;

  Leaf(final ImmutableList<Outcome<V>> outcomes) {
    this.outcomes = outcomes;
    init();
  }

  private void readObject(final ObjectInputStream o) throws ClassNotFoundException, IOException {
    o.defaultReadObject();
    init();
  }

  private void init() {
    random = new Random();
  }

  // Construction

  /**
   * Builds a leaf from raw weights, dropping zero weights. Values are kept in
   * iteration order unless {@code sort} is set and they admit a natural order.
   *
   * @throws ConstructionException if no value has a positive weight
   */
  static <V> Leaf<V> of(final Map<V, Probability> weights, final boolean sort, final boolean normalize) {
    // Numerically equal values such as 1 and 1.0 merge under the first one seen.
    final Map<Object, V> representatives = new LinkedHashMap<>();
    final Map<Object, Probability> merged = new HashMap<>();
    for (final Map.Entry<V, Probability> entry : weights.entrySet()) {
      final Object key = Values.key(Preconditions.checkNotNull(entry.getKey(), "null value"));
      representatives.putIfAbsent(key, entry.getKey());
      merged.merge(key, entry.getValue(), Probability::add);
    }

    final List<V> keys = new ArrayList<>();
    Probability total = null;
    for (final Map.Entry<Object, V> entry : representatives.entrySet()) {
      final Probability weight = merged.get(entry.getKey());
      final int signum = weight.signum();
      if (signum < 0) {
        throw new DomainException("negative probability " + weight + " for value '" + entry.getValue() + "'");
      }
      if (signum > 0) {
        keys.add(entry.getValue());
        total = total == null ? weight : total.add(weight);
      }
    }
    if (keys.isEmpty()) {
      throw new ConstructionException("no value");
    }
    if (sort && Values.isSortable(keys)) {
      keys.sort(Values.ORDER);
    }

    final boolean divide = normalize && !total.isOne();
    final ImmutableList.Builder<Outcome<V>> builder = ImmutableList.builder();
    for (final V value : keys) {
      final Probability weight = merged.get(Values.key(value));
      builder.add(new Outcome<>(value, divide ? weight.divide(total) : weight));
    }
    return new Leaf<>(builder.build());
  }

  private static Probability checked(final Probability p, final Settings settings) {
    if (settings.isCheckProbabilities() && (p.signum() < 0 || p.compareTo(p.type().one()) > 0)) {
      throw new DomainException("probability " + p + " is out of [0,1]");
    }
    return p;
  }

  @SafeVarargs
  public static <V> Leaf<V> fromValues(final V... values) {
    return fromValues(Arrays.asList(values), Settings.DEFAULT);
  }

  /**
   * Builds a leaf in which each value is weighted by its number of
   * occurrences.
   */
  public static <V> Leaf<V> fromValues(final Collection<? extends V> values, final Settings settings) {
    return fromCounts(values, settings, settings.isSorting());
  }

  /**
   * Same as {@link #fromValues(Collection, Settings)} but keeps values in order
   * of first occurrence.
   */
  public static <V> Leaf<V> fromSequence(final Collection<? extends V> values, final Settings settings) {
    return fromCounts(values, settings, false);
  }

  private static <V> Leaf<V> fromCounts(final Collection<? extends V> values, final Settings settings,
      final boolean sort) {
    final Map<V, Long> counts = new LinkedHashMap<>();
    for (final V value : values) {
      counts.merge(Preconditions.checkNotNull(value, "null value"), 1L, Long::sum);
    }
    final ProbabilityType type = settings.getProbabilityType();
    final Map<V, Probability> weights = new LinkedHashMap<>();
    counts.forEach((value, count) -> weights.put(value, type.of(count)));
    return of(weights, sort, true);
  }

  public static <V> Leaf<V> fromMap(final Map<? extends V, ?> weights) {
    return fromMap(weights, Settings.DEFAULT);
  }

  /**
   * Builds a leaf from values mapped to weights. Weights are proportional and
   * are normalized; they may be numbers, probabilities or literals such as
   * {@code "1/3"}.
   */
  public static <V> Leaf<V> fromMap(final Map<? extends V, ?> weights, final Settings settings) {
    return fromValueFreqs(weights.entrySet(), settings);
  }

  /**
   * Builds a leaf from value/weight pairs, summing the weights of duplicate
   * values.
   */
  public static <V> Leaf<V> fromValueFreqs(final Iterable<? extends Map.Entry<? extends V, ?>> pairs,
      final Settings settings) {
    final ProbabilityType type = settings.getProbabilityType();
    final Map<V, Probability> weights = new LinkedHashMap<>();
    for (final Map.Entry<? extends V, ?> pair : pairs) {
      final Probability weight = type.coerce(pair.getValue());
      if (settings.isCheckProbabilities() && weight.signum() < 0) {
        throw new DomainException("negative weight " + weight + " for value '" + pair.getKey() + "'");
      }
      weights.merge(Preconditions.checkNotNull(pair.getKey(), "null value"), weight, Probability::add);
    }
    return of(weights, settings.isSorting(), true);
  }

  /**
   * Builds a leaf from value/weight pairs, keeping the given order.
   *
   * @throws ConstructionException if a value is given twice
   */
  public static <V> Leaf<V> ordered(final Iterable<? extends Map.Entry<? extends V, ?>> pairs,
      final Settings settings) {
    final ProbabilityType type = settings.getProbabilityType();
    final Map<V, Probability> weights = new LinkedHashMap<>();
    final Set<Object> keys = new HashSet<>();
    for (final Map.Entry<? extends V, ?> pair : pairs) {
      if (!keys.add(Values.key(Preconditions.checkNotNull(pair.getKey(), "null value")))) {
        throw new ConstructionException("duplicate value '" + pair.getKey() + "'");
      }
      weights.put(pair.getKey(), type.coerce(pair.getValue()));
    }
    return of(weights, false, true);
  }

  public static <V> Leaf<V> certain(final V value) {
    return certain(value, Settings.DEFAULT);
  }

  public static <V> Leaf<V> certain(final V value, final Settings settings) {
    Preconditions.checkNotNull(value, "null value");
    return new Leaf<>(ImmutableList.of(new Outcome<>(value, settings.getProbabilityType().one())));
  }

  /**
   * Equiprobable integers from {@code from} to {@code to}, inclusive.
   */
  public static Leaf<Integer> interval(final int from, final int to) {
    return interval(from, to, Settings.DEFAULT);
  }

  public static Leaf<Integer> interval(final int from, final int to, final Settings settings) {
    final List<Integer> values = new ArrayList<>();
    for (int i = from; i <= to; ++i) {
      values.add(i);
    }
    return fromValues(values, settings);
  }

  /**
   * A boolean that is true with probability {@code p}.
   */
  public static Leaf<Boolean> boolProb(final Object p) {
    return boolProb(p, Settings.DEFAULT);
  }

  public static Leaf<Boolean> boolProb(final long numerator, final long denominator) {
    return boolProb(Settings.DEFAULT.getProbabilityType().of(numerator, denominator), Settings.DEFAULT);
  }

  public static Leaf<Boolean> boolProb(final Object p, final Settings settings) {
    final Probability pTrue = checked(settings.getProbabilityType().coerce(p), settings);
    final Map<Boolean, Probability> weights = new LinkedHashMap<>();
    weights.put(false, pTrue.type().one().subtract(pTrue));
    weights.put(true, pTrue);
    return of(weights, false, false);
  }

  /**
   * 1 with probability {@code p}, 0 otherwise.
   */
  public static Leaf<Integer> bernoulli(final Object p) {
    return bernoulli(p, Settings.DEFAULT);
  }

  public static Leaf<Integer> bernoulli(final Object p, final Settings settings) {
    final Probability pOne = checked(settings.getProbabilityType().coerce(p), settings);
    final Map<Integer, Probability> weights = new LinkedHashMap<>();
    weights.put(0, pOne.type().one().subtract(pOne));
    weights.put(1, pOne);
    return of(weights, false, false);
  }

  /**
   * The number of successes among {@code n} independent trials of probability
   * {@code p}.
   */
  public static Leaf<Integer> binom(final int n, final Object p) {
    return binom(n, p, Settings.DEFAULT);
  }

  public static Leaf<Integer> binom(final int n, final Object p, final Settings settings) {
    Preconditions.checkArgument(n >= 0, "negative number of trials");
    final ProbabilityType type = settings.getProbabilityType();
    final Probability success = checked(type.coerce(p), settings);
    final Probability failure = type.one().subtract(success);
    final Map<Integer, Probability> weights = new LinkedHashMap<>();
    for (int k = 0; k <= n; ++k) {
      Probability weight = type.coerce(CombinatoricsUtils.binomialCoefficient(n, k));
      for (int i = 0; i < k; ++i) {
        weight = weight.multiply(success);
      }
      for (int i = k; i < n; ++i) {
        weight = weight.multiply(failure);
      }
      weights.put(k, weight);
    }
    return of(weights, false, false);
  }

  public static Leaf<Integer> poisson(final double mean) {
    return poisson(mean, 1e-20);
  }

  /**
   * A Poisson distribution truncated to the values whose probability reaches
   * {@code precision}. Probabilities are floats.
   */
  public static Leaf<Integer> poisson(final double mean, final double precision) {
    Preconditions.checkArgument(mean > 0, "mean must be positive");
    final Map<Integer, Probability> weights = new LinkedHashMap<>();
    double p = Math.exp(-mean);
    int k = 0;
    while (p >= precision || k <= mean) {
      if (p >= precision) {
        weights.put(k, ProbabilityType.FLOAT.of(p));
      }
      ++k;
      p = p * mean / k;
    }
    return of(weights, false, true);
  }

  // Queries

  @Override
  public Leaf<V> evaluate() {
    return this;
  }

  public ImmutableList<Outcome<V>> outcomes() {
    return outcomes;
  }

  public ProbabilityType probabilityType() {
    return outcomes.get(0).weight().type();
  }

  public int size() {
    return outcomes.size();
  }

  public ImmutableList<V> values() {
    if (values == null) {
      values = outcomes.stream().map(Outcome::value).collect(ImmutableList.toImmutableList());
    }
    return values;
  }

  public ImmutableList<Probability> probabilities() {
    if (probabilities == null) {
      probabilities = outcomes.stream().map(Outcome::weight).collect(ImmutableList.toImmutableList());
    }
    return probabilities;
  }

  /**
   * The probability of {@code value}, zero if it is not in the support.
   */
  @Override
  public Probability probability(final Object value) {
    if (index == null) {
      final Map<Object, Probability> built = new HashMap<>();
      for (final Outcome<V> outcome : outcomes) {
        built.put(Values.key(outcome.value()), outcome.weight());
      }
      index = built;
    }
    final Probability p = index.get(Values.key(value));
    return p == null ? probabilityType().zero() : p;
  }

  /**
   * Prefix sums of the probabilities in value order: {@code n + 1} entries,
   * from zero to one.
   */
  @Override
  public ImmutableList<Probability> cumulative() {
    if (cumulative == null) {
      val builder = ImmutableList.<Probability>builder();
      Probability sum = probabilityType().zero();
      builder.add(sum);
      for (final Outcome<V> outcome : outcomes) {
        sum = sum.add(outcome.weight());
        builder.add(sum);
      }
      cumulative = builder.build();
    }
    return cumulative;
  }

  /**
   * Suffix sums of the probabilities in value order: {@code n + 1} entries,
   * from one to zero. Entry {@code i} is the probability of being at least the
   * {@code i}th value.
   */
  @Override
  public ImmutableList<Probability> inverseCumulative() {
    if (inverseCumulative == null) {
      final Probability[] sums = new Probability[outcomes.size() + 1];
      Probability sum = probabilityType().zero();
      sums[outcomes.size()] = sum;
      for (int i = outcomes.size() - 1; i >= 0; --i) {
        sum = sum.add(outcomes.get(i).weight());
        sums[i] = sum;
      }
      inverseCumulative = ImmutableList.copyOf(sums);
    }
    return inverseCumulative;
  }

  private boolean isSorted() {
    if (sorted == null) {
      boolean result = Values.isSortable(values());
      for (int i = 1; result && i < outcomes.size(); ++i) {
        result = Values.compare(values().get(i - 1), values().get(i)) < 0;
      }
      sorted = result;
    }
    return sorted;
  }

  // Number of values strictly below (strict) or at most (!strict) the given
  // one, by binary search on the sorted values.
  private int bisect(final Object value, final boolean strict) {
    int lo = 0, hi = outcomes.size();
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      final int c = Values.compare(values().get(mid), value);
      if (c < 0 || !strict && c == 0) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  /**
   * The probability of a value lower than or equal to {@code value}, which
   * need not be in the support.
   */
  public Probability probabilityAtMost(final Object value) {
    if (isSorted()) {
      return cumulative().get(bisect(value, false));
    }
    Probability sum = probabilityType().zero();
    for (final Outcome<V> outcome : outcomes) {
      if (Values.compare(outcome.value(), value) <= 0) {
        sum = sum.add(outcome.weight());
      }
    }
    return sum;
  }

  /**
   * The probability of a value greater than or equal to {@code value}, which
   * need not be in the support.
   */
  public Probability probabilityAtLeast(final Object value) {
    if (isSorted()) {
      return inverseCumulative().get(bisect(value, true));
    }
    Probability sum = probabilityType().zero();
    for (final Outcome<V> outcome : outcomes) {
      if (Values.compare(outcome.value(), value) >= 0) {
        sum = sum.add(outcome.weight());
      }
    }
    return sum;
  }

  public boolean isUniform() {
    final Probability first = outcomes.get(0).weight();
    return outcomes.stream().allMatch(o -> o.weight().compareTo(first) == 0);
  }

  /**
   * The same distribution with float probabilities.
   */
  public Leaf<V> withFloatProbabilities() {
    return new Leaf<>(outcomes.stream()
        .map(o -> new Outcome<>(o.value(), ProbabilityType.FLOAT.of(o.weight().doubleValue())))
        .collect(ImmutableList.toImmutableList()));
  }

  // Sampling

  public V sample() {
    return sample(random);
  }

  /**
   * Draws a value by inverse transform sampling.
   */
  public V sample(final Random random) {
    if (cumulativeDoubles == null) {
      final double[] built = new double[outcomes.size() + 1];
      for (int i = 0; i < outcomes.size(); ++i) {
        built[i + 1] = built[i] + outcomes.get(i).weight().doubleValue();
      }
      cumulativeDoubles = built;
    }
    final double u = random.nextDouble() * cumulativeDoubles[outcomes.size()];
    int lo = 0, hi = outcomes.size() - 1;
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      if (u < cumulativeDoubles[mid + 1]) {
        hi = mid;
      } else {
        lo = mid + 1;
      }
    }
    return outcomes.get(lo).value();
  }

  public List<V> sample(final int n) {
    final List<V> samples = new ArrayList<>(n);
    for (int i = 0; i < n; ++i) {
      samples.add(sample());
    }
    return samples;
  }

  /**
   * An endless stream of independent samples.
   */
  public Observable<V> rxSamples() {
    return Observable.generate(emitter -> emitter.onNext(sample()));
  }

  /**
   * Draws {@code n} distinct values, each drawn among the values not drawn yet
   * with probabilities proportional to their weights.
   *
   * @throws DomainException if {@code n} exceeds the number of values
   */
  public List<V> randomDraw(final int n, final boolean sorted) {
    if (n < 0 || n > outcomes.size()) {
      throw new DomainException("cannot draw " + n + " distinct values among " + outcomes.size());
    }
    final List<Outcome<V>> remaining = new ArrayList<>(outcomes);
    final List<V> drawn = new ArrayList<>(n);
    for (int i = 0; i < n; ++i) {
      double total = 0;
      for (final Outcome<V> outcome : remaining) {
        total += outcome.weight().doubleValue();
      }
      double u = random.nextDouble() * total;
      final Iterator<Outcome<V>> it = remaining.iterator();
      Outcome<V> picked = null;
      while (it.hasNext()) {
        picked = it.next();
        u -= picked.weight().doubleValue();
        if (u < 0 || !it.hasNext()) {
          it.remove();
          break;
        }
      }
      drawn.add(picked.value());
    }
    if (sorted && Values.isSortable(drawn)) {
      drawn.sort(Values.ORDER);
    }
    return drawn;
  }

  // Graph

  @Override
  public List<Distribution<?>> children() {
    return ImmutableList.of();
  }

  @Override
  protected Iterator<Outcome<V>> generate(final EvaluationPass pass) {
    return outcomes.iterator();
  }

  @Override
  protected V sample(final SamplingPass pass) {
    return sample(pass.getRandom());
  }

  @Override
  protected Distribution<V> copy(final Cloner cloner) {
    return clone();
  }

  /**
   * An independent leaf with the same distribution. The value list is shared.
   */
  @Override
  public Leaf<V> clone() {
    return new Leaf<>(outcomes);
  }

  public Map<V, Probability> asMap() {
    final Map<V, Probability> map = Maps.newLinkedHashMap();
    for (final Outcome<V> outcome : outcomes) {
      map.put(outcome.value(), outcome.weight());
    }
    return map;
  }
}
