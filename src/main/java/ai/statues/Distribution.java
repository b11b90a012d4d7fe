package ai.statues;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import ai.statues.prob.Probability;
import ai.statues.prob.ProbabilityType;
import ai.statues.util.Values;

/**
 * A discrete random variable, defined as a node in a graph of distributions.
 * Nodes are immutable and freely shared; referencing the same node twice in an
 * expression refers to the same random variable, so {@code x.subtract(x)} is
 * certainly zero. Identity, not value, distinguishes random variables.
 * <p>
 * Evaluation enumerates the graph exactly (see {@link EvaluationPass}) and
 * yields a normalized {@link Leaf}.
 */
public abstract class Distribution<V> {
  private Leaf<V> evaluated;

  protected Distribution() {
  }

  /**
   * The nodes this node is computed from, in enumeration order.
   */
  public abstract List<Distribution<?>> children();

  /**
   * Enumerates the outcomes of this node, pulling children through the given
   * pass. The same value may be produced more than once.
   */
  protected abstract Iterator<Outcome<V>> generate(EvaluationPass pass);

  /**
   * Draws one value, pulling children through the given pass.
   */
  protected abstract V sample(SamplingPass pass);

  protected abstract Distribution<V> copy(Cloner cloner);

  /**
   * Maps every node of a graph to its copy, so that a node shared in the
   * original is shared in the copy.
   */
  protected static final class Cloner {
    private final Map<Distribution<?>, Distribution<?>> clones = new IdentityHashMap<>();

    @SuppressWarnings("unchecked")
    public <T> Distribution<T> of(final Distribution<T> node) {
      Distribution<?> clone = clones.get(node);
      if (clone == null) {
        clone = node.copy(this);
        clones.put(node, clone);
      }
      return (Distribution<T>) clone;
    }

    public ImmutableList<Distribution<?>> all(final List<? extends Distribution<?>> nodes) {
      final ImmutableList.Builder<Distribution<?>> builder = ImmutableList.builder();
      for (final Distribution<?> node : nodes) {
        builder.add(of(node));
      }
      return builder.build();
    }
  }

  /**
   * Wraps a plain value in a certain distribution. Distributions are returned
   * as is.
   */
  @SuppressWarnings("unchecked")
  public static <T> Distribution<T> coerce(final Object value) {
    Preconditions.checkNotNull(value);
    if (value instanceof Distribution<?> d) {
      return (Distribution<T>) d;
    }
    return Leaf.certain((T) value);
  }

  // Evaluation

  /**
   * The normalized distribution of this node. The result is computed once and
   * cached.
   */
  public Leaf<V> evaluate() {
    if (evaluated == null) {
      evaluated = Collector.collect(this, Settings.DEFAULT, null);
    }
    return evaluated;
  }

  public Leaf<V> evaluate(final Settings settings) {
    return settings.equals(Settings.DEFAULT) ? evaluate() : Collector.collect(this, settings, null);
  }

  public Leaf<V> evaluate(final Evidence evidence) {
    return evaluate(evidence, Settings.DEFAULT);
  }

  public Leaf<V> evaluate(final Evidence evidence, final Settings settings) {
    return evidence == null || evidence.isEmpty() ? evaluate(settings) : Collector.collect(this, settings, evidence);
  }

  /**
   * The number of atomic outcomes enumerated by an evaluation of this node.
   */
  public long countCases() {
    try (final EvaluationPass pass = EvaluationPass.open(this, Settings.DEFAULT)) {
      return Iterators.size(pass.iterate(this));
    }
  }

  public Probability probability(final Object value) {
    return evaluate().probability(value);
  }

  /**
   * The probability of {@code true}.
   *
   * @throws EvaluationException if a value is not a boolean
   */
  public Probability P() {
    final Leaf<V> leaf = evaluate();
    for (final V value : leaf.values()) {
      if (!(value instanceof Boolean)) {
        throw new EvaluationException("boolean distribution expected, found value '" + value + "'");
      }
    }
    return leaf.probability(true);
  }

  public boolean isTrue() {
    return P().isOne();
  }

  public boolean isFeasible() {
    return !P().isZero();
  }

  public List<V> support() {
    return evaluate().values();
  }

  public List<Probability> cumulative() {
    return evaluate().cumulative();
  }

  public List<Probability> inverseCumulative() {
    return evaluate().inverseCumulative();
  }

  /**
   * Samples the evaluated distribution.
   */
  public V random() {
    return evaluate().sample();
  }

  public List<V> random(final int n) {
    return evaluate().sample(n);
  }

  /**
   * Samples the graph without evaluating it, by drawing every leaf once per
   * sample.
   */
  public List<V> randomMC(final int n) {
    return SamplingPass.draw(this, n, Settings.DEFAULT.getMaxSamplingTries(), null, new Random());
  }

  public List<V> randomMC(final int n, final int maxTries) {
    return SamplingPass.draw(this, n, maxTries, null, new Random());
  }

  // Statistics

  public double mean() {
    return Statistics.mean(evaluate());
  }

  public double variance() {
    return Statistics.variance(evaluate());
  }

  public double standardDeviation() {
    return Statistics.standardDeviation(evaluate());
  }

  public List<V> mode() {
    return Statistics.mode(evaluate());
  }

  public double entropy() {
    return Statistics.entropy(evaluate());
  }

  public double relativeEntropy() {
    return Statistics.relativeEntropy(evaluate());
  }

  public double redundancy() {
    return Statistics.redundancy(evaluate());
  }

  public double informationOf(final Object value) {
    return Statistics.informationOf(evaluate(), value);
  }

  public double information() {
    return Statistics.information(this);
  }

  public double conditionalEntropy(final Distribution<?> other) {
    return Statistics.conditionalEntropy(this, other);
  }

  public double mutualInformation(final Distribution<?> other) {
    return Statistics.mutualInformation(this, other);
  }

  public double likelihoodRatio(final Distribution<?>... hypotheses) {
    return Statistics.likelihoodRatio(this, hypotheses);
  }

  /**
   * Whether both nodes evaluate to the same values with equal probabilities.
   */
  public boolean equiv(final Object other) {
    final Leaf<V> a = evaluate();
    final Leaf<?> b = coerce(other).evaluate();
    if (a.size() != b.size()) {
      return false;
    }
    if (!Sets.newHashSet(Iterables.transform(a.values(), Values::key))
        .equals(Sets.newHashSet(Iterables.transform(b.values(), Values::key)))) {
      return false;
    }
    for (final V value : a.values()) {
      if (a.probability(value).compareTo(b.probability(value)) != 0) {
        return false;
      }
    }
    return true;
  }

  public boolean equivApprox(final Object other, final double tolerance) {
    final Leaf<V> a = evaluate();
    final Leaf<?> b = coerce(other).evaluate();
    for (final Object value : Values.distinct(Iterables.concat(a.values(), b.values()))) {
      if (Math.abs(a.probability(value).doubleValue() - b.probability(value).doubleValue()) > tolerance) {
        return false;
      }
    }
    return true;
  }

  public String asString(final DisplayFormat format) {
    return format.format(evaluate());
  }

  @Override
  public String toString() {
    final Leaf<V> leaf = evaluate();
    return DisplayFormat.defaultFor(leaf).format(leaf);
  }

  // Composition

  public <R> Distribution<R> map(final Function<? super V, ? extends R> function) {
    return new Map1<>("f", function, this);
  }

  public <R> Distribution<R> map(final String tag, final Function<? super V, ? extends R> function) {
    return new Map1<>(tag, function, this);
  }

  /**
   * Applies a binary operator with {@code other}, which is either a
   * distribution or a plain value.
   */
  public Distribution<Object> apply(final Operation op, final Object other) {
    Preconditions.checkArgument(op.arity() == 2, "%s is not binary", op);
    Preconditions.checkNotNull(other);
    if (other instanceof Distribution<?> d) {
      return new Map2<V, Object, Object>(op.symbol(), op::apply, this, cast(d));
    }
    return new Map1<V, Object>(op.symbol(), v -> op.apply(v, other), this);
  }

  public Distribution<Object> apply(final Operation op) {
    Preconditions.checkArgument(op.arity() == 1, "%s is not unary", op);
    return new Map1<V, Object>(op.symbol(), op::apply, this);
  }

  @SuppressWarnings("unchecked")
  private static Distribution<Object> cast(final Distribution<?> d) {
    return (Distribution<Object>) d;
  }

  @SuppressWarnings("unchecked")
  private Distribution<Boolean> test(final Operation op, final Object other) {
    return (Distribution<Boolean>) (Distribution<?>) apply(op, other);
  }

  public Distribution<Object> add(final Object other) {
    return apply(Operation.ADD, other);
  }

  public Distribution<Object> subtract(final Object other) {
    return apply(Operation.SUBTRACT, other);
  }

  public Distribution<Object> multiply(final Object other) {
    return apply(Operation.MULTIPLY, other);
  }

  public Distribution<Object> divide(final Object other) {
    return apply(Operation.DIVIDE, other);
  }

  public Distribution<Object> floorDivide(final Object other) {
    return apply(Operation.FLOOR_DIVIDE, other);
  }

  public Distribution<Object> mod(final Object other) {
    return apply(Operation.MOD, other);
  }

  public Distribution<Object> pow(final Object other) {
    return apply(Operation.POW, other);
  }

  public Distribution<Object> negate() {
    return apply(Operation.NEGATE);
  }

  public Distribution<Object> abs() {
    return apply(Operation.ABS);
  }

  public Distribution<Boolean> lt(final Object other) {
    return test(Operation.LT, other);
  }

  public Distribution<Boolean> le(final Object other) {
    return test(Operation.LE, other);
  }

  public Distribution<Boolean> eq(final Object other) {
    return test(Operation.EQ, other);
  }

  public Distribution<Boolean> ne(final Object other) {
    return test(Operation.NE, other);
  }

  public Distribution<Boolean> gt(final Object other) {
    return test(Operation.GT, other);
  }

  public Distribution<Boolean> ge(final Object other) {
    return test(Operation.GE, other);
  }

  public Distribution<Boolean> and(final Object other) {
    return test(Operation.AND, other);
  }

  public Distribution<Boolean> or(final Object other) {
    return test(Operation.OR, other);
  }

  public Distribution<Boolean> xor(final Object other) {
    return test(Operation.XOR, other);
  }

  public Distribution<Boolean> not() {
    return new Map1<V, Boolean>(Operation.NOT.symbol(), v -> !Values.toBoolean(v), this);
  }

  public Distribution<Boolean> isAnyOf(final Object... values) {
    final List<Object> candidates = Arrays.asList(values);
    return new Map1<V, Boolean>("in", v -> candidates.stream().anyMatch(c -> Values.equal(v, c)), this);
  }

  public Distribution<Boolean> isNoneOf(final Object... values) {
    final List<Object> candidates = Arrays.asList(values);
    return new Map1<V, Boolean>("not in", v -> candidates.stream().noneMatch(c -> Values.equal(v, c)), this);
  }

  /**
   * This distribution restricted to the cases where every condition is true.
   */
  public Distribution<V> given(final Distribution<?>... conditions) {
    return new Filter<>(this, Arrays.asList(conditions));
  }

  /**
   * Switches on the values of this node.
   */
  public <R> Distribution<R> switchOn(final Map<? extends V, ? extends Distribution<? extends R>> table) {
    return new Switch<>(this, table, null);
  }

  public <R> Distribution<R> switchOn(final Map<? extends V, ? extends Distribution<? extends R>> table,
      final Distribution<? extends R> defaultBranch) {
    return new Switch<>(this, table, defaultBranch);
  }

  public static <R> Distribution<R> ifThen(final Distribution<Boolean> condition, final Object then,
      final Object otherwise) {
    final Map<Boolean, Distribution<R>> table = new HashMap<>();
    table.put(true, coerce(then));
    table.put(false, coerce(otherwise));
    return new Switch<>(condition, table, null);
  }

  /**
   * Builds a clause set whose unconditioned distribution is this one.
   */
  @SafeVarargs
  public final Distribution<V> revisedWithClauses(final ClauseSet.Clause<? extends V>... clauses) {
    final ClauseSet.Builder<V> builder = ClauseSet.builder();
    for (final ClauseSet.Clause<? extends V> clause : clauses) {
      builder.when(clause.guard(), clause.result());
    }
    return builder.prior(this).build();
  }

  /**
   * An equiprobable mixture of this distribution and the others.
   */
  public Distribution<Object> merge(final Distribution<?>... others) {
    final List<Distribution<?>> all = new ArrayList<>();
    all.add(this);
    all.addAll(Arrays.asList(others));
    final Settings settings = settingsFor(evaluate());
    final Leaf<Integer> index = Leaf.interval(0, all.size() - 1, settings);
    final ClauseSet.Builder<Object> builder = ClauseSet.<Object>builder().settings(settings);
    for (int i = 0; i < all.size(); ++i) {
      builder.when(index.eq(i), cast(all.get(i)));
    }
    return builder.build();
  }

  /**
   * This distribution revised so that {@code condition} holds with the given
   * probability.
   */
  public Leaf<V> withProbability(final Distribution<Boolean> condition, final Object probability) {
    final Settings settings = settingsFor(evaluate());
    final Leaf<Boolean> required = Leaf.boolProb(probability, settings);
    if (required.isFeasible() && !condition.isFeasible()) {
      throw new DomainException("condition is impossible, its probability cannot become "
          + required.probability(true));
    }
    if (!required.isTrue() && !condition.not().isFeasible()) {
      throw new DomainException("condition is certain, its probability cannot become "
          + required.probability(true));
    }
    if (required.isTrue()) {
      return given(condition).evaluate();
    } else if (!required.isFeasible()) {
      return given(condition.not()).evaluate();
    }
    final Settings unsorted = settings.toBuilder().sorting(false).build();
    return Distribution.<V>ifThen(required, given(condition).evaluate(unsorted),
        given(condition.not()).evaluate(unsorted)).evaluate(settings);
  }

  /**
   * This distribution revised so that {@code condition} has the given
   * probability when {@code givenCondition} is true, keeping the
   * probabilities of both conditions unchanged.
   *
   * @throws DomainException if no such revision exists
   */
  public Leaf<V> withConditionalProbability(final Distribution<Boolean> condition,
      final Distribution<Boolean> givenCondition, final Object probability) {
    final Settings settings = settingsFor(evaluate());
    final ProbabilityType type = settings.getProbabilityType();
    final Probability p = type.coerce(probability);
    if (p.signum() < 0 || p.compareTo(type.one()) > 0) {
      throw new DomainException("probability " + p + " is out of [0,1]");
    }

    // Current masses of (condition, givenCondition), indexed by 2c + g.
    final Leaf<ImmutableList<Object>> cases = joint(this, condition, givenCondition).evaluate(settings);
    final Probability[] current = { type.zero(), type.zero(), type.zero(), type.zero() };
    for (final Outcome<ImmutableList<Object>> outcome : cases.outcomes()) {
      final int cell = cell(outcome.value());
      current[cell] = current[cell].add(outcome.weight());
    }
    final Probability pCondition = current[3].add(current[2]);
    final Probability pGiven = current[3].add(current[1]);
    if (pGiven.isZero()) {
      throw new DomainException("given condition is impossible");
    }

    final Probability[] revised = new Probability[4];
    revised[3] = pGiven.multiply(p);
    revised[1] = pGiven.subtract(revised[3]);
    revised[2] = pCondition.subtract(revised[3]);
    revised[0] = type.one().subtract(pCondition).subtract(revised[1]);
    if (revised[2].signum() < 0 || revised[0].signum() < 0) {
      final Probability min = type.one().subtract(pCondition).compareTo(pGiven) >= 0 ? type.zero()
          : pGiven.subtract(type.one().subtract(pCondition)).divide(pGiven);
      final Probability max = pCondition.compareTo(pGiven) >= 0 ? type.one() : pCondition.divide(pGiven);
      throw new DomainException("infeasible: conditional probability shall be in [" + min + ", " + max + "]");
    }
    for (int cell = 0; cell < 4; ++cell) {
      if (current[cell].isZero() && revised[cell].signum() > 0) {
        throw new DomainException("infeasible: the case where condition is " + (cell >= 2)
            + " and given condition is " + (cell % 2 == 1) + " is impossible");
      }
    }

    final Map<V, Probability> weights = new LinkedHashMap<>();
    for (final Outcome<ImmutableList<Object>> outcome : cases.outcomes()) {
      final int cell = cell(outcome.value());
      @SuppressWarnings("unchecked")
      final V value = (V) outcome.value().get(0);
      weights.merge(value, outcome.weight().multiply(revised[cell]).divide(current[cell]), Probability::add);
    }
    return Leaf.of(weights, settings.isSorting(), true);
  }

  private static int cell(final List<Object> tuple) {
    return (Values.toBoolean(tuple.get(1)) ? 2 : 0) + (Values.toBoolean(tuple.get(2)) ? 1 : 0);
  }

  /**
   * This distribution with its values in the order of the joint values of
   * {@code ordering}, which are usually functions of this one.
   *
   * @throws ConstructionException if a value occurs under several orderings
   */
  public Leaf<V> sortBy(final Distribution<?>... ordering) {
    final Settings settings = settingsFor(evaluate());
    final List<Distribution<?>> factors = new ArrayList<>(Arrays.asList(ordering));
    factors.add(this);
    final List<Map.Entry<V, Probability>> pairs = new ArrayList<>();
    for (final Outcome<ImmutableList<Object>> outcome : new Product(factors).evaluate(settings).outcomes()) {
      @SuppressWarnings("unchecked")
      final V value = (V) outcome.value().get(ordering.length);
      pairs.add(Maps.immutableEntry(value, outcome.weight()));
    }
    return Leaf.ordered(pairs, settings);
  }

  static Settings settingsFor(final Leaf<?> leaf) {
    return leaf.probabilityType() == Settings.DEFAULT.getProbabilityType() ? Settings.DEFAULT
        : Settings.DEFAULT.toBuilder().probabilityType(leaf.probabilityType()).build();
  }

  public Leaf<Object> times(final int n) {
    return Combinatorics.times(this, n, Operation.ADD::apply);
  }

  public Leaf<Object> times(final int n, final BinaryOperator<Object> op) {
    return Combinatorics.times(this, n, op);
  }

  public Leaf<ImmutableList<Object>> timesTuple(final int n) {
    return Combinatorics.timesTuple(this, n);
  }

  /**
   * Draws {@code n} values, as a tuple.
   *
   * @param sorted      whether tuples are sorted, so that draws in different
   *                    orders are merged
   * @param replacement whether a value may be drawn more than once
   */
  public Leaf<ImmutableList<Object>> draw(final int n, final boolean sorted, final boolean replacement) {
    return Combinatorics.draw(this, n, sorted, replacement);
  }

  /**
   * Every leaf under this node, in first visit order.
   */
  public List<Leaf<?>> leaves() {
    final Set<Distribution<?>> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    final List<Leaf<?>> leaves = new ArrayList<>();
    collectLeaves(this, visited, leaves);
    return leaves;
  }

  private static void collectLeaves(final Distribution<?> node, final Set<Distribution<?>> visited,
      final List<Leaf<?>> leaves) {
    if (!visited.add(node)) {
      return;
    }
    if (node instanceof Leaf<?> leaf) {
      leaves.add(leaf);
    }
    for (final Distribution<?> child : node.children()) {
      collectLeaves(child, visited, leaves);
    }
  }

  /**
   * A deep copy of this graph, with fresh leaves. Sharing within the graph is
   * preserved, so the copy is independent of this node but has the same
   * distribution.
   */
  @Override
  public Distribution<V> clone() {
    return new Cloner().of(this);
  }

  // Static composition

  /**
   * The joint distribution of the arguments, as tuples.
   */
  public static Distribution<ImmutableList<Object>> joint(final Distribution<?>... args) {
    return new Product(Arrays.asList(args));
  }

  public static <R> Distribution<R> apply(final Function<? super List<Object>, ? extends R> function,
      final Distribution<?>... args) {
    return new MapN<>("f", function, Arrays.asList(args));
  }

  public static <A, B, R> Distribution<R> apply(final BiFunction<? super A, ? super B, ? extends R> function,
      final Distribution<A> a, final Distribution<B> b) {
    return new Map2<>("f", function, a, b);
  }

  /**
   * Folds the arguments with a binary operator, left to right, in a single
   * node.
   */
  public static Distribution<Object> reduce(final Operation op, final Distribution<?>... args) {
    Preconditions.checkArgument(op.arity() == 2, "%s is not binary", op);
    Preconditions.checkArgument(args.length > 0, "nothing to reduce");
    return new MapN<Object>(op.symbol(), values -> {
      final Iterator<Object> it = values.iterator();
      Object result = it.next();
      while (it.hasNext()) {
        result = op.apply(result, it.next());
      }
      return result;
    }, Arrays.asList(args));
  }

  public static Distribution<Object> max(final Distribution<?>... args) {
    Preconditions.checkArgument(args.length > 0, "no argument");
    return new MapN<>("max", values -> Collections.max(values, Values.ORDER), Arrays.asList(args));
  }

  public static Distribution<Object> min(final Distribution<?>... args) {
    Preconditions.checkArgument(args.length > 0, "no argument");
    return new MapN<>("min", values -> Collections.min(values, Values.ORDER), Arrays.asList(args));
  }

  /**
   * The mixture of the distributions produced by {@code outer}.
   */
  public static <T> Distribution<T> flatten(final Distribution<?> outer) {
    return new Flatten<>(outer);
  }
}
