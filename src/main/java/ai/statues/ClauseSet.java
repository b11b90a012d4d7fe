package ai.statues;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;

import ai.statues.prob.Probability;
import ai.statues.prob.ProbabilityType;
import ai.statues.util.Values;

/**
 * A disjoint union of guarded results, each clause contributing its result
 * restricted to the cases where its guard is true. Guards must not overlap
 * and, together with the else clause if any, must cover every case.
 * <p>
 * The else clause can be given explicitly, spread uniformly over every value
 * of the other results, or derived from a prior so that the clause set as a
 * whole has the prior's distribution.
 */
public class ClauseSet<V> extends Distribution<V> {
  /**
   * A result applying when its guard is true.
   */
  public record Clause<V>(Distribution<?> guard, Distribution<? extends V> result) {
  }

  public static <V> Clause<V> clause(final Distribution<?> guard, final Object result) {
    return new Clause<>(guard, coerce(result));
  }

  private static final double FLOAT_TOLERANCE = 1e-12;

  private final ImmutableList<Clause<V>> clauses;
  private final ImmutableList<Filter<V>> branches;

  @SuppressWarnings("unchecked")
  private ClauseSet(final List<Clause<V>> clauses) {
    this.clauses = ImmutableList.copyOf(clauses);
    final ImmutableList.Builder<Filter<V>> branches = ImmutableList.builder();
    for (final Clause<V> clause : clauses) {
      branches.add(new Filter<>((Distribution<V>) clause.result(), ImmutableList.of(clause.guard())));
    }
    this.branches = branches.build();
  }

  public List<Clause<V>> getClauses() {
    return clauses;
  }

  @Override
  public List<Distribution<?>> children() {
    return ImmutableList.copyOf(branches);
  }

  @Override
  protected Iterator<Outcome<V>> generate(final EvaluationPass pass) {
    return Iterators.concat(Iterators.transform(branches.iterator(), pass::iterate));
  }

  @Override
  protected V sample(final SamplingPass pass) {
    for (final Clause<V> clause : clauses) {
      if (Filter.holds(pass.sample(clause.guard()))) {
        return pass.sample(clause.result());
      }
    }
    throw SamplingPass.REJECTED;
  }

  @Override
  protected Distribution<V> copy(final Cloner cloner) {
    final List<Clause<V>> copied = new ArrayList<>();
    for (final Clause<V> clause : clauses) {
      copied.add(new Clause<>(cloner.of(clause.guard()), cloner.of(clause.result())));
    }
    return new ClauseSet<>(copied);
  }

  /**
   * A clause set from a table of guards to results, each result a value or a
   * distribution. A null guard gives the else clause.
   */
  public static <V> ClauseSet<V> fromTable(final Map<? extends Distribution<?>, ?> table) {
    return fromTable(table, null);
  }

  /**
   * Same as {@link #fromTable(Map)}, with the else clause derived from
   * {@code prior} when it is not null.
   */
  public static <V> ClauseSet<V> fromTable(final Map<? extends Distribution<?>, ?> table,
      final Distribution<V> prior) {
    final Builder<V> builder = builder();
    table.forEach((guard, result) -> {
      if (guard == null) {
        builder.otherwise(Distribution.<V>coerce(result));
      } else {
        builder.when(guard, Distribution.<V>coerce(result));
      }
    });
    if (prior != null) {
      builder.prior(prior);
    }
    return builder.build();
  }

  public static <V> Builder<V> builder() {
    return new Builder<>();
  }

  public static final class Builder<V> {
    private final List<Clause<V>> clauses = new ArrayList<>();
    private Distribution<? extends V> otherwise;
    private Distribution<V> prior;
    private boolean autoElse;
    private Settings settings = Settings.DEFAULT;
    private Boolean check;

    private Builder() {
    }

    public Builder<V> when(final Distribution<?> guard, final Distribution<? extends V> result) {
      clauses.add(new Clause<>(guard, result));
      return this;
    }

    public Builder<V> when(final Distribution<?> guard, final V result) {
      return when(guard, Leaf.certain(result, settings));
    }

    /**
     * The result when no other guard is true. May be given at any point of the
     * build.
     *
     * @throws ConstructionException if an else clause was already given
     */
    public Builder<V> otherwise(final Distribution<? extends V> result) {
      if (otherwise != null) {
        throw new ConstructionException("more than one else clause");
      }
      otherwise = result;
      return this;
    }

    public Builder<V> otherwise(final V result) {
      return otherwise(Leaf.certain(result, settings));
    }

    /**
     * Makes the else clause uniform over every value of the other results.
     */
    public Builder<V> autoElse() {
      autoElse = true;
      return this;
    }

    /**
     * Derives the else clause so that the clause set has the distribution of
     * {@code prior}.
     */
    public Builder<V> prior(final Distribution<V> prior) {
      this.prior = prior;
      return this;
    }

    /**
     * Overrides {@link Settings#isCheckClauses()}.
     */
    public Builder<V> check(final boolean check) {
      this.check = check;
      return this;
    }

    public Builder<V> settings(final Settings settings) {
      this.settings = settings;
      return this;
    }

    /**
     * @throws ConstructionException if the clauses are inconsistent
     * @throws DomainException       if the prior cannot be reached
     */
    public ClauseSet<V> build() {
      if (prior != null && autoElse) {
        throw new ConstructionException("prior and automatic else clause are exclusive");
      }
      if (otherwise != null && (prior != null || autoElse)) {
        throw new ConstructionException("else clause cannot be combined with a prior or an automatic else clause");
      }
      if (clauses.isEmpty() && otherwise == null) {
        throw new ConstructionException("no clause");
      }

      final List<Distribution<?>> guards = new ArrayList<>();
      for (final Clause<V> clause : clauses) {
        guards.add(clause.guard());
      }
      final Distribution<Boolean> anyGuard = new MapN<Boolean>("any", values -> {
        boolean any = false;
        for (final Object value : values) {
          any |= Filter.holds(value);
        }
        return any;
      }, guards);

      if (check == null ? settings.isCheckClauses() : check) {
        checkDisjoint(guards);
        final boolean complete = !guards.isEmpty() && anyGuard.evaluate(settings).probability(false).isZero();
        if (complete && prior != null) {
          throw new ConstructionException("prior cannot be used with complete clauses");
        }
        if (!complete && otherwise == null && prior == null && !autoElse) {
          throw new ConstructionException("clauses are not complete");
        }
      }

      final Distribution<? extends V> elseResult;
      if (otherwise != null) {
        elseResult = otherwise;
      } else if (autoElse) {
        elseResult = uniformElse();
      } else if (prior != null) {
        elseResult = priorElse(anyGuard);
      } else {
        elseResult = null;
      }

      final List<Clause<V>> all = new ArrayList<>(clauses);
      if (elseResult != null) {
        all.add(new Clause<>(anyGuard.not(), elseResult));
      }
      return new ClauseSet<>(all);
    }

    private void checkDisjoint(final List<Distribution<?>> guards) {
      if (guards.size() < 2) {
        return;
      }
      for (final ImmutableList<Object> values : new Product(guards).evaluate(settings).values()) {
        int trueCount = 0;
        for (final Object value : values) {
          if (Filter.holds(value)) {
            ++trueCount;
          }
        }
        if (trueCount > 1) {
          throw new ConstructionException("clause conditions are not disjoint");
        }
      }
    }

    private Distribution<V> uniformElse() {
      final List<V> values = new ArrayList<>();
      ProbabilityType type = null;
      for (final Clause<V> clause : clauses) {
        final Leaf<? extends V> result = clause.result().evaluate(settings);
        values.addAll(result.values());
        type = result.probabilityType();
      }
      if (values.isEmpty()) {
        throw new ConstructionException("automatic else clause needs at least one clause");
      }
      return Leaf.fromValues(Values.distinct(values), settings.toBuilder().probabilityType(type).build());
    }

    /**
     * else(v) = (prior(v) - P(clauses give v)) / P(no guard is true).
     */
    private Distribution<V> priorElse(final Distribution<Boolean> anyGuard) {
      final Leaf<V> priorLeaf = prior.evaluate(settings);
      final ProbabilityType type = priorLeaf.probabilityType();
      final Map<V, Probability> covered = clauses.isEmpty() ? new LinkedHashMap<>()
          : Collector.accumulate(new ClauseSet<>(clauses), settings, null);
      final Probability pElse = anyGuard.evaluate(settings).probability(false);
      if (pElse.isZero()) {
        throw new DomainException("prior cannot be honored: no case is left for the else clause");
      }

      final Map<Object, Probability> coveredByKey = new HashMap<>();
      covered.forEach((value, p) -> coveredByKey.put(Values.key(value), p));
      final Map<V, Probability> weights = new LinkedHashMap<>();
      for (final V value : Values.distinct(Iterables.concat(priorLeaf.values(), covered.keySet()))) {
        final Probability coveredWeight = coveredByKey.getOrDefault(Values.key(value), type.zero());
        Probability p = priorLeaf.probability(value).subtract(coveredWeight).divide(pElse);
        if (type == ProbabilityType.FLOAT && Math.abs(p.doubleValue()) < FLOAT_TOLERANCE) {
          p = type.zero();
        }
        if (p.signum() < 0 || p.compareTo(type.one()) > 0) {
          throw new DomainException("prior is inconsistent with the clauses for value '" + value + "'");
        }
        weights.put(value, p);
      }
      if (weights.values().stream().allMatch(Probability::isZero)) {
        throw new DomainException("prior leaves no value for the else clause");
      }
      return Leaf.of(weights, settings.isSorting(), true);
    }
  }
}
