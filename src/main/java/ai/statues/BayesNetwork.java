package ai.statues;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import ai.statues.util.Values;

/**
 * Named random variables learned from a joint distribution of tuples. Each
 * variable starts as the independent marginal of its attribute; a dependency
 * replaces the target by a clause set giving, for every combination of its
 * sources found in the joint distribution, the target's marginal under that
 * combination.
 * <p>
 * Combinations of sources absent from the joint distribution give a uniform
 * distribution over every target value seen in the other clauses.
 */
public final class BayesNetwork {
  private record Dependency(String target, ImmutableList<String> sources) {
  }

  private final ImmutableMap<String, Distribution<Object>> variables;

  private BayesNetwork(final ImmutableMap<String, Distribution<Object>> variables) {
    this.variables = variables;
  }

  /**
   * @throws IllegalArgumentException if there is no such variable
   */
  public Distribution<Object> get(final String name) {
    final Distribution<Object> variable = variables.get(name);
    Preconditions.checkArgument(variable != null, "unknown variable '%s'", name);
    return variable;
  }

  public ImmutableMap<String, Distribution<Object>> variables() {
    return variables;
  }

  /**
   * Starts a network over {@code joint}, whose values are tuples with one
   * element per attribute name.
   */
  public static Builder fromJoint(final Distribution<? extends List<?>> joint, final String... attributes) {
    return new Builder(joint, ImmutableList.copyOf(attributes));
  }

  public static final class Builder {
    private final Distribution<? extends List<?>> joint;
    private final ImmutableList<String> attributes;
    private final List<Dependency> dependencies = new ArrayList<>();

    private Builder(final Distribution<? extends List<?>> joint, final ImmutableList<String> attributes) {
      Preconditions.checkArgument(!attributes.isEmpty(), "no attribute");
      Preconditions.checkArgument(new HashSet<>(attributes).size() == attributes.size(), "duplicate attribute");
      this.joint = joint;
      this.attributes = attributes;
    }

    /**
     * Makes {@code target} depend on {@code sources}. Dependencies are built in
     * the order given, so a source that is itself a target refers to its table
     * only if its dependency came first.
     */
    public Builder dependency(final String target, final String... sources) {
      Preconditions.checkArgument(attributes.contains(target), "unknown attribute '%s'", target);
      for (final String source : sources) {
        Preconditions.checkArgument(attributes.contains(source), "unknown attribute '%s'", source);
      }
      dependencies.add(new Dependency(target, ImmutableList.copyOf(sources)));
      return this;
    }

    /**
     * @throws ConstructionException if the joint values do not match the
     *                               attributes, or an attribute is the target
     *                               of more than one dependency
     */
    public BayesNetwork build() {
      final Leaf<? extends List<?>> jointLeaf = joint.evaluate();
      for (final List<?> tuple : jointLeaf.values()) {
        if (tuple.size() != attributes.size()) {
          throw new ConstructionException(
              "joint value '" + tuple + "' does not have " + attributes.size() + " attributes");
        }
      }
      final Settings unsorted = Distribution.settingsFor(jointLeaf).toBuilder().sorting(false).build();

      final Map<String, Distribution<Object>> marginals = new LinkedHashMap<>();
      final Map<String, Distribution<Object>> variables = new LinkedHashMap<>();
      for (int i = 0; i < attributes.size(); ++i) {
        final int index = i;
        final Distribution<Object> marginal = joint.map(attributes.get(i), tuple -> tuple.get(index));
        marginals.put(attributes.get(i), marginal);
        variables.put(attributes.get(i), marginal.evaluate(unsorted));
      }

      final Set<String> targets = new HashSet<>();
      for (final Dependency dependency : dependencies) {
        if (!targets.add(dependency.target())) {
          throw new ConstructionException("'" + dependency.target() + "' is the target of more than one dependency");
        }
        variables.put(dependency.target(), table(dependency, marginals, variables, unsorted));
      }
      return new BayesNetwork(ImmutableMap.copyOf(variables));
    }

    private Distribution<Object> table(final Dependency dependency, final Map<String, Distribution<Object>> marginals,
        final Map<String, Distribution<Object>> variables, final Settings settings) {
      final List<Distribution<?>> sources = new ArrayList<>();
      final List<Distribution<?>> networkSources = new ArrayList<>();
      final List<Distribution<?>> independentSources = new ArrayList<>();
      for (final String name : dependency.sources()) {
        sources.add(marginals.get(name));
        networkSources.add(variables.get(name));
        independentSources.add(marginals.get(name).evaluate(settings));
      }
      final Distribution<ImmutableList<Object>> cases = new Product(sources);
      final Distribution<ImmutableList<Object>> networkCases = new Product(networkSources);
      final Distribution<Object> target = marginals.get(dependency.target());

      final ClauseSet.Builder<Object> builder = ClauseSet.builder().settings(settings).check(false);
      final Set<Object> present = new HashSet<>();
      final List<Object> seen = new ArrayList<>();
      for (final ImmutableList<Object> combination : cases.evaluate(settings).values()) {
        final Leaf<Object> result = target.given(cases.eq(combination)).evaluate(settings);
        builder.when(networkCases.eq(combination), result);
        present.add(Values.key(combination));
        seen.addAll(result.values());
      }

      Leaf<Object> indifferent = null;
      for (final ImmutableList<Object> combination : new Product(independentSources).evaluate(settings).values()) {
        if (!present.contains(Values.key(combination))) {
          if (indifferent == null) {
            indifferent = Leaf.fromValues(Values.distinct(seen), settings);
          }
          builder.when(networkCases.eq(combination), indifferent);
        }
      }
      return builder.build();
    }
  }
}
