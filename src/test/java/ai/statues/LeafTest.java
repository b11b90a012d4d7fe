package ai.statues;

import static ai.statues.TestUtil.p;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.AbstractMap.SimpleEntry;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Test;

import ai.statues.prob.ProbabilityType;
import lombok.val;

public class LeafTest {
  @Test
  public void testFromValuesCountsOccurrences() {
    val leaf = Leaf.fromValues(2, 1, 2);
    assertThat(leaf.values()).containsExactly(1, 2);
    assertThat(leaf.probabilities()).containsExactly(p(1, 3), p(2, 3));
    assertThat(leaf.probability(2)).isEqualTo(p(2, 3));
    assertThat(leaf.probability(3).isZero()).isTrue();
  }

  @Test
  public void testNoValue() {
    assertThatThrownBy(() -> Leaf.<Integer>fromValues()).isInstanceOf(ConstructionException.class)
        .hasMessage("no value");
    assertThatThrownBy(() -> Leaf.fromMap(ImmutableMap.of("a", 0, "b", 0)))
        .isInstanceOf(ConstructionException.class);
  }

  @Test
  public void testFromMapDropsZeroWeights() {
    val leaf = Leaf.fromMap(ImmutableMap.of("b", 3, "a", 1, "c", 0));
    assertThat(leaf.values()).containsExactly("a", "b");
    assertThat(leaf.probability("b")).isEqualTo(p(3, 4));
  }

  @Test
  public void testNegativeWeight() {
    assertThatThrownBy(() -> Leaf.fromMap(ImmutableMap.of("a", 1, "b", -1)))
        .isInstanceOf(DomainException.class);
  }

  @Test
  public void testFromSequenceKeepsOrder() {
    val leaf = Leaf.fromSequence(Arrays.asList("b", "a", "b"), Settings.DEFAULT);
    assertThat(leaf.values()).containsExactly("b", "a");
    assertThat(leaf.probability("b")).isEqualTo(p(2, 3));
  }

  @Test
  public void testValueFreqsSumDuplicates() {
    val leaf = Leaf.fromValueFreqs(List.of(new SimpleEntry<>("a", 1), new SimpleEntry<>("b", 1),
        new SimpleEntry<>("a", 2)), Settings.DEFAULT);
    assertThat(leaf.probability("a")).isEqualTo(p(3, 4));
  }

  @Test
  public void testOrdered() {
    val leaf = Leaf.ordered(List.of(new SimpleEntry<>("z", "1/2"), new SimpleEntry<>("a", "1/2")),
        Settings.DEFAULT);
    assertThat(leaf.values()).containsExactly("z", "a");
    assertThatThrownBy(() -> Leaf.ordered(List.of(new SimpleEntry<>("a", 1), new SimpleEntry<>("a", 1)),
        Settings.DEFAULT)).isInstanceOf(ConstructionException.class);
  }

  @Test
  public void testUnorderedValuesKeepFirstSeenOrder() {
    final Leaf<List<Object>> leaf = Leaf.fromValues(List.<Object>of(1), List.<Object>of(1, "x"),
        List.<Object>of(1, 2));
    assertThat(leaf.values()).containsExactly(List.<Object>of(1), List.<Object>of(1, "x"), List.<Object>of(1, 2));
    assertThat(leaf.probability(List.of(1, 2))).isEqualTo(p(1, 3));
  }

  @Test
  public void testNumericallyEqualValuesMerge() {
    final Leaf<Object> leaf = Leaf.fromMap(ImmutableMap.<Object, Integer>of(1, 1, 1.0, 1, 2L, 2));
    assertThat(leaf.values()).containsExactly(1, 2L);
    assertThat(leaf.probability(1L)).isEqualTo(p(1, 2));
    assertThat(leaf.probability(2)).isEqualTo(p(1, 2));
    assertThatThrownBy(() -> Leaf.ordered(
        List.of(new SimpleEntry<Object, Object>(1, 1), new SimpleEntry<Object, Object>(1.0, 1)), Settings.DEFAULT))
        .isInstanceOf(ConstructionException.class).hasMessage("duplicate value '1.0'");
  }

  @Test
  public void testCumulative() {
    val die = Leaf.interval(1, 6);
    val cumulative = die.cumulative();
    assertThat(cumulative).hasSize(7);
    assertThat(cumulative.get(0).isZero()).isTrue();
    assertThat(cumulative.get(3)).isEqualTo(p(1, 2));
    assertThat(cumulative.get(6).isOne()).isTrue();

    val inverse = die.inverseCumulative();
    assertThat(inverse).hasSize(7);
    assertThat(inverse.get(0).isOne()).isTrue();
    assertThat(inverse.get(4)).isEqualTo(p(1, 3));
    assertThat(inverse.get(6).isZero()).isTrue();
  }

  @Test
  public void testProbabilityBounds() {
    val die = Leaf.interval(1, 6);
    assertThat(die.probabilityAtMost(3.5)).isEqualTo(p(1, 2));
    assertThat(die.probabilityAtMost(3)).isEqualTo(p(1, 2));
    assertThat(die.probabilityAtMost(0).isZero()).isTrue();
    assertThat(die.probabilityAtLeast(5)).isEqualTo(p(1, 3));
    assertThat(die.probabilityAtLeast(0).isOne()).isTrue();
    assertThat(die.probabilityAtLeast(7).isZero()).isTrue();

    val unsorted = Leaf.fromSequence(Arrays.asList(3, 1, 2), Settings.DEFAULT);
    assertThat(unsorted.probabilityAtMost(2)).isEqualTo(p(2, 3));
    assertThat(unsorted.probabilityAtLeast(2)).isEqualTo(p(2, 3));
  }

  @Test
  public void testBoolProb() {
    val leaf = Leaf.boolProb("1/4");
    assertThat(leaf.values()).containsExactly(false, true);
    assertThat(leaf.P()).isEqualTo(p(1, 4));
    assertThat(Leaf.boolProb(1).values()).containsExactly(true);
    assertThat(Leaf.boolProb(0).values()).containsExactly(false);
    assertThatThrownBy(() -> Leaf.boolProb(2)).isInstanceOf(DomainException.class);
    assertThatThrownBy(() -> Leaf.boolProb("-1/2")).isInstanceOf(DomainException.class);
  }

  @Test
  public void testBernoulliAndBinom() {
    assertThat(Leaf.bernoulli("1/4").probability(1)).isEqualTo(p(1, 4));
    val binom = Leaf.binom(3, "1/2");
    assertThat(binom.values()).containsExactly(0, 1, 2, 3);
    assertThat(binom.probability(1)).isEqualTo(p(3, 8));
    assertThat(binom.probability(3)).isEqualTo(p(1, 8));
  }

  @Test
  public void testPoisson() {
    val poisson = Leaf.poisson(2);
    assertThat(poisson.probabilityType()).isEqualTo(ProbabilityType.FLOAT);
    assertThat(poisson.probability(0).doubleValue()).isCloseTo(Math.exp(-2), within(1e-12));
    assertThat(poisson.mean()).isCloseTo(2, within(1e-9));
  }

  @Test
  public void testUniform() {
    assertThat(Leaf.interval(1, 3).isUniform()).isTrue();
    assertThat(Leaf.fromValues(1, 1, 2).isUniform()).isFalse();
  }

  @Test
  public void testProbabilityTypes() {
    val decimal = Leaf.interval(1, 3, TestUtil.DECIMAL);
    assertThat(decimal.probabilityType()).isEqualTo(ProbabilityType.DECIMAL);
    assertThat(decimal.probability(1)).isEqualTo(ProbabilityType.DECIMAL.of(1, 3));

    val floats = Leaf.interval(1, 4).withFloatProbabilities();
    assertThat(floats.probabilityType()).isEqualTo(ProbabilityType.FLOAT);
    assertThat(floats.probability(1).doubleValue()).isEqualTo(0.25);
  }

  @Test
  public void testSample() {
    val die = Leaf.interval(1, 6);
    assertThat(die.sample(100)).hasSize(100).allMatch(v -> v >= 1 && v <= 6);
    assertThat(Leaf.certain("x").sample()).isEqualTo("x");
    assertThat(Leaf.boolProb("1/1000000").sample(new Random(0))).isFalse();
  }

  @Test
  public void testRxSamples() {
    val samples = Leaf.interval(1, 6).rxSamples().take(10).toList().blockingGet();
    assertThat(samples).hasSize(10).allMatch(v -> v >= 1 && v <= 6);
  }

  @Test
  public void testRandomDraw() {
    val drawn = Leaf.interval(1, 6).randomDraw(3, true);
    assertThat(drawn).hasSize(3).doesNotHaveDuplicates().isSorted();
    assertThat(Leaf.interval(1, 6).randomDraw(6, false)).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6);
    assertThatThrownBy(() -> Leaf.interval(1, 6).randomDraw(7, false)).isInstanceOf(DomainException.class);
  }

  @Test
  public void testCloneIsIndependent() {
    val die = Leaf.interval(1, 6);
    val clone = die.clone();
    assertThat(clone).isNotSameAs(die);
    assertThat(clone.equiv(die)).isTrue();
    assertThat(die.subtract(clone).evaluate().size()).isEqualTo(11);
    assertThat(die.subtract(die).evaluate().size()).isEqualTo(1);
  }

  @Test
  public void testSerialization() throws Exception {
    val die = Leaf.interval(1, 6);
    val copy = TestUtil.serialize(die);
    assertThat(copy.values()).containsExactly(1, 2, 3, 4, 5, 6);
    assertThat(copy.probabilities()).containsExactlyElementsOf(die.probabilities());
    assertThat(copy.cumulative().get(6).isOne()).isTrue();
    assertThat(copy.sample()).isBetween(1, 6);
  }
}
