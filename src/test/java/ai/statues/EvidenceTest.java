package ai.statues;

import static ai.statues.StandardDistributions.die;
import static ai.statues.TestUtil.p;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;

import org.junit.jupiter.api.Test;

import lombok.val;

public class EvidenceTest {
  @Test
  public void testObserve() {
    val x = die(6);
    val y = die(6);
    val sum = x.add(y);
    val evidence = new Evidence();
    try (final Evidence.Scope scope = evidence.observe(x, 6)) {
      val leaf = sum.evaluate(evidence);
      assertThat(leaf.values()).containsExactly(7, 8, 9, 10, 11, 12);
      assertThat(leaf.probability(12)).isEqualTo(p(1, 6));
      assertThat(evidence.getObservations()).containsKey(x);
    }
    assertThat(evidence.isEmpty()).isTrue();
    assertThat(sum.evaluate(evidence).size()).isEqualTo(11);
  }

  @Test
  public void testObserveImpossible() {
    val evidence = new Evidence();
    assertThatThrownBy(() -> evidence.observe(die(6), 7)).isInstanceOf(DomainException.class);
    assertThat(evidence.isEmpty()).isTrue();
  }

  @Test
  public void testObserveTwice() {
    val x = die(6);
    val evidence = new Evidence();
    evidence.observe(x, 1);
    assertThatThrownBy(() -> evidence.observe(x, 2)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void testConditions() {
    val x = die(6);
    val y = die(6);
    val sum = x.add(y);
    val evidence = new Evidence();
    try (final Evidence.Scope scope = evidence.add(x.gt(y))) {
      assertThat(sum.evaluate(evidence).probability(3)).isEqualTo(p(1, 15));
      assertThat(evidence.getConditions()).hasSize(1);
    }
    assertThat(evidence.getConditions()).isEmpty();
  }

  @Test
  public void testNestedScopes() {
    val x = die(6);
    val evidence = new Evidence();
    val even = x.mod(2).eq(0);
    final Evidence.Scope outer = evidence.add(x.gt(2));
    try (final Evidence.Scope inner = evidence.add(even)) {
      assertThat(x.evaluate(evidence).values()).containsExactly(4, 6);
    }
    assertThat(x.evaluate(evidence).values()).containsExactly(3, 4, 5, 6);
    outer.close();
    assertThat(x.evaluate(evidence).size()).isEqualTo(6);
  }

  @Test
  public void testImpossibleEvidence() {
    val x = die(6);
    val evidence = new Evidence();
    evidence.add(x.gt(3), x.lt(3));
    assertThatThrownBy(() -> x.evaluate(evidence)).isInstanceOf(InfeasibleQueryException.class);
  }

  @Test
  public void testSampling() {
    val x = die(6);
    val y = die(6);
    val evidence = new Evidence();
    evidence.observe(x, 6);
    evidence.add(y.ge(5));
    assertThat(SamplingPass.draw(x.add(y), 50, 100, evidence, new Random(1)))
        .allMatch(v -> v.equals(11) || v.equals(12));
  }
}
