package ai.statues;

import static ai.statues.StandardDistributions.die;
import static ai.statues.StandardDistributions.flip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Test;

import lombok.val;

public class StatisticsTest {
  private static final double LOG2_6 = Math.log(6) / Math.log(2);

  @Test
  public void testMoments() {
    val x = die(6);
    assertThat(x.mean()).isCloseTo(3.5, within(1e-12));
    assertThat(x.variance()).isCloseTo(35.0 / 12, within(1e-12));
    assertThat(x.standardDeviation()).isCloseTo(Math.sqrt(35.0 / 12), within(1e-12));
    assertThat(flip().mean()).isCloseTo(0.5, within(1e-12));
    assertThatThrownBy(() -> Leaf.fromValues("a", "b").mean()).isInstanceOf(NumericCapabilityException.class);
  }

  @Test
  public void testMode() {
    assertThat(Leaf.fromMap(ImmutableMap.of("a", 2, "b", 1)).mode()).containsExactly("a");
    assertThat(die(3).mode()).containsExactly(1, 2, 3);
  }

  @Test
  public void testEntropy() {
    assertThat(flip().entropy()).isCloseTo(1, within(1e-12));
    assertThat(die(6).entropy()).isCloseTo(LOG2_6, within(1e-12));
    assertThat(Leaf.certain(1).entropy()).isEqualTo(0);
    assertThat(die(6).relativeEntropy()).isCloseTo(1, within(1e-12));
    assertThat(Leaf.certain(1).relativeEntropy()).isEqualTo(0);
    assertThat(Leaf.certain(1).redundancy()).isEqualTo(1);
    assertThat(Leaf.boolProb("1/4").redundancy()).isBetween(0.0, 1.0);
  }

  @Test
  public void testInformation() {
    assertThat(flip().informationOf(true)).isCloseTo(1, within(1e-12));
    assertThat(die(6).informationOf(1)).isCloseTo(LOG2_6, within(1e-12));
    assertThat(Leaf.boolProb("1/8").information()).isCloseTo(3, within(1e-12));
    assertThatThrownBy(() -> die(6).informationOf(7)).isInstanceOf(DomainException.class);
  }

  @Test
  public void testJointMeasures() {
    val x = die(6);
    val y = die(6);
    assertThat(Statistics.jointEntropy(x, y)).isCloseTo(2 * LOG2_6, within(1e-12));
    assertThat(x.conditionalEntropy(x)).isCloseTo(0, within(1e-12));
    assertThat(x.conditionalEntropy(y)).isCloseTo(LOG2_6, within(1e-12));
    assertThat(x.mutualInformation(x)).isCloseTo(LOG2_6, within(1e-12));
    assertThat(x.mutualInformation(y)).isCloseTo(0, within(1e-12));
    assertThat(x.mutualInformation(x.mod(2))).isCloseTo(1, within(1e-12));
  }

  @Test
  public void testLikelihoodRatio() {
    val x = die(6);
    assertThat(x.ge(4).likelihoodRatio(x.ge(5))).isCloseTo(4, within(1e-12));
    assertThat(x.ge(5).likelihoodRatio(x.mod(2).eq(0))).isCloseTo(1, within(1e-12));
    assertThat(x.ge(4).likelihoodRatio(x.ge(3), x.le(5))).isCloseTo(2, within(1e-12));
    assertThatThrownBy(() -> x.ge(4).likelihoodRatio(x.ge(1))).isInstanceOf(DomainException.class);
  }
}
