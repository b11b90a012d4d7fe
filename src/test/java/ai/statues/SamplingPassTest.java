package ai.statues;

import static ai.statues.StandardDistributions.die;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;

import org.junit.jupiter.api.Test;

import lombok.val;

public class SamplingPassTest {
  @Test
  public void testSharedNodeSampledOnce() {
    val x = die(6);
    assertThat(x.subtract(x).randomMC(100)).containsOnly(0);
  }

  @Test
  public void testRange() {
    assertThat(die(6).add(die(6)).randomMC(100)).allMatch(v -> (Integer) v >= 2 && (Integer) v <= 12);
  }

  @Test
  public void testRejection() {
    val x = die(6);
    assertThat(x.given(x.gt(4)).randomMC(100)).allMatch(v -> v == 5 || v == 6);
  }

  @Test
  public void testInfeasible() {
    val x = die(6);
    assertThatThrownBy(() -> x.given(x.gt(6)).randomMC(1, 10)).isInstanceOf(InfeasibleQueryException.class);
  }

  @Test
  public void testSeeded() {
    val x = die(6).add(die(6));
    assertThat(SamplingPass.draw(x, 20, 1, null, new Random(42)))
        .isEqualTo(SamplingPass.draw(x, 20, 1, null, new Random(42)));
  }

  @Test
  public void testFlattenAndSwitch() {
    val coin = Leaf.fromValues("H", "T");
    val mixture = Distribution.<Integer>flatten(Leaf.fromValues(Leaf.certain(1), Leaf.certain(2)));
    assertThat(mixture.randomMC(50)).allMatch(v -> v == 1 || v == 2);
    val ifHeads = Distribution.<String>ifThen(coin.eq("H"), "heads", "tails");
    assertThat(ifHeads.randomMC(50)).allMatch(v -> v.equals("heads") || v.equals("tails"));
  }

  @Test
  public void testZeroSamples() {
    assertThat(die(6).randomMC(0)).isEmpty();
  }
}
