package ai.statues;

import static ai.statues.TestUtil.p;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import lombok.val;

public class StandardDistributionsTest {
  @Test
  public void testDie() {
    val die = StandardDistributions.die(6);
    assertThat(die.values()).containsExactly(1, 2, 3, 4, 5, 6);
    assertThat(die.isUniform()).isTrue();
    assertThat(die).isNotSameAs(StandardDistributions.die(6));
  }

  @Test
  public void testDice() {
    val dice = StandardDistributions.dice(2, 6);
    assertThat(dice.probability(7)).isEqualTo(p(1, 6));
    assertThat(StandardDistributions.dice(3, 6).probability(3)).isEqualTo(p(1, 216));
  }

  @Test
  public void testDiceSeq() {
    assertThat(StandardDistributions.diceSeq(3, 6, true).size()).isEqualTo(56);
    assertThat(StandardDistributions.diceSeq(2, 6, false).size()).isEqualTo(36);
  }

  @Test
  public void testFlip() {
    assertThat(StandardDistributions.flip().P()).isEqualTo(p(1, 2));
  }

  @Test
  public void testCards() {
    assertThat(StandardDistributions.cardSuite().values()).containsExactly("S", "H", "D", "C");
    assertThat(StandardDistributions.cardRank().size()).isEqualTo(13);
    val card = StandardDistributions.card();
    assertThat(card.size()).isEqualTo(52);
    assertThat(card.probability("AS")).isEqualTo(p(1, 52));
    assertThat(card.map(c -> c.substring(1)).probability("H")).isEqualTo(p(1, 4));
  }
}
