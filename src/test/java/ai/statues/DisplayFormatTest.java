package ai.statues;

import static ai.statues.StandardDistributions.flip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Test;

import lombok.val;

public class DisplayFormatTest {
  @Test
  public void testFraction() {
    assertThat(flip().asString(DisplayFormat.FRACTION)).isEqualTo("false : 1/2\n true : 1/2");
    val leaf = Leaf.fromMap(ImmutableMap.of("a", 1, "b", 2, "c", 3));
    assertThat(leaf.asString(DisplayFormat.FRACTION)).isEqualTo("a : 1/6\nb : 2/6\nc : 3/6");
    assertThat(Leaf.certain(10).asString(DisplayFormat.FRACTION)).isEqualTo("10 : 1");
  }

  @Test
  public void testDecimal() {
    assertThat(flip().asString(DisplayFormat.DECIMAL)).isEqualTo("false : 0.500000\n true : 0.500000");
    assertThat(DisplayFormat.DECIMAL.format(Leaf.boolProb("1/4"), 2)).isEqualTo("false : 0.75\n true : 0.25");
  }

  @Test
  public void testPercent() {
    assertThat(flip().asString(DisplayFormat.PERCENT))
        .isEqualTo("false :  50.000000 %\n true :  50.000000 %");
  }

  @Test
  public void testHistogram() {
    val bar = Strings.repeat("-", 50);
    assertThat(flip().asString(DisplayFormat.HISTOGRAM)).isEqualTo("false : " + bar + "\n true : " + bar);
    assertThat(flip().asString(DisplayFormat.FRACTION_HISTOGRAM))
        .isEqualTo("false : 1/2 " + bar + "\n true : 1/2 " + bar);
  }

  @Test
  public void testStored() {
    assertThat(Leaf.interval(1, 4).asString(DisplayFormat.STORED))
        .isEqualTo("1 : 1/4\n2 : 1/4\n3 : 1/4\n4 : 1/4");
    assertThat(Leaf.interval(1, 2, TestUtil.DECIMAL).toString()).isEqualTo("1 : 0.5\n2 : 0.5");
  }

  @Test
  public void testSymbols() {
    assertThat(DisplayFormat.of("/")).isEqualTo(DisplayFormat.FRACTION);
    assertThat(DisplayFormat.of("%-")).isEqualTo(DisplayFormat.PERCENT_HISTOGRAM);
    assertThat(DisplayFormat.of("-")).isEqualTo(DisplayFormat.HISTOGRAM);
    assertThat(DisplayFormat.of("")).isEqualTo(DisplayFormat.STORED);
    assertThatThrownBy(() -> DisplayFormat.of("?")).isInstanceOf(IllegalArgumentException.class);
  }
}
