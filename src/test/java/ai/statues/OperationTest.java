package ai.statues;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class OperationTest {
  @Test
  public void testSymbols() {
    assertThat(Operation.ofSymbol("//")).isEqualTo(Operation.FLOOR_DIVIDE);
    assertThat(Operation.ofSymbol("<=")).isEqualTo(Operation.LE);
    assertThat(Operation.POW).hasToString("**");
    assertThatThrownBy(() -> Operation.ofSymbol("<>")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testArity() {
    assertThat(Operation.ADD.arity()).isEqualTo(2);
    assertThat(Operation.NEGATE.arity()).isEqualTo(1);
    assertThat(Operation.NOT.arity()).isEqualTo(1);
    assertThatThrownBy(() -> Operation.ADD.apply(1)).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> Operation.ADD.apply(Arrays.asList(1, 2, 3)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testComparisons() {
    assertThat(Operation.LT.isComparison()).isTrue();
    assertThat(Operation.GE.isComparison()).isTrue();
    assertThat(Operation.ADD.isComparison()).isFalse();
    assertThat(Operation.AND.isComparison()).isFalse();
    assertThat(Operation.LT.apply(1, 2.5)).isEqualTo(true);
    assertThat(Operation.NE.apply(1, 1L)).isEqualTo(false);
  }

  @Test
  public void testApply() {
    assertThat(Operation.SUBTRACT.apply(Arrays.asList(5, 3))).isEqualTo(2);
    assertThat(Operation.NOT.apply(true)).isEqualTo(false);
    assertThat(Operation.XOR.apply(true, false)).isEqualTo(true);
    assertThatThrownBy(() -> Operation.AND.apply(1, true)).isInstanceOf(EvaluationException.class);
  }
}
