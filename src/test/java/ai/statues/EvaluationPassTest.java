package ai.statues;

import static ai.statues.StandardDistributions.die;
import static ai.statues.TestUtil.p;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import org.junit.jupiter.api.Test;

import lombok.val;

public class EvaluationPassTest {
  @Test
  public void testSharedCount() {
    val x = die(6);
    try (final EvaluationPass pass = EvaluationPass.open(x.add(x), Settings.DEFAULT)) {
      assertThat(pass.sharedCount()).isEqualTo(1);
    }
    try (final EvaluationPass pass = EvaluationPass.open(x.add(die(6)), Settings.DEFAULT)) {
      assertThat(pass.sharedCount()).isEqualTo(0);
    }
  }

  @Test
  public void testBindingLifetime() {
    val x = die(6);
    val sum = x.add(x);
    val pass = EvaluationPass.open(sum, Settings.DEFAULT);
    val outcomes = pass.iterate(sum);
    assertThat(pass.isBound(x)).isFalse();

    val first = outcomes.next();
    assertThat(first.value()).isEqualTo(2);
    assertThat(first.weight()).isEqualTo(p(1, 6));
    assertThat(pass.isBound(x)).isTrue();

    assertThat(Iterators.size(outcomes)).isEqualTo(5);
    assertThat(pass.isBound(x)).isFalse();
  }

  @Test
  public void testCloseReleasesBindings() {
    val x = die(6);
    val sum = x.add(x);
    val pass = EvaluationPass.open(sum, Settings.DEFAULT);
    pass.iterate(sum).next();
    assertThat(pass.isBound(x)).isTrue();
    pass.close();
    assertThat(pass.isBound(x)).isFalse();
  }

  @Test
  public void testSingleReferenceIsNotBound() {
    val x = die(6);
    val y = die(6);
    val sum = x.add(y);
    try (final EvaluationPass pass = EvaluationPass.open(sum, Settings.DEFAULT)) {
      pass.iterate(sum).next();
      assertThat(pass.isBound(x)).isFalse();
      assertThat(pass.isBound(y)).isFalse();
    }
  }

  @Test
  public void testIterateAll() {
    val x = Leaf.fromValues(1, 2);
    val y = Leaf.fromValues("a", "b");
    try (final EvaluationPass pass = EvaluationPass.open(Distribution.joint(x, y), Settings.DEFAULT)) {
      assertThat(pass.iterateAll(Arrays.asList(x, y))).toIterable()
          .extracting(Outcome::value)
          .containsExactly(ImmutableList.of(1, "a"), ImmutableList.of(1, "b"), ImmutableList.of(2, "a"),
              ImmutableList.of(2, "b"));
    }
  }

  @Test
  public void testIterateNothing() {
    val x = Leaf.certain(1);
    try (final EvaluationPass pass = EvaluationPass.open(x, Settings.DEFAULT)) {
      val only = pass.iterateAll(Collections.emptyList()).next();
      assertThat(only.value()).isEmpty();
      assertThat(only.weight().isOne()).isTrue();
    }
  }

  @Test
  public void testObservations() {
    val x = die(6);
    val y = die(6);
    val sum = x.add(y);
    val observations = new IdentityHashMap<Leaf<?>, Object>();
    observations.put(x, 6);
    try (final EvaluationPass pass = EvaluationPass.open(sum, Settings.DEFAULT, observations)) {
      assertThat(pass.iterate(sum)).toIterable().extracting(Outcome::value)
          .containsExactly(7, 8, 9, 10, 11, 12);
    }
  }
}
