package ai.statues;

import ai.statues.prob.ProbabilityType;
import lombok.Builder;
import lombok.Value;

/**
 * Evaluation and construction options. Instances are immutable and passed
 * explicitly; {@link #DEFAULT} is used wherever none is given.
 */
@Value
@Builder(toBuilder = true)
public class Settings {
  public static final Settings DEFAULT = Settings.builder().build();

  /**
   * Numeric domain of the probabilities created by factories.
   */
  @Builder.Default
  ProbabilityType probabilityType = ProbabilityType.FRACTION;

  /**
   * Whether clause sets verify that their conditions are disjoint and, absent
   * an else clause, complete.
   */
  @Builder.Default
  boolean checkClauses = true;

  /**
   * Whether probabilities given to factories are checked to lie in [0, 1].
   */
  @Builder.Default
  boolean checkProbabilities = true;

  /**
   * Whether evaluation results are sorted by natural value order, where one
   * exists.
   */
  @Builder.Default
  boolean sorting = true;

  @Builder.Default
  int maxSamplingTries = 1000;
}
