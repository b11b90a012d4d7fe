package ai.statues;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import lombok.experimental.UtilityClass;

/**
 * Common distributions. Every call returns new, independent random variables.
 */
@UtilityClass
public class StandardDistributions {
  public Leaf<Integer> die(final int faces) {
    return Leaf.interval(1, faces);
  }

  /**
   * The total of {@code n} independent dice.
   */
  public Leaf<Object> dice(final int n, final int faces) {
    return die(faces).times(n);
  }

  /**
   * The values of {@code n} independent dice, as tuples.
   *
   * @param sorted whether the order of the dice is irrelevant
   */
  public Leaf<ImmutableList<Object>> diceSeq(final int n, final int faces, final boolean sorted) {
    return die(faces).draw(n, sorted, true);
  }

  /**
   * A fair boolean.
   */
  public Leaf<Boolean> flip() {
    return Leaf.boolProb(1, 2);
  }

  public Leaf<String> cardSuite() {
    return sequence("SHDC");
  }

  /**
   * Ace, 2 to 9, Ten, Jack, Queen and King.
   */
  public Leaf<String> cardRank() {
    return sequence("A23456789TJQK");
  }

  /**
   * A card of a standard 52 card deck, as rank followed by suite.
   */
  @SuppressWarnings("unchecked")
  public Leaf<String> card() {
    return (Leaf<String>) (Leaf<?>) cardRank().add(cardSuite()).evaluate();
  }

  private Leaf<String> sequence(final String symbols) {
    final List<String> values = new ArrayList<>();
    for (final char symbol : symbols.toCharArray()) {
      values.add(String.valueOf(symbol));
    }
    return Leaf.fromSequence(values, Settings.DEFAULT);
  }
}
