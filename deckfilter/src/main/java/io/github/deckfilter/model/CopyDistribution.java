package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * One bucket of a copy count histogram: how many decks ran exactly {@code copies} copies.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCopyDistribution.class)
@JsonDeserialize(as = ImmutableCopyDistribution.class)
public interface CopyDistribution {

  /**
   * Copies per deck.
   *
   * @return the copies
   */
  int copies();

  /**
   * Decks with that many copies.
   *
   * @return the players
   */
  int players();

  /**
   * Share of the decks containing the card, rounded to 2 decimals.
   *
   * @return the percent
   */
  double percent();
}
