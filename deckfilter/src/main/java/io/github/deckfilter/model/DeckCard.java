package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One line of a decklist: a card printing and how many copies the deck runs.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableDeckCard.class)
@JsonDeserialize(as = ImmutableDeckCard.class)
public interface DeckCard {

  /**
   * Card name.
   *
   * @return the name
   */
  @Value.Default
  default String name() {
    return "Unknown Card";
  }

  /**
   * Raw set code, as delivered by ingestion.
   *
   * @return the set
   */
  Optional<String> set();

  /**
   * Raw collector number. Numeric JSON values are coerced to text.
   *
   * @return the number
   */
  Optional<String> number();

  /**
   * Copies of this printing in the deck.
   *
   * @return the count
   */
  @Value.Default
  default int count() {
    return 0;
  }

  /**
   * Base category (pokemon, trainer, energy).
   *
   * @return the category
   */
  Optional<String> category();

  /**
   * Trainer subtype (supporter, item, stadium, tool).
   *
   * @return the trainer type
   */
  Optional<String> trainerType();

  /**
   * Energy subtype (basic, special).
   *
   * @return the energy type
   */
  Optional<String> energyType();

  /**
   * Ace spec flag.
   *
   * @return true for ace spec cards
   */
  @Value.Default
  default boolean aceSpec() {
    return false;
  }
}
