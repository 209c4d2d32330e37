package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A single tournament decklist. Produced by ingestion, read only here.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableDeck.class)
@JsonDeserialize(as = ImmutableDeck.class)
public interface Deck {

  /**
   * Deck id (a content hash from ingestion).
   *
   * @return the id
   */
  Optional<String> id();

  /**
   * Archetype label.
   *
   * @return the archetype
   */
  @Value.Default
  default String archetype() {
    return "Unknown";
  }

  /**
   * Tournament reference.
   *
   * @return the tournament id
   */
  Optional<String> tournamentId();

  /**
   * Tournament display name.
   *
   * @return the tournament name
   */
  Optional<String> tournamentName();

  /**
   * Final placing, 1 based.
   *
   * @return the placement
   */
  Optional<Integer> placement();

  /**
   * Field size of the tournament.
   *
   * @return the tournament players
   */
  Optional<Integer> tournamentPlayers();

  /**
   * Decklist.
   *
   * @return the cards
   */
  List<DeckCard> cards();

  /**
   * Placement derived success tags (winner, top8, top25...).
   *
   * @return the success tags
   */
  List<String> successTags();
}
