package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Usage statistics of one card over a deck pool. This is the item shape shared by materialized
 * subsets and fallback reports.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCardUsage.class)
@JsonDeserialize(as = ImmutableCardUsage.class)
public interface CardUsage {

  /**
   * 1 based rank within the report.
   *
   * @return the rank
   */
  int rank();

  /**
   * Card name.
   *
   * @return the name
   */
  String name();

  /**
   * Canonical set code.
   *
   * @return the set
   */
  Optional<String> set();

  /**
   * Canonical collector number.
   *
   * @return the number
   */
  Optional<String> number();

  /**
   * Canonical uid, {@code Name::SET::NUMBER}.
   *
   * @return the uid
   */
  Optional<String> uid();

  /**
   * Category slug such as {@code trainer/supporter}.
   *
   * @return the category
   */
  Optional<String> category();

  /**
   * Trainer subtype.
   *
   * @return the trainer type
   */
  Optional<String> trainerType();

  /**
   * Energy subtype.
   *
   * @return the energy type
   */
  Optional<String> energyType();

  /**
   * Ace spec flag.
   *
   * @return the ace spec flag
   */
  @Value.Default
  default boolean aceSpec() {
    return false;
  }

  /**
   * Decks containing the card.
   *
   * @return the found count
   */
  int found();

  /**
   * Pool size.
   *
   * @return the total
   */
  int total();

  /**
   * {@code found / total * 100}, rounded to 2 decimals.
   *
   * @return the pct
   */
  double pct();

  /**
   * Copy count histogram, ascending by copies.
   *
   * @return the dist
   */
  List<CopyDistribution> dist();
}
