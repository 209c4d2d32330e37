package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Card type lookup keyed by CardKey ({@code SET~NUMBER}). Read only.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCardTypeDatabase.class)
@JsonDeserialize(as = ImmutableCardTypeDatabase.class)
public interface CardTypeDatabase {

  /**
   * Empty database.
   *
   * @return the card type database
   */
  static CardTypeDatabase empty() {
    return ImmutableCardTypeDatabase.builder().build();
  }

  Map<String, CardTypeInfo> cards();

  /**
   * Lookup.
   *
   * @param cardKey the card key
   * @return the type info
   */
  default Optional<CardTypeInfo> lookup(final String cardKey) {
    return cardKey == null ? Optional.empty() : Optional.ofNullable(cards().get(cardKey));
  }
}
