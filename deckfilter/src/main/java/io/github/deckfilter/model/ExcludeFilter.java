package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Reject decks containing a card.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableExcludeFilter.class)
@JsonDeserialize(as = ImmutableExcludeFilter.class)
public interface ExcludeFilter {

  /**
   * Exclude filter.
   *
   * @param cardId the card id
   * @return the exclude filter
   */
  static ExcludeFilter of(final String cardId) {
    return ImmutableExcludeFilter.builder().cardId(cardId).build();
  }

  /**
   * CardKey of the card.
   *
   * @return the card id
   */
  String cardId();
}
