package io.github.deckfilter.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * A predicate together with its evaluated subset.
 */
@Value.Immutable
public interface SubsetResult {

  FilterPredicate predicate();

  SubsetStatus status();

  /**
   * Eligible decks.
   *
   * @return the deck count
   */
  int deckCount();

  /**
   * Present only when accepted.
   *
   * @return the document
   */
  Optional<SubsetDocument> document();
}
