package io.github.deckfilter.model;

import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Output of the filter combination generator for one archetype.
 */
@Value.Immutable
public interface CombinationPlan {

  /**
   * Normalized predicates in generation order, unique by FilterKey.
   *
   * @return the combinations
   */
  List<FilterPredicate> combinations();

  /**
   * Every card of the report with a CardKey, in report order.
   *
   * @return the cards
   */
  Map<String, CardSummary> cards();

  int optionalCards();

  int alwaysIncludedCards();

  /**
   * Optional cards at or above the usage threshold.
   *
   * @return the qualifying cards
   */
  int qualifyingCards();
}
