package io.github.deckfilter.filter;

import io.github.deckfilter.model.ExcludeFilter;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.IncludeFilter;
import io.github.deckfilter.model.QuantityOperator;
import java.util.BitSet;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Selects the decks of a pool matching a normalized predicate.
 */
@Singleton
public class PredicateEvaluator {

  /**
   * Instantiates a new Predicate evaluator.
   */
  @Inject
  public PredicateEvaluator() {
    // Stateless
  }

  /**
   * Evaluate. Each include intersects the eligible set; each exclude removes every deck holding
   * the card. A count qualified include compares the deck's total copies, zero when absent.
   *
   * @param predicate the normalized predicate
   * @param index     the pool index
   * @return the matching deck positions
   */
  public BitSet evaluate(final FilterPredicate predicate, final DeckCardIndex index) {
    final BitSet eligible = index.allDecks();
    for (IncludeFilter include : predicate.include()) {
      if (include.countQualified()) {
        final QuantityOperator operator = include.operator().orElseThrow();
        final int expected = include.count().orElseThrow();
        for (int position = eligible.nextSetBit(0); position >= 0; position = eligible.nextSetBit(position + 1)) {
          if (!operator.matches(index.copies(include.cardId(), position), expected)) {
            eligible.clear(position);
          }
        }
      } else {
        eligible.and(index.decksWith(include.cardId()));
      }
    }
    for (ExcludeFilter exclude : predicate.exclude()) {
      eligible.andNot(index.decksWith(exclude.cardId()));
    }
    return eligible;
  }
}
