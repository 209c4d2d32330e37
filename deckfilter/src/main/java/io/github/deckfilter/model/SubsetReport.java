package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Card usage over the decks selected by one predicate.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSubsetReport.class)
@JsonDeserialize(as = ImmutableSubsetReport.class)
public interface SubsetReport {

  /**
   * Empty report, for an empty pool.
   *
   * @return the subset report
   */
  static SubsetReport empty() {
    return ImmutableSubsetReport.builder().deckTotal(0).build();
  }

  /**
   * Decks in the subset.
   *
   * @return the deck total
   */
  int deckTotal();

  /**
   * Items, descending by found.
   *
   * @return the items
   */
  List<CardUsage> items();
}
