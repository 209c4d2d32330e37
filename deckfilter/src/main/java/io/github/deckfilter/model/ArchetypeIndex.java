package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.Map;
import org.immutables.value.Value;

/**
 * The per archetype index: filter keys to subset ids plus subset metadata. Replaced wholesale on
 * every generation run.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableArchetypeIndex.class)
@JsonDeserialize(as = ImmutableArchetypeIndex.class)
public interface ArchetypeIndex {

  String archetype();

  int deckTotal();

  /**
   * Predicates evaluated, accepted or not.
   *
   * @return the total combinations
   */
  int totalCombinations();

  int uniqueSubsets();

  /**
   * Share of combinations that did not produce a new subset, rounded to 2 decimals.
   *
   * @return the deduplication rate
   */
  double deduplicationRate();

  /**
   * Card summaries keyed by CardKey.
   *
   * @return the cards
   */
  Map<String, CardSummary> cards();

  /**
   * FilterKey to subset id.
   *
   * @return the filter map
   */
  Map<String, String> filterMap();

  Map<String, SubsetMetadata> subsets();

  Instant generatedAt();
}
