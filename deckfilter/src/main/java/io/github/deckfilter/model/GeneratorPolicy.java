package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Bounds of the filter combination generator. These control index size, not correctness.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableGeneratorPolicy.class)
@JsonDeserialize(as = ImmutableGeneratorPolicy.class)
public interface GeneratorPolicy {

  /**
   * Optional cards below this usage get no filters.
   *
   * @return the min card usage percent
   */
  @Value.Default
  default double minCardUsagePercent() {
    return 5.0;
  }

  /**
   * Only the top cards by usage take part in include/exclude cross pairs.
   *
   * @return the cross filter card limit
   */
  @Value.Default
  default int crossFilterCardLimit() {
    return 10;
  }

  /**
   * Most frequent copy counts that get an "exactly N" filter.
   *
   * @return the max count variations
   */
  @Value.Default
  default int maxCountVariations() {
    return 3;
  }

  /**
   * Subsets with fewer decks are not materialized.
   *
   * @return the min subset size
   */
  @Value.Default
  default int minSubsetSize() {
    return 2;
  }

  /**
   * Archetypes with fewer decks are skipped.
   *
   * @return the min decks for analysis
   */
  @Value.Default
  default int minDecksForAnalysis() {
    return 4;
  }

  /**
   * Validates the bounds.
   */
  @Value.Check
  default void check() {
    if (minCardUsagePercent() < 0 || minCardUsagePercent() > 100) {
      throw new IllegalStateException("minCardUsagePercent must be within 0..100");
    }
    if (crossFilterCardLimit() < 0 || maxCountVariations() < 0) {
      throw new IllegalStateException("crossFilterCardLimit and maxCountVariations must not be negative");
    }
    if (minSubsetSize() < 1 || minDecksForAnalysis() < 1) {
      throw new IllegalStateException("minSubsetSize and minDecksForAnalysis must be at least 1");
    }
  }
}
