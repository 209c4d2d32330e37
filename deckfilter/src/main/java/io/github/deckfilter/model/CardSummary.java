package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Full pool usage of one card, as listed in the index.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCardSummary.class)
@JsonDeserialize(as = ImmutableCardSummary.class)
public interface CardSummary {

  String name();

  Optional<String> set();

  Optional<String> number();

  double pct();

  int found();

  int total();

  /**
   * Present in every deck at a single copy count.
   *
   * @return true if always included
   */
  boolean alwaysIncluded();

  List<CopyDistribution> dist();
}
