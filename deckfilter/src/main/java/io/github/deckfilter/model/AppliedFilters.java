package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Filter metadata attached to a materialized subset.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAppliedFilters.class)
@JsonDeserialize(as = ImmutableAppliedFilters.class)
public interface AppliedFilters {

  List<FilterDetail> include();

  List<FilterDetail> exclude();

  /**
   * Size of the archetype pool the subset was cut from.
   *
   * @return the base deck total
   */
  int baseDeckTotal();
}
