package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The answer to a {@link ResolveRequest}.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableResolvedReport.class)
@JsonDeserialize(as = ImmutableResolvedReport.class)
public interface ResolvedReport {

  ReportOrigin origin();

  /**
   * FilterKey of the normalized request predicate.
   *
   * @return the filter key
   */
  String filterKey();

  /**
   * Subset id on a materialized hit.
   *
   * @return the subset id
   */
  Optional<String> subsetId();

  SubsetReport report();

  /**
   * Filter metadata of the materialized subset.
   *
   * @return the filters
   */
  Optional<AppliedFilters> filters();

  /**
   * True when computed from the raw corpus.
   *
   * @return the generated client side flag
   */
  @Value.Derived
  default boolean generatedClientSide() {
    return origin() == ReportOrigin.FALLBACK;
  }
}
