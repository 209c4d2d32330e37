package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The blob stored at {@code unique_subsets/{subsetId}.json}: a report plus filter metadata.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSubsetDocument.class)
@JsonDeserialize(as = ImmutableSubsetDocument.class)
public interface SubsetDocument {

  int deckTotal();

  List<CardUsage> items();

  /**
   * Filters of the predicate that first produced this subset.
   *
   * @return the filters
   */
  Optional<AppliedFilters> filters();

  Optional<SubsetSource> source();

  /**
   * The report part.
   *
   * @return the subset report
   */
  default SubsetReport report() {
    return ImmutableSubsetReport.builder().deckTotal(deckTotal()).items(items()).build();
  }
}
