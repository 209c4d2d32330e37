package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Index entry of one unique subset.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSubsetMetadata.class)
@JsonDeserialize(as = ImmutableSubsetMetadata.class)
public interface SubsetMetadata {

  int deckTotal();

  /**
   * The predicate that allocated the subset id.
   *
   * @return the primary filters
   */
  FilterPredicate primaryFilters();

  /**
   * Later predicates whose reports hashed identically.
   *
   * @return the alternate filters
   */
  List<FilterPredicate> alternateFilters();
}
