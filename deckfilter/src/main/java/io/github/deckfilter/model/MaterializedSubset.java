package io.github.deckfilter.model;

import java.util.List;
import org.immutables.value.Value;

/**
 * One unique subset, ready to be written.
 */
@Value.Immutable
public interface MaterializedSubset {

  /**
   * Sequential id, {@code subset_001}.
   *
   * @return the id
   */
  String id();

  /**
   * Content hash of the items, used only for deduplication.
   *
   * @return the content hash
   */
  String contentHash();

  SubsetDocument document();

  FilterPredicate primaryFilter();

  List<FilterPredicate> alternateFilters();
}
