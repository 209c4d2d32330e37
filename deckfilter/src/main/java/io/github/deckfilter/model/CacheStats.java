package io.github.deckfilter.model;

import org.immutables.value.Value;

/**
 * Resolver cache sizes.
 */
@Value.Immutable
public interface CacheStats {

  int indexCacheSize();

  int subsetCacheSize();

  int corpusCacheSize();

  /**
   * Fetches not yet completed.
   *
   * @return the pending fetches
   */
  int pendingFetches();
}
