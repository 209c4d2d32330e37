package io.github.deckfilter.model;

/**
 * Where a resolved report came from.
 */
public enum ReportOrigin {
  /**
   * A precomputed subset blob.
   */
  MATERIALIZED,

  /**
   * Computed on request from the raw deck corpus.
   */
  FALLBACK
}
