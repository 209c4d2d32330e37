package io.github.deckfilter.model;

/**
 * Outcome of evaluating one predicate for materialization.
 */
public enum SubsetStatus {
  ACCEPTED,
  EMPTY,
  /**
   * Exclude only predicate leaving the whole pool.
   */
  NO_OP,
  TOO_SMALL
}
