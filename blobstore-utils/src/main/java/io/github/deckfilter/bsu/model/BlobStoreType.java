package io.github.deckfilter.bsu.model;

/**
 * Supported blob store backends.
 */
public enum BlobStoreType {
  /**
   * Files under a local root directory.
   */
  FILESYSTEM,

  /**
   * An S3 compatible bucket (AWS S3, Cloudflare R2).
   */
  S3,

  /**
   * Read only access to a public base URL.
   */
  HTTP,

  /**
   * Process local map, used by tests and dry runs.
   */
  MEMORY
}
