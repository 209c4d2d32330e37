package io.github.deckfilter.bsu;

import java.util.Optional;

/**
 * An opaque key to bytes store. Keys are slash separated paths such as
 * {@code include-exclude/Online/Gardevoir/index.json}.
 */
public interface BlobStore {

  /**
   * The content type used when none is given.
   */
  String JSON_CONTENT_TYPE = "application/json";

  /**
   * Fetch the bytes stored under the key.
   *
   * @param key the key
   * @return the bytes, or empty if nothing is stored under the key
   * @throws BlobStoreException if the store could not be read
   */
  Optional<byte[]> get(String key);

  /**
   * Store bytes under the key, replacing any previous value.
   *
   * @param key         the key
   * @param bytes       the bytes
   * @param contentType the content type
   * @throws BlobStoreException if the store could not be written
   */
  void put(String key, byte[] bytes, String contentType);

  /**
   * Store JSON bytes under the key.
   *
   * @param key   the key
   * @param bytes the bytes
   */
  default void put(final String key, final byte[] bytes) {
    put(key, bytes, JSON_CONTENT_TYPE);
  }

}
