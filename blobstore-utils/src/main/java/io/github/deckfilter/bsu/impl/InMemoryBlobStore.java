package io.github.deckfilter.bsu.impl;

import io.github.deckfilter.bsu.BlobStore;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process local blob store.
 */
public class InMemoryBlobStore implements BlobStore {

  private final ConcurrentMap<String, byte[]> blobs = new ConcurrentHashMap<>();

  @Override
  public Optional<byte[]> get(final String key) {
    return Optional.ofNullable(blobs.get(key)).map(byte[]::clone);
  }

  @Override
  public void put(final String key, final byte[] bytes, final String contentType) {
    blobs.put(key, bytes.clone());
  }

  /**
   * Stored keys in lexical order.
   *
   * @return the keys
   */
  public Set<String> keys() {
    return new TreeSet<>(blobs.keySet());
  }
}
