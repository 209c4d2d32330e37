package io.github.deckfilter.bsu.impl;

import io.github.deckfilter.bsu.BlobStore;
import java.util.Optional;

/**
 * Decorator that places every key below a fixed prefix.
 */
public class PrefixedBlobStore implements BlobStore {

  private final BlobStore delegate;
  private final String prefix;

  /**
   * Instantiates a new Prefixed blob store.
   *
   * @param delegate the delegate
   * @param prefix   the prefix, with or without trailing slash
   */
  public PrefixedBlobStore(final BlobStore delegate, final String prefix) {
    this.delegate = delegate;
    this.prefix = prefix.endsWith("/") ? prefix : prefix + "/";
  }

  @Override
  public Optional<byte[]> get(final String key) {
    return delegate.get(prefix + key);
  }

  @Override
  public void put(final String key, final byte[] bytes, final String contentType) {
    delegate.put(prefix + key, bytes, contentType);
  }
}
