package io.github.deckfilter.resolver;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Maps keys to single flight futures. Concurrent requests for a key share one load; a failed load
 * is evicted so the next request retries.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class SingleFlightCache<K, V> {

  private final ConcurrentMap<K, CompletableFuture<V>> entries = new ConcurrentHashMap<>();
  private final AtomicInteger pending = new AtomicInteger();

  /**
   * The cached future of the key, starting the loader when there is none.
   *
   * @param key    the key
   * @param loader the loader
   * @return the future
   */
  public CompletableFuture<V> get(final K key, final Function<K, CompletableFuture<V>> loader) {
    final CompletableFuture<V> existing = entries.get(key);
    if (existing != null) {
      return existing;
    }
    final CompletableFuture<V> placeholder = new CompletableFuture<>();
    final CompletableFuture<V> raced = entries.putIfAbsent(key, placeholder);
    if (raced != null) {
      return raced;
    }
    pending.incrementAndGet();
    final CompletableFuture<V> load;
    try {
      load = loader.apply(key);
    } catch (RuntimeException e) {
      settle(key, placeholder, null, e);
      return placeholder;
    }
    load.whenComplete((value, error) -> settle(key, placeholder, value, error));
    return placeholder;
  }

  /**
   * The value of a successfully completed entry.
   *
   * @param key the key
   * @return the value
   */
  public Optional<V> peek(final K key) {
    final CompletableFuture<V> future = entries.get(key);
    if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
      return Optional.empty();
    }
    return Optional.ofNullable(future.join());
  }

  /**
   * Entries, including in flight ones.
   *
   * @return the size
   */
  public int size() {
    return entries.size();
  }

  /**
   * Loads not yet completed.
   *
   * @return the pending count
   */
  public int pending() {
    return pending.get();
  }

  /**
   * Evict the matching keys.
   *
   * @param filter the filter
   */
  public void invalidate(final Predicate<K> filter) {
    entries.keySet().removeIf(filter);
  }

  /**
   * Evict everything.
   */
  public void clear() {
    entries.clear();
  }

  private void settle(final K key, final CompletableFuture<V> placeholder, final V value, final Throwable error) {
    pending.decrementAndGet();
    if (error != null) {
      entries.remove(key, placeholder);
      placeholder.completeExceptionally(error);
    } else {
      placeholder.complete(value);
    }
  }
}
