package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.deckfilter.bsu.model.BlobStoreConfig;
import java.time.Duration;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The deckfilter configuration.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableConfiguration.class)
@JsonDeserialize(as = ImmutableConfiguration.class)
public interface Configuration {

  /**
   * Blob store holding the artifacts and the raw corpus.
   *
   * @return the blob store config
   */
  BlobStoreConfig blobStore();

  /**
   * Generator bounds.
   *
   * @return the generator policy
   */
  @Value.Default
  default GeneratorPolicy generatorPolicy() {
    return ImmutableGeneratorPolicy.builder().build();
  }

  /**
   * Archetypes persisted in parallel.
   *
   * @return the persistence concurrency
   */
  @Value.Default
  default int persistenceConcurrency() {
    return 5;
  }

  /**
   * Budget for fetching the raw deck corpus on the fallback path.
   *
   * @return the corpus fetch timeout
   */
  @Value.Default
  default Duration corpusFetchTimeout() {
    return Duration.ofSeconds(30);
  }

  /**
   * Delay before an intent signal starts prefetching.
   *
   * @return the intent delay
   */
  @Value.Default
  default Duration intentDelay() {
    return Duration.ofMillis(200);
  }

  /**
   * Threads fetching artifacts for the resolver.
   *
   * @return the resolver threads
   */
  @Value.Default
  default int resolverThreads() {
    return 4;
  }

  /**
   * Synonyms to use instead of the ones stored in the blob store.
   *
   * @return the synonym database
   */
  Optional<SynonymDatabase> synonymDatabase();

  /**
   * Card types to use instead of the ones stored in the blob store.
   *
   * @return the card type database
   */
  Optional<CardTypeDatabase> cardTypeDatabase();

  /**
   * Validates the settings.
   */
  @Value.Check
  default void check() {
    if (persistenceConcurrency() < 1 || resolverThreads() < 1) {
      throw new IllegalStateException("persistenceConcurrency and resolverThreads must be at least 1");
    }
  }
}
