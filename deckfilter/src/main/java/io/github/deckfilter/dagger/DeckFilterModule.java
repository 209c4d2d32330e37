package io.github.deckfilter.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.deckfilter.bsu.BlobStore;
import io.github.deckfilter.bsu.factory.BlobStoreFactory;
import io.github.deckfilter.model.CardTypeDatabase;
import io.github.deckfilter.model.Configuration;
import io.github.deckfilter.model.SynonymDatabase;
import io.github.deckfilter.resolver.IntentPrefetcher;
import io.github.deckfilter.resolver.SubsetResolver;
import io.github.deckfilter.store.ArtifactPublisher;
import io.github.deckfilter.store.ReferenceDataLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * The type Deck filter module.
 */
@Module
public class DeckFilterModule {

  /**
   * Instantiates a new Deck filter module.
   */
  public DeckFilterModule() {
    // Default constructor
  }

  /**
   * Blob store.
   *
   * @param factory the factory
   * @return the blob store
   */
  @Provides
  @Singleton
  public BlobStore blobStore(final BlobStoreFactory factory) {
    return factory.createBlobStore();
  }

  /**
   * Synonym database, from the configuration when given, otherwise from the blob store.
   *
   * @param configuration the configuration
   * @param loader        the loader
   * @param blobStore     the blob store
   * @return the synonym database
   */
  @Provides
  @Singleton
  public SynonymDatabase synonymDatabase(final Configuration configuration,
                                         final ReferenceDataLoader loader,
                                         final BlobStore blobStore) {
    return configuration.synonymDatabase().orElseGet(() -> loader.loadSynonyms(blobStore));
  }

  /**
   * Card type database, from the configuration when given, otherwise from the blob store.
   *
   * @param configuration the configuration
   * @param loader        the loader
   * @param blobStore     the blob store
   * @return the card type database
   */
  @Provides
  @Singleton
  public CardTypeDatabase cardTypeDatabase(final Configuration configuration,
                                           final ReferenceDataLoader loader,
                                           final BlobStore blobStore) {
    return configuration.cardTypeDatabase().orElseGet(() -> loader.loadCardTypes(blobStore));
  }

  /**
   * Resolver executor.
   *
   * @param configuration the configuration
   * @return the executor service
   */
  @Provides
  @Singleton
  @Named(SubsetResolver.RESOLVER_EXECUTOR)
  public ExecutorService resolverExecutor(final Configuration configuration) {
    return Executors.newFixedThreadPool(configuration.resolverThreads(), daemonThreads("deckfilter-resolver"));
  }

  /**
   * Executor the archetype artifacts are written on.
   *
   * @param configuration the configuration
   * @return the executor service
   */
  @Provides
  @Singleton
  @Named(ArtifactPublisher.PUBLISH_EXECUTOR)
  public ExecutorService publishExecutor(final Configuration configuration) {
    return Executors.newFixedThreadPool(configuration.persistenceConcurrency(), daemonThreads("deckfilter-publish"));
  }

  /**
   * Intent scheduler.
   *
   * @return the scheduled executor service
   */
  @Provides
  @Singleton
  @Named(IntentPrefetcher.INTENT_SCHEDULER)
  public ScheduledExecutorService intentScheduler() {
    return Executors.newSingleThreadScheduledExecutor(daemonThreads("deckfilter-intent"));
  }

  private static ThreadFactory daemonThreads(final String prefix) {
    final AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      final Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
