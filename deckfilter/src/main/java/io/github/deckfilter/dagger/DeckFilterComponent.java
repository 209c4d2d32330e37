package io.github.deckfilter.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Component;
import io.github.deckfilter.bsu.BlobStore;
import io.github.deckfilter.filter.PredicateNormalizer;
import io.github.deckfilter.model.Configuration;
import io.github.deckfilter.normalize.CardKeyNormalizer;
import io.github.deckfilter.pipeline.MaterializationPipeline;
import io.github.deckfilter.report.ReportAggregator;
import io.github.deckfilter.resolver.FallbackReportGenerator;
import io.github.deckfilter.resolver.IntentPrefetcher;
import io.github.deckfilter.resolver.SubsetResolver;
import io.github.deckfilter.store.IncludeExcludeStore;
import io.github.deckfilter.store.ReferenceDataLoader;
import javax.inject.Singleton;

/**
 * The interface Deck filter component.
 */
@Singleton
@Component(modules = {DeckFilterModule.class, ConfigurationModule.class, CommonModule.class})
public interface DeckFilterComponent {

  /**
   * Instance deck filter component.
   *
   * @param configuration the configuration
   * @return the deck filter component
   */
  static DeckFilterComponent instance(final Configuration configuration) {
    return DaggerDeckFilterComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Materialization pipeline.
   *
   * @return the materialization pipeline
   */
  MaterializationPipeline materializationPipeline();

  /**
   * Subset resolver.
   *
   * @return the subset resolver
   */
  SubsetResolver subsetResolver();

  /**
   * Intent prefetcher.
   *
   * @return the intent prefetcher
   */
  IntentPrefetcher intentPrefetcher();

  /**
   * Include exclude store.
   *
   * @return the include exclude store
   */
  IncludeExcludeStore includeExcludeStore();

  /**
   * Blob store.
   *
   * @return the blob store
   */
  BlobStore blobStore();

  /**
   * Report aggregator.
   *
   * @return the report aggregator
   */
  ReportAggregator reportAggregator();

  /**
   * Fallback report generator (for testing).
   *
   * @return the fallback report generator
   */
  FallbackReportGenerator fallbackReportGenerator();

  /**
   * Predicate normalizer.
   *
   * @return the predicate normalizer
   */
  PredicateNormalizer predicateNormalizer();

  /**
   * Card key normalizer.
   *
   * @return the card key normalizer
   */
  CardKeyNormalizer cardKeyNormalizer();

  /**
   * Reference data loader.
   *
   * @return the reference data loader
   */
  ReferenceDataLoader referenceDataLoader();

  /**
   * Object mapper.
   *
   * @return the object mapper
   */
  ObjectMapper objectMapper();
}
