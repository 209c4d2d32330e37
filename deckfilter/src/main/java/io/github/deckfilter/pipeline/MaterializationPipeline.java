package io.github.deckfilter.pipeline;

import io.github.deckfilter.filter.DeckCardIndex;
import io.github.deckfilter.generator.FilterCombinationGenerator;
import io.github.deckfilter.generator.SubsetBuilder;
import io.github.deckfilter.index.SubsetIndexer;
import io.github.deckfilter.model.ArchetypeArtifacts;
import io.github.deckfilter.model.CombinationPlan;
import io.github.deckfilter.model.Deck;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.GeneratorPolicy;
import io.github.deckfilter.model.ImmutablePublishSummary;
import io.github.deckfilter.model.PublishSummary;
import io.github.deckfilter.model.SubsetReport;
import io.github.deckfilter.model.SubsetResult;
import io.github.deckfilter.model.SubsetStatus;
import io.github.deckfilter.normalize.ArchetypeNames;
import io.github.deckfilter.normalize.CardIdentityResolver;
import io.github.deckfilter.report.ReportAggregator;
import io.github.deckfilter.store.ArtifactPublisher;
import io.github.deckfilter.store.BlobKeys;
import io.github.deckfilter.store.IncludeExcludeStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch materialization of one tournament: decks, then archetype pools, reports, combinations,
 * subsets, deduplicated index and finally storage.
 */
@Singleton
public class MaterializationPipeline {

  /**
   * Failure key used when the raw corpus could not be published.
   */
  public static final String CORPUS_FAILURE_KEY = "decks.json";

  private static final Logger log = LoggerFactory.getLogger(MaterializationPipeline.class);

  private final ReportAggregator aggregator;
  private final FilterCombinationGenerator generator;
  private final SubsetBuilder subsetBuilder;
  private final SubsetIndexer indexer;
  private final CardIdentityResolver identityResolver;
  private final ArtifactPublisher publisher;
  private final IncludeExcludeStore store;
  private final BlobKeys blobKeys;
  private final GeneratorPolicy policy;

  /**
   * Instantiates a new Materialization pipeline.
   *
   * @param aggregator       the aggregator
   * @param generator        the generator
   * @param subsetBuilder    the subset builder
   * @param indexer          the indexer
   * @param identityResolver the identity resolver
   * @param publisher        the publisher
   * @param store            the store
   * @param blobKeys         the blob keys
   * @param policy           the policy
   */
  @Inject
  public MaterializationPipeline(final ReportAggregator aggregator,
                                 final FilterCombinationGenerator generator,
                                 final SubsetBuilder subsetBuilder,
                                 final SubsetIndexer indexer,
                                 final CardIdentityResolver identityResolver,
                                 final ArtifactPublisher publisher,
                                 final IncludeExcludeStore store,
                                 final BlobKeys blobKeys,
                                 final GeneratorPolicy policy) {
    this.aggregator = aggregator;
    this.generator = generator;
    this.subsetBuilder = subsetBuilder;
    this.indexer = indexer;
    this.identityResolver = identityResolver;
    this.publisher = publisher;
    this.store = store;
    this.blobKeys = blobKeys;
    this.policy = policy;
  }

  /**
   * Materialize and publish every archetype of a tournament. Failures are isolated per archetype.
   *
   * @param tournament    the tournament folder name
   * @param decks         the tournament's decks
   * @param publishCorpus also publish the raw corpus read by the fallback path
   * @return the publish summary
   */
  public PublishSummary run(final String tournament, final List<Deck> decks, final boolean publishCorpus) {
    log.info("Materializing {} decks of {}", decks.size(), tournament);
    final ImmutablePublishSummary.Builder summary = ImmutablePublishSummary.builder();
    final List<ArchetypeArtifacts> artifacts = new ArrayList<>();

    for (Map.Entry<String, List<Deck>> pool : groupByArchetype(decks).entrySet()) {
      try {
        materialize(pool.getKey(), pool.getValue()).ifPresent(artifacts::add);
      } catch (RuntimeException e) {
        log.error("Failed to materialize {}", pool.getKey(), e);
        summary.putFailures(pool.getKey(), String.valueOf(e.getMessage()));
      }
    }

    final PublishSummary published = publisher.publish(tournament, artifacts);
    summary.addAllPublished(published.published()).putAllFailures(published.failures());

    if (publishCorpus) {
      try {
        store.writeDeckCorpus(tournament, decks);
      } catch (RuntimeException e) {
        log.error("Failed to publish deck corpus of {}", tournament, e);
        summary.putFailures(CORPUS_FAILURE_KEY, String.valueOf(e.getMessage()));
      }
    }
    final PublishSummary result = summary.build();
    log.info("{}: {} archetypes published, {} failed", tournament, result.published().size(),
        result.failures().size());
    return result;
  }

  /**
   * Materialize one archetype pool.
   *
   * @param archetype the archetype display name
   * @param pool      the archetype's decks
   * @return the artifacts, empty when the pool is too small or has no optional cards
   */
  public Optional<ArchetypeArtifacts> materialize(final String archetype, final List<Deck> pool) {
    if (pool.size() < policy.minDecksForAnalysis()) {
      log.info("Skipping {}: only {} decks (minimum {})", archetype, pool.size(), policy.minDecksForAnalysis());
      return Optional.empty();
    }
    final SubsetReport report = aggregator.aggregate(pool);
    final CombinationPlan plan = generator.plan(report);
    if (plan.optionalCards() == 0) {
      log.info("No optional cards for {}", archetype);
      return Optional.empty();
    }
    log.info("{}: {} optional cards, {} always included, {} combinations", archetype, plan.optionalCards(),
        plan.alwaysIncludedCards(), plan.combinations().size());

    final DeckCardIndex index = DeckCardIndex.build(pool, identityResolver);
    final List<SubsetResult> results = new ArrayList<>(plan.combinations().size());
    int skippedSmall = 0;
    for (FilterPredicate predicate : plan.combinations()) {
      final SubsetResult result = subsetBuilder.build(archetype, predicate, index, plan.cards());
      if (result.status() == SubsetStatus.TOO_SMALL) {
        skippedSmall++;
      }
      results.add(result);
    }
    log.debug("{}: skipped {} small subsets", archetype, skippedSmall);
    return Optional.of(indexer.index(archetype, blobKeys.archetypeBase(archetype), pool.size(), plan, results));
  }

  /**
   * Group decks by normalized archetype name, keeping the first label seen as display name.
   *
   * @param decks the decks
   * @return display name to pool
   */
  public Map<String, List<Deck>> groupByArchetype(final List<Deck> decks) {
    final Map<String, String> displayNames = new LinkedHashMap<>();
    final Map<String, List<Deck>> pools = new LinkedHashMap<>();
    for (Deck deck : decks) {
      final String normalized = ArchetypeNames.normalize(deck.archetype());
      final String display = displayNames.computeIfAbsent(normalized,
          key -> deck.archetype().isBlank() ? ArchetypeNames.UNKNOWN : deck.archetype().trim());
      pools.computeIfAbsent(display, key -> new ArrayList<>()).add(deck);
    }
    return pools;
  }
}
