package io.github.deckfilter.resolver;

import io.github.deckfilter.exception.ArtifactNotFoundException;
import io.github.deckfilter.exception.CorpusTimeoutException;
import io.github.deckfilter.exception.CorpusUnavailableException;
import io.github.deckfilter.exception.DeckFilterException;
import io.github.deckfilter.filter.FilterKeys;
import io.github.deckfilter.filter.PredicateNormalizer;
import io.github.deckfilter.model.ArchetypeIndex;
import io.github.deckfilter.model.CacheStats;
import io.github.deckfilter.model.Configuration;
import io.github.deckfilter.model.Deck;
import io.github.deckfilter.model.ExcludeFilter;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.ImmutableCacheStats;
import io.github.deckfilter.model.ImmutableFilterPredicate;
import io.github.deckfilter.model.ImmutableIncludeFilter;
import io.github.deckfilter.model.ImmutableResolvedReport;
import io.github.deckfilter.model.ReportOrigin;
import io.github.deckfilter.model.ResolveRequest;
import io.github.deckfilter.model.ResolvedReport;
import io.github.deckfilter.model.SubsetDocument;
import io.github.deckfilter.model.SubsetReport;
import io.github.deckfilter.store.BlobKeys;
import io.github.deckfilter.store.IncludeExcludeStore;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves report requests against the materialized artifacts, computing the report from the raw
 * deck corpus when no materialized subset matches.
 * <ul>
 *   <li>Quantity and success tag requests always take the fallback.</li>
 *   <li>Index, subset and corpus fetches are single flight and memoized per
 *   (tournament, archetype[, subset]).</li>
 *   <li>A missing or unreadable index or subset is a miss, never an error.</li>
 *   <li>The corpus fetch is bounded by a timeout and fails with {@link CorpusTimeoutException},
 *   distinct from {@link CorpusUnavailableException}.</li>
 * </ul>
 */
@Singleton
public class SubsetResolver {

  /**
   * Executor used for artifact fetches.
   */
  public static final String RESOLVER_EXECUTOR = "resolverExecutor";

  private static final Logger log = LoggerFactory.getLogger(SubsetResolver.class);
  private static final String SEPARATOR = "::";

  private final IncludeExcludeStore store;
  private final BlobKeys blobKeys;
  private final PredicateNormalizer predicateNormalizer;
  private final FallbackReportGenerator fallbackGenerator;
  private final ExecutorService executor;
  private final Duration corpusFetchTimeout;

  private final SingleFlightCache<String, ArchetypeIndex> indexCache = new SingleFlightCache<>();
  private final SingleFlightCache<String, SubsetDocument> subsetCache = new SingleFlightCache<>();
  private final SingleFlightCache<String, List<Deck>> corpusCache = new SingleFlightCache<>();

  /**
   * Instantiates a new Subset resolver.
   *
   * @param store               the store
   * @param blobKeys            the blob keys
   * @param predicateNormalizer the predicate normalizer
   * @param fallbackGenerator   the fallback generator
   * @param executor            the executor
   * @param configuration       the configuration
   */
  @Inject
  public SubsetResolver(final IncludeExcludeStore store,
                        final BlobKeys blobKeys,
                        final PredicateNormalizer predicateNormalizer,
                        final FallbackReportGenerator fallbackGenerator,
                        @Named(RESOLVER_EXECUTOR) final ExecutorService executor,
                        final Configuration configuration) {
    this.store = store;
    this.blobKeys = blobKeys;
    this.predicateNormalizer = predicateNormalizer;
    this.fallbackGenerator = fallbackGenerator;
    this.executor = executor;
    this.corpusFetchTimeout = configuration.corpusFetchTimeout();
  }

  /**
   * Resolve a request.
   *
   * @param request the request
   * @return the future report; fails with {@link CorpusTimeoutException} or
   *     {@link CorpusUnavailableException} only when the fallback cannot run
   * @throws IllegalArgumentException on an invalid card id or count
   */
  public CompletableFuture<ResolvedReport> resolve(final ResolveRequest request) {
    final FilterPredicate predicate = predicateOf(request);
    final String filterKey = FilterKeys.of(predicate);
    if (request.requiresFallback()) {
      log.info("Quantity or success filter on {}/{}, computing {} from the corpus",
          request.tournament(), request.archetype(), filterKey);
      return fallback(request, predicate, filterKey);
    }

    final String tournament = request.tournament();
    final String archetypeBase = blobKeys.archetypeBase(request.archetype());
    return optionalIndex(tournament, archetypeBase).thenCompose(index -> {
      final Optional<String> subsetId = index.map(found -> found.filterMap().get(filterKey));
      if (subsetId.isEmpty()) {
        log.info("No materialized subset for {} in {}/{}", filterKey, tournament, archetypeBase);
        return fallback(request, predicate, filterKey);
      }
      return subset(tournament, archetypeBase, subsetId.get())
          .handle((document, error) -> {
            if (error != null) {
              log.warn("Subset {} of {}/{} unavailable: {}", subsetId.get(), tournament, archetypeBase,
                  unwrap(error).getMessage());
              return Optional.<SubsetDocument>empty();
            }
            return Optional.of(document);
          })
          .thenCompose(document -> {
            if (document.isEmpty()) {
              return fallback(request, predicate, filterKey);
            }
            log.debug("Materialized hit {} -> {}", filterKey, subsetId.get());
            return CompletableFuture.completedFuture(ImmutableResolvedReport.builder()
                .origin(ReportOrigin.MATERIALIZED)
                .filterKey(filterKey)
                .subsetId(subsetId)
                .report(document.get().report())
                .filters(document.get().filters())
                .build());
          });
    });
  }

  /**
   * Resolve and wait.
   *
   * @param request the request
   * @return the resolved report
   */
  public ResolvedReport resolveNow(final ResolveRequest request) {
    try {
      return resolve(request).get();
    } catch (ExecutionException e) {
      throw asRuntime(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DeckFilterException("Interrupted while resolving " + request, e);
    }
  }

  /**
   * Fetch the index and resolve the subset id of a presence predicate without fetching the subset.
   *
   * @param tournament the tournament
   * @param archetype  the archetype
   * @param includeIds the include ids
   * @param excludeIds the exclude ids
   * @return the subset id, empty on a miss or a fetch failure
   */
  public CompletableFuture<Optional<String>> preResolve(final String tournament,
                                                        final String archetype,
                                                        final List<String> includeIds,
                                                        final List<String> excludeIds) {
    final String filterKey = FilterKeys.of(predicateNormalizer.normalize(ImmutableFilterPredicate.builder()
        .include(includeIds.stream().map(id -> ImmutableIncludeFilter.builder().cardId(id).build())
            .collect(Collectors.toList()))
        .exclude(excludeIds.stream().map(ExcludeFilter::of).collect(Collectors.toList()))
        .build()));
    return optionalIndex(tournament, blobKeys.archetypeBase(archetype))
        .thenApply(index -> index.map(found -> found.filterMap().get(filterKey)));
  }

  /**
   * Warm the index cache.
   *
   * @param tournament the tournament
   * @param archetype  the archetype
   * @return true when an index exists
   */
  public CompletableFuture<Boolean> preCacheIndex(final String tournament, final String archetype) {
    return optionalIndex(tournament, blobKeys.archetypeBase(archetype)).thenApply(Optional::isPresent);
  }

  /**
   * Cache statistics.
   *
   * @return the cache stats
   */
  public CacheStats stats() {
    return ImmutableCacheStats.builder()
        .indexCacheSize(indexCache.size())
        .subsetCacheSize(subsetCache.size())
        .corpusCacheSize(corpusCache.size())
        .pendingFetches(indexCache.pending() + subsetCache.pending() + corpusCache.pending())
        .build();
  }

  /**
   * Drop everything cached for a tournament, for example after a new generation run.
   *
   * @param tournament the tournament
   */
  public void invalidateTournament(final String tournament) {
    final String prefix = tournament + SEPARATOR;
    indexCache.invalidate(key -> key.startsWith(prefix));
    subsetCache.invalidate(key -> key.startsWith(prefix));
    corpusCache.invalidate(key -> key.startsWith(prefix));
    log.info("Invalidated cached artifacts of {}", tournament);
  }

  /**
   * Drop every cache entry.
   */
  public void clearAll() {
    indexCache.clear();
    subsetCache.clear();
    corpusCache.clear();
  }

  private FilterPredicate predicateOf(final ResolveRequest request) {
    final ImmutableFilterPredicate.Builder builder = ImmutableFilterPredicate.builder();
    for (String cardId : request.includeIds()) {
      builder.addInclude(ImmutableIncludeFilter.builder()
          .cardId(cardId)
          .operator(request.quantityOperator())
          .count(request.quantityCount())
          .build());
    }
    for (String cardId : request.excludeIds()) {
      builder.addExclude(ExcludeFilter.of(cardId));
    }
    return predicateNormalizer.normalize(builder.build());
  }

  private CompletableFuture<Optional<ArchetypeIndex>> optionalIndex(final String tournament,
                                                                   final String archetypeBase) {
    final String key = tournament + SEPARATOR + archetypeBase + SEPARATOR + "index";
    return indexCache.get(key, ignored -> CompletableFuture.supplyAsync(() -> store.readIndex(tournament, archetypeBase)
            .orElseThrow(() -> new ArtifactNotFoundException("No index for " + tournament + "/" + archetypeBase)),
            executor))
        .handle((index, error) -> {
          if (error != null) {
            log.warn("Index of {}/{} unavailable: {}", tournament, archetypeBase, unwrap(error).getMessage());
            return Optional.empty();
          }
          return Optional.of(index);
        });
  }

  private CompletableFuture<SubsetDocument> subset(final String tournament,
                                                   final String archetypeBase,
                                                   final String subsetId) {
    final String key = tournament + SEPARATOR + archetypeBase + SEPARATOR + subsetId;
    return subsetCache.get(key, ignored -> CompletableFuture.supplyAsync(
        () -> store.readSubset(tournament, archetypeBase, subsetId)
            .orElseThrow(() -> new ArtifactNotFoundException("No subset " + key)),
        executor));
  }

  private CompletableFuture<List<Deck>> corpus(final String tournament) {
    final String key = tournament + SEPARATOR + "corpus";
    return corpusCache.get(key, ignored -> CompletableFuture.supplyAsync(
            () -> store.readDeckCorpus(tournament)
                .orElseThrow(() -> new CorpusUnavailableException("No deck corpus for " + tournament)),
            executor)
        .orTimeout(corpusFetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .handle((decks, error) -> {
          if (error == null) {
            return decks;
          }
          final Throwable cause = unwrap(error);
          if (cause instanceof TimeoutException) {
            throw new CorpusTimeoutException("Deck corpus of " + tournament + " not fetched within "
                + corpusFetchTimeout.toMillis() + " ms", cause);
          }
          if (cause instanceof DeckFilterException) {
            throw (DeckFilterException) cause;
          }
          throw new CorpusUnavailableException("Deck corpus of " + tournament + " unreadable", cause);
        }));
  }

  private CompletableFuture<ResolvedReport> fallback(final ResolveRequest request,
                                                     final FilterPredicate predicate,
                                                     final String filterKey) {
    return corpus(request.tournament()).thenApply(decks -> {
      final SubsetReport report = fallbackGenerator.generate(decks, request.archetype(), predicate,
          request.successTag());
      return ImmutableResolvedReport.builder()
          .origin(ReportOrigin.FALLBACK)
          .filterKey(filterKey)
          .report(report)
          .build();
    });
  }

  private static Throwable unwrap(final Throwable error) {
    Throwable cause = error;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  private static RuntimeException asRuntime(final Throwable error) {
    final Throwable cause = unwrap(error);
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    return new DeckFilterException("Resolution failed", cause);
  }
}
