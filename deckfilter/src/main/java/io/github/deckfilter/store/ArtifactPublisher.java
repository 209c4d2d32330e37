package io.github.deckfilter.store;

import io.github.deckfilter.model.ArchetypeArtifacts;
import io.github.deckfilter.model.Configuration;
import io.github.deckfilter.model.ImmutablePublishSummary;
import io.github.deckfilter.model.PublishSummary;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists many archetypes through a bounded worker pool. A failing archetype is logged and
 * reported; the others are still written.
 */
@Singleton
public class ArtifactPublisher {

  /**
   * Name of the executor the archetypes are written on.
   */
  public static final String PUBLISH_EXECUTOR = "publishExecutor";

  private static final Logger log = LoggerFactory.getLogger(ArtifactPublisher.class);

  private final IncludeExcludeStore store;
  private final ExecutorService executor;
  private final int concurrency;

  /**
   * Instantiates a new Artifact publisher.
   *
   * @param store         the store
   * @param executor      the executor, sized by the persistence concurrency
   * @param configuration the configuration
   */
  @Inject
  public ArtifactPublisher(final IncludeExcludeStore store,
                           @Named(PUBLISH_EXECUTOR) final ExecutorService executor,
                           final Configuration configuration) {
    this.store = store;
    this.executor = executor;
    this.concurrency = configuration.persistenceConcurrency();
  }

  /**
   * Publish.
   *
   * @param tournament the tournament
   * @param artifacts  the artifacts
   * @return the publish summary
   */
  public PublishSummary publish(final String tournament, final List<ArchetypeArtifacts> artifacts) {
    final ImmutablePublishSummary.Builder summary = ImmutablePublishSummary.builder();
    if (artifacts.isEmpty()) {
      return summary.build();
    }
    log.info("Publishing {} archetypes for {} with concurrency {}", artifacts.size(), tournament, concurrency);
    final Map<ArchetypeArtifacts, Future<?>> futures = new LinkedHashMap<>();
    for (ArchetypeArtifacts archetype : artifacts) {
      futures.put(archetype, executor.submit(() -> store.writeArtifacts(tournament, archetype)));
    }
    for (Map.Entry<ArchetypeArtifacts, Future<?>> entry : futures.entrySet()) {
      final String archetype = entry.getKey().archetype();
      try {
        entry.getValue().get();
        summary.addPublished(archetype);
      } catch (ExecutionException e) {
        log.error("Failed to write artifacts for {}", archetype, e.getCause());
        summary.putFailures(archetype, String.valueOf(e.getCause().getMessage()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        summary.putFailures(archetype, "interrupted");
      }
    }
    return summary.build();
  }
}
