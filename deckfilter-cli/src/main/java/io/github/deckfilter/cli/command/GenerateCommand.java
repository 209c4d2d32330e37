package io.github.deckfilter.cli.command;

import io.github.deckfilter.cli.dagger.CliComponent;
import io.github.deckfilter.model.Configuration;
import io.github.deckfilter.model.Deck;
import io.github.deckfilter.model.ImmutableConfiguration;
import io.github.deckfilter.model.ImmutableGeneratorPolicy;
import io.github.deckfilter.model.PublishSummary;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Generate command: materializes include/exclude subsets of a tournament.
 */
@Command(
    name = "generate",
    description = "Materialize include/exclude subsets for every archetype of a tournament")
public class GenerateCommand implements Callable<Integer> {

  /**
   * Exit code when at least one archetype failed.
   */
  public static final int EXIT_PARTIAL_FAILURE = 2;

  private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

  @Option(
      names = {"--tournament", "-t"},
      description = "Tournament folder name, e.g. \"Online - Last 14 Days\"",
      required = true)
  private String tournament;

  @Option(
      names = {"--decks", "-d"},
      description = "JSON file holding the tournament's decks",
      required = true)
  private Path decksFile;

  @Mixin
  private BlobStoreOptions blobStoreOptions;

  @Option(
      names = {"--min-usage"},
      description = "Minimum card usage percent for filters (default: ${DEFAULT-VALUE})",
      defaultValue = "5")
  private double minUsage;

  @Option(
      names = {"--cross-limit"},
      description = "Top cards used for include/exclude pairs (default: ${DEFAULT-VALUE})",
      defaultValue = "10")
  private int crossLimit;

  @Option(
      names = {"--max-count-variations"},
      description = "Most frequent copy counts per card (default: ${DEFAULT-VALUE})",
      defaultValue = "3")
  private int maxCountVariations;

  @Option(
      names = {"--min-subset-size"},
      description = "Smallest subset stored (default: ${DEFAULT-VALUE})",
      defaultValue = "2")
  private int minSubsetSize;

  @Option(
      names = {"--min-decks"},
      description = "Smallest archetype analyzed (default: ${DEFAULT-VALUE})",
      defaultValue = "4")
  private int minDecks;

  @Option(
      names = {"--concurrency"},
      description = "Archetypes persisted in parallel (default: ${DEFAULT-VALUE})",
      defaultValue = "5")
  private int concurrency;

  @Option(
      names = {"--publish-corpus"},
      description = "Also publish the raw deck corpus used by the fallback path")
  private boolean publishCorpus;

  @Option(
      names = {"--synonyms"},
      description = "Card synonyms JSON file (default: read from the blob store)")
  private Path synonymsFile;

  @Option(
      names = {"--card-types"},
      description = "Card types JSON file (default: read from the blob store)")
  private Path cardTypesFile;

  @Override
  public Integer call() throws Exception {
    log.info("Generating include/exclude subsets for '{}' from {}", tournament, decksFile);

    final ImmutableConfiguration.Builder builder = ImmutableConfiguration.builder()
        .blobStore(blobStoreOptions.toConfig())
        .generatorPolicy(ImmutableGeneratorPolicy.builder()
            .minCardUsagePercent(minUsage)
            .crossFilterCardLimit(crossLimit)
            .maxCountVariations(maxCountVariations)
            .minSubsetSize(minSubsetSize)
            .minDecksForAnalysis(minDecks)
            .build())
        .persistenceConcurrency(concurrency);
    ReferenceFiles.apply(builder, synonymsFile, cardTypesFile);
    final Configuration configuration = builder.build();

    // Initialize Dagger component
    final CliComponent component = CliComponent.create(configuration);
    final List<Deck> decks = component.deckFileReader().readDecks(decksFile);
    final PublishSummary summary = component.materializationPipeline().run(tournament, decks, publishCorpus);

    if (!summary.isSuccess()) {
      summary.failures().forEach((archetype, message) -> log.error("{} failed: {}", archetype, message));
      return EXIT_PARTIAL_FAILURE;
    }
    log.info("Generation completed successfully: {} archetypes published", summary.published().size());
    return 0;
  }
}
