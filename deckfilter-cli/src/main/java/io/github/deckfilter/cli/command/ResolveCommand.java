package io.github.deckfilter.cli.command;

import io.github.deckfilter.cli.dagger.CliComponent;
import io.github.deckfilter.exception.CorpusTimeoutException;
import io.github.deckfilter.exception.CorpusUnavailableException;
import io.github.deckfilter.model.Configuration;
import io.github.deckfilter.model.ImmutableConfiguration;
import io.github.deckfilter.model.ImmutableResolveRequest;
import io.github.deckfilter.model.QuantityOperator;
import io.github.deckfilter.model.ResolvedReport;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Resolve command: prints the report of one archetype under include/exclude filters.
 */
@Command(
    name = "resolve",
    description = "Resolve the report of an archetype under include/exclude filters")
public class ResolveCommand implements Callable<Integer> {

  /**
   * Exit code when the raw corpus fetch timed out.
   */
  public static final int EXIT_TIMEOUT = 3;

  /**
   * Exit code when no report could be produced.
   */
  public static final int EXIT_NO_DATA = 4;

  private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

  @Spec
  private CommandSpec spec;

  @Option(
      names = {"--tournament", "-t"},
      description = "Tournament folder name",
      required = true)
  private String tournament;

  @Option(
      names = {"--archetype", "-a"},
      description = "Archetype name or file base",
      required = true)
  private String archetype;

  @Option(
      names = {"--include", "-i"},
      description = "Card id that must be present, e.g. SVI~118 (repeatable)")
  private List<String> includeIds = new ArrayList<>();

  @Option(
      names = {"--exclude", "-x"},
      description = "Card id that must be absent (repeatable)")
  private List<String> excludeIds = new ArrayList<>();

  @Option(
      names = {"--operator"},
      description = "Copy count operator for the included cards: =, <, <=, >, >=, any or none")
  private String operator;

  @Option(
      names = {"--count"},
      description = "Copy count compared by --operator")
  private Integer count;

  @Option(
      names = {"--success-tag"},
      description = "Restrict to a success bucket: winner, top2, top4, top8, top16, top10, top25, top50")
  private String successTag;

  @Option(
      names = {"--timeout-seconds"},
      description = "Raw corpus fetch timeout (default: ${DEFAULT-VALUE})",
      defaultValue = "30")
  private long timeoutSeconds;

  @Option(
      names = {"--output", "-o"},
      description = "Output file (default: standard output)")
  private Path output;

  @Mixin
  private BlobStoreOptions blobStoreOptions;

  @Override
  public Integer call() throws Exception {
    final Configuration configuration = ImmutableConfiguration.builder()
        .blobStore(blobStoreOptions.toConfig())
        .corpusFetchTimeout(Duration.ofSeconds(timeoutSeconds))
        .build();
    final CliComponent component = CliComponent.create(configuration);

    final ImmutableResolveRequest.Builder request = ImmutableResolveRequest.builder()
        .tournament(tournament)
        .archetype(archetype)
        .includeIds(includeIds)
        .excludeIds(excludeIds)
        .quantityCount(Optional.ofNullable(count))
        .successTag(Optional.ofNullable(successTag));
    if (operator != null) {
      request.quantityOperator("none".equalsIgnoreCase(operator)
          ? QuantityOperator.NONE
          : QuantityOperator.fromSymbol(operator));
    }

    final ResolvedReport report;
    try {
      report = component.subsetResolver().resolveNow(request.build());
    } catch (CorpusTimeoutException e) {
      log.error("Timed out: {}", e.getMessage());
      return EXIT_TIMEOUT;
    } catch (CorpusUnavailableException e) {
      log.error("No data: {}", e.getMessage());
      return EXIT_NO_DATA;
    }

    log.info("Resolved {} from {} ({} decks)", report.filterKey(), report.origin(), report.report().deckTotal());
    if (output != null) {
      component.reportPrinter().write(report, output);
    } else {
      component.reportPrinter().print(report, spec.commandLine().getOut());
    }
    return 0;
  }
}
