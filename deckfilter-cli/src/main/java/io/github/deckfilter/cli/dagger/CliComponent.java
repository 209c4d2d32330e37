package io.github.deckfilter.cli.dagger;

import dagger.Component;
import io.github.deckfilter.cli.io.DeckFileReader;
import io.github.deckfilter.cli.io.ReportPrinter;
import io.github.deckfilter.dagger.CommonModule;
import io.github.deckfilter.dagger.ConfigurationModule;
import io.github.deckfilter.dagger.DeckFilterModule;
import io.github.deckfilter.model.Configuration;
import io.github.deckfilter.pipeline.MaterializationPipeline;
import io.github.deckfilter.resolver.SubsetResolver;
import javax.inject.Singleton;

/**
 * Dagger component for CLI tool.
 */
@Singleton
@Component(
    modules = {CliModule.class, DeckFilterModule.class, ConfigurationModule.class, CommonModule.class})
public interface CliComponent {

  /**
   * Create CLI component with configuration.
   *
   * @param configuration the configuration
   * @return the CLI component
   */
  static CliComponent create(final Configuration configuration) {
    return DaggerCliComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
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
   * Deck file reader.
   *
   * @return the deck file reader
   */
  DeckFileReader deckFileReader();

  /**
   * Report printer.
   *
   * @return the report printer
   */
  ReportPrinter reportPrinter();
}
