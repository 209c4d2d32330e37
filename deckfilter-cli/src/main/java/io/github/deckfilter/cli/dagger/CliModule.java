package io.github.deckfilter.cli.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import io.github.deckfilter.cli.io.DeckFileReader;
import io.github.deckfilter.cli.io.ReportPrinter;
import javax.inject.Singleton;

/**
 * Dagger module providing CLI dependencies.
 */
@Module
public class CliModule {

  /**
   * Provide deck file reader.
   *
   * @param objectMapper the object mapper
   * @return the deck file reader
   */
  @Provides
  @Singleton
  public DeckFileReader deckFileReader(final ObjectMapper objectMapper) {
    return new DeckFileReader(objectMapper);
  }

  /**
   * Provide report printer.
   *
   * @param objectMapper the object mapper
   * @return the report printer
   */
  @Provides
  @Singleton
  public ReportPrinter reportPrinter(final ObjectMapper objectMapper) {
    return new ReportPrinter(objectMapper);
  }
}
