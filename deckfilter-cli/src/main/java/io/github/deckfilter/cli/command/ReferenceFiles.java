package io.github.deckfilter.cli.command;

import io.github.deckfilter.dagger.CommonModule;
import io.github.deckfilter.model.CardTypeDatabase;
import io.github.deckfilter.model.ImmutableConfiguration;
import io.github.deckfilter.model.SynonymDatabase;
import io.github.deckfilter.normalize.CardKeyNormalizer;
import io.github.deckfilter.store.ReferenceDataLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads reference databases given as local files, before the component exists.
 */
final class ReferenceFiles {

  private ReferenceFiles() {
    // Utility
  }

  /**
   * Add the databases of the given files to a configuration under construction.
   *
   * @param builder   the builder
   * @param synonyms  synonym file, may be null
   * @param cardTypes card type file, may be null
   * @throws IOException if a file cannot be read
   */
  static void apply(final ImmutableConfiguration.Builder builder,
                    final Path synonyms,
                    final Path cardTypes) throws IOException {
    if (synonyms == null && cardTypes == null) {
      return;
    }
    final ReferenceDataLoader loader =
        new ReferenceDataLoader(new CommonModule().objectMapper(), new CardKeyNormalizer());
    if (synonyms != null) {
      final SynonymDatabase database = loader.parseSynonyms(Files.readAllBytes(synonyms));
      builder.synonymDatabase(database);
    }
    if (cardTypes != null) {
      final CardTypeDatabase database = loader.parseCardTypes(Files.readAllBytes(cardTypes));
      builder.cardTypeDatabase(database);
    }
  }
}
