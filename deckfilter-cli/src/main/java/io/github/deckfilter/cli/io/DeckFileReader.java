package io.github.deckfilter.cli.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.deckfilter.model.Deck;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a tournament's decks from a JSON array file.
 */
public class DeckFileReader {

  private static final Logger log = LoggerFactory.getLogger(DeckFileReader.class);
  private static final TypeReference<List<Deck>> DECK_LIST = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;

  /**
   * Constructor.
   *
   * @param objectMapper the object mapper
   */
  public DeckFileReader(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Read decks.
   *
   * @param path the path
   * @return the decks
   * @throws IOException if the file cannot be read or parsed
   */
  public List<Deck> readDecks(final Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Deck file not found: " + path);
    }
    final List<Deck> decks = objectMapper.readValue(path.toFile(), DECK_LIST);
    log.info("Read {} decks from {}", decks.size(), path);
    return decks;
  }
}
