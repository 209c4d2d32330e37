package io.github.deckfilter.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.deckfilter.bsu.BlobStore;
import io.github.deckfilter.exception.DeckFilterException;
import io.github.deckfilter.model.CardTypeDatabase;
import io.github.deckfilter.model.ImmutableCardTypeDatabase;
import io.github.deckfilter.model.ImmutableCardTypeInfo;
import io.github.deckfilter.model.SynonymDatabase;
import io.github.deckfilter.normalize.CardKeyNormalizer;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the synonym and card type databases. Both are optional: a missing database loads as
 * empty, with a warning.
 */
@Singleton
public class ReferenceDataLoader {

  private static final Logger log = LoggerFactory.getLogger(ReferenceDataLoader.class);

  private final ObjectMapper objectMapper;
  private final CardKeyNormalizer normalizer;

  /**
   * Instantiates a new Reference data loader.
   *
   * @param objectMapper the object mapper
   * @param normalizer   the normalizer
   */
  @Inject
  public ReferenceDataLoader(final ObjectMapper objectMapper, final CardKeyNormalizer normalizer) {
    this.objectMapper = objectMapper;
    this.normalizer = normalizer;
  }

  /**
   * Load synonyms from the blob store.
   *
   * @param blobStore the blob store
   * @return the synonym database
   */
  public SynonymDatabase loadSynonyms(final BlobStore blobStore) {
    final Optional<byte[]> bytes = blobStore.get(BlobKeys.SYNONYMS);
    if (bytes.isEmpty()) {
      log.warn("Card synonyms not found at {}; continuing without canonicalization", BlobKeys.SYNONYMS);
      return SynonymDatabase.empty();
    }
    return parseSynonyms(bytes.get());
  }

  /**
   * Parse a synonym database ({@code {"synonyms": {...}, "canonicals": {...}}}).
   *
   * @param bytes the bytes
   * @return the synonym database
   */
  public SynonymDatabase parseSynonyms(final byte[] bytes) {
    try {
      final SynonymDatabase database = objectMapper.readValue(bytes, SynonymDatabase.class);
      log.info("Loaded {} card synonyms", database.synonyms().size());
      return database;
    } catch (IOException e) {
      throw new DeckFilterException("Unreadable card synonyms", e);
    }
  }

  /**
   * Load card types from the blob store.
   *
   * @param blobStore the blob store
   * @return the card type database
   */
  public CardTypeDatabase loadCardTypes(final BlobStore blobStore) {
    final Optional<byte[]> bytes = blobStore.get(BlobKeys.CARD_TYPES);
    if (bytes.isEmpty()) {
      log.warn("Card types not found at {}; continuing without enrichment", BlobKeys.CARD_TYPES);
      return CardTypeDatabase.empty();
    }
    return parseCardTypes(bytes.get());
  }

  /**
   * Parse a card type database. Entries are keyed {@code SET::NUMBER} and carry {@code cardType},
   * {@code subType} and {@code aceSpec}; they are re-keyed by CardKey.
   *
   * @param bytes the bytes
   * @return the card type database
   */
  public CardTypeDatabase parseCardTypes(final byte[] bytes) {
    final JsonNode root;
    try {
      root = objectMapper.readTree(bytes);
    } catch (IOException e) {
      throw new DeckFilterException("Unreadable card types", e);
    }
    final ImmutableCardTypeDatabase.Builder builder = ImmutableCardTypeDatabase.builder();
    int loaded = 0;
    final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      final String[] parts = field.getKey().split("::");
      final String cardKey = parts.length == 2 ? normalizer.normalize(parts[0], parts[1]) : null;
      final String cardType = text(field.getValue(), "cardType");
      if (cardKey == null || cardType == null) {
        continue;
      }
      final String subType = text(field.getValue(), "subType");
      final ImmutableCardTypeInfo.Builder info = ImmutableCardTypeInfo.builder()
          .category(cardType)
          .aceSpec(field.getValue().path("aceSpec").asBoolean(false));
      if ("trainer".equals(cardType.toLowerCase(Locale.ROOT)) && subType != null) {
        info.trainerType(subType);
      } else if ("energy".equals(cardType.toLowerCase(Locale.ROOT)) && subType != null) {
        info.energyType(subType);
      }
      builder.putCards(cardKey, info.build());
      loaded++;
    }
    log.info("Loaded {} card types", loaded);
    return builder.build();
  }

  private String text(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    return value == null || value.isNull() || value.asText().isBlank() ? null : value.asText();
  }
}
