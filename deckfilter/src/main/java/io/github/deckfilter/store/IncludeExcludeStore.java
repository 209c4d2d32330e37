package io.github.deckfilter.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.deckfilter.bsu.BlobStore;
import io.github.deckfilter.exception.DeckFilterException;
import io.github.deckfilter.model.ArchetypeArtifacts;
import io.github.deckfilter.model.ArchetypeIndex;
import io.github.deckfilter.model.Deck;
import io.github.deckfilter.model.MaterializedSubset;
import io.github.deckfilter.model.SubsetDocument;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes include/exclude artifacts and the raw deck corpus. An artifact that is missing
 * or cannot be parsed reads as empty; blob store failures propagate as
 * {@link io.github.deckfilter.bsu.BlobStoreException}.
 */
@Singleton
public class IncludeExcludeStore {

  private static final Logger log = LoggerFactory.getLogger(IncludeExcludeStore.class);
  private static final TypeReference<List<Deck>> DECK_LIST = new TypeReference<>() {
  };

  private final BlobStore blobStore;
  private final ObjectMapper objectMapper;
  private final BlobKeys blobKeys;

  /**
   * Instantiates a new Include exclude store.
   *
   * @param blobStore    the blob store
   * @param objectMapper the object mapper
   * @param blobKeys     the blob keys
   */
  @Inject
  public IncludeExcludeStore(final BlobStore blobStore,
                             final ObjectMapper objectMapper,
                             final BlobKeys blobKeys) {
    this.blobStore = blobStore;
    this.objectMapper = objectMapper;
    this.blobKeys = blobKeys;
  }

  /**
   * Read an archetype index.
   *
   * @param tournament    the tournament
   * @param archetypeBase the archetype base
   * @return the index
   */
  public Optional<ArchetypeIndex> readIndex(final String tournament, final String archetypeBase) {
    return read(blobKeys.index(tournament, archetypeBase), ArchetypeIndex.class);
  }

  /**
   * Read a subset document.
   *
   * @param tournament    the tournament
   * @param archetypeBase the archetype base
   * @param subsetId      the subset id
   * @return the subset document
   */
  public Optional<SubsetDocument> readSubset(final String tournament,
                                             final String archetypeBase,
                                             final String subsetId) {
    return read(blobKeys.subset(tournament, archetypeBase, subsetId), SubsetDocument.class);
  }

  /**
   * Read the raw deck corpus of a tournament.
   *
   * @param tournament the tournament
   * @return the decks
   */
  public Optional<List<Deck>> readDeckCorpus(final String tournament) {
    final String key = blobKeys.deckCorpus(tournament);
    final Optional<byte[]> bytes = blobStore.get(key);
    if (bytes.isEmpty()) {
      log.debug("No deck corpus at {}", key);
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(bytes.get(), DECK_LIST));
    } catch (IOException e) {
      log.warn("Unreadable deck corpus at {}: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Write one archetype's artifacts. Subsets go first so a published index never points at a
   * subset that is not there yet.
   *
   * @param tournament the tournament
   * @param artifacts  the artifacts
   */
  public void writeArtifacts(final String tournament, final ArchetypeArtifacts artifacts) {
    for (MaterializedSubset subset : artifacts.subsets()) {
      blobStore.put(blobKeys.subset(tournament, artifacts.archetypeBase(), subset.id()), toJson(subset.document()));
    }
    blobStore.put(blobKeys.index(tournament, artifacts.archetypeBase()), toJson(artifacts.index()));
    log.info("Wrote {} subsets for {} to {}", artifacts.subsets().size(), artifacts.archetype(),
        blobKeys.archetypeFolder(tournament, artifacts.archetypeBase()));
  }

  /**
   * Publish the raw deck corpus used by the fallback path.
   *
   * @param tournament the tournament
   * @param decks      the decks
   */
  public void writeDeckCorpus(final String tournament, final List<Deck> decks) {
    blobStore.put(blobKeys.deckCorpus(tournament), toJson(decks));
    log.info("Wrote deck corpus of {} decks for {}", decks.size(), tournament);
  }

  private <T> Optional<T> read(final String key, final Class<T> type) {
    final Optional<byte[]> bytes = blobStore.get(key);
    if (bytes.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(bytes.get(), type));
    } catch (IOException e) {
      log.warn("Unreadable {} at {}: {}", type.getSimpleName(), key, e.getMessage());
      return Optional.empty();
    }
  }

  private byte[] toJson(final Object value) {
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (IOException e) {
      throw new DeckFilterException("Unable to serialize " + value.getClass().getSimpleName(), e);
    }
  }
}
