package io.github.deckfilter.store;

import io.github.deckfilter.normalize.CardKeyNormalizer;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Blob layout.
 * <pre>
 *   include-exclude/{tournament}/{archetype}/index.json
 *   include-exclude/{tournament}/{archetype}/unique_subsets/{subsetId}.json
 *   reports/{tournament}/decks.json
 * </pre>
 */
@Singleton
public class BlobKeys {

  /**
   * Root folder of materialized artifacts.
   */
  public static final String INCLUDE_EXCLUDE_ROOT = "include-exclude";

  /**
   * Synonym database key.
   */
  public static final String SYNONYMS = "assets/card-synonyms.json";

  /**
   * Card type database key.
   */
  public static final String CARD_TYPES = "assets/data/card-types.json";

  private final CardKeyNormalizer normalizer;

  /**
   * Instantiates a new Blob keys.
   *
   * @param normalizer the normalizer
   */
  @Inject
  public BlobKeys(final CardKeyNormalizer normalizer) {
    this.normalizer = normalizer;
  }

  /**
   * Path segment of an archetype, {@code Gardevoir ex} becomes {@code Gardevoir_ex}.
   *
   * @param archetype the archetype
   * @return the archetype base
   */
  public String archetypeBase(final String archetype) {
    return normalizer.sanitizeForFilename(archetype);
  }

  /**
   * Archetype folder.
   *
   * @param tournament    the tournament
   * @param archetypeBase the archetype base
   * @return the key prefix
   */
  public String archetypeFolder(final String tournament, final String archetypeBase) {
    return INCLUDE_EXCLUDE_ROOT + "/" + tournamentFolder(tournament) + "/" + archetypeBase;
  }

  /**
   * Index key.
   *
   * @param tournament    the tournament
   * @param archetypeBase the archetype base
   * @return the key
   */
  public String index(final String tournament, final String archetypeBase) {
    return archetypeFolder(tournament, archetypeBase) + "/index.json";
  }

  /**
   * Subset key.
   *
   * @param tournament    the tournament
   * @param archetypeBase the archetype base
   * @param subsetId      the subset id
   * @return the key
   */
  public String subset(final String tournament, final String archetypeBase, final String subsetId) {
    return archetypeFolder(tournament, archetypeBase) + "/unique_subsets/" + normalizer.sanitizeForPath(subsetId)
        + ".json";
  }

  /**
   * Raw deck corpus key.
   *
   * @param tournament the tournament
   * @return the key
   */
  public String deckCorpus(final String tournament) {
    return "reports/" + tournamentFolder(tournament) + "/decks.json";
  }

  private String tournamentFolder(final String tournament) {
    final String folder = normalizer.sanitizeForPath(tournament);
    if (folder.isEmpty()) {
      throw new IllegalArgumentException("Tournament name is empty after sanitizing: " + tournament);
    }
    return folder;
  }
}
