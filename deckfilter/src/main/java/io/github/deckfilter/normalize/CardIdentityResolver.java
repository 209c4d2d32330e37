package io.github.deckfilter.normalize;

import io.github.deckfilter.model.DeckCard;
import io.github.deckfilter.model.SynonymDatabase;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Maps a deck card onto its canonical identity. Reprints listed in the synonym database collapse
 * onto one uid ({@code Name::SET::NUMBER}) and therefore one CardKey.
 */
@Singleton
public class CardIdentityResolver {

  /**
   * Separator inside a uid.
   */
  public static final String UID_SEPARATOR = "::";

  private final SynonymDatabase synonymDatabase;
  private final CardKeyNormalizer normalizer;
  private final Map<String, String> canonicalKeys;

  /**
   * Instantiates a new Card identity resolver.
   *
   * @param synonymDatabase the synonym database
   * @param normalizer      the normalizer
   */
  @Inject
  public CardIdentityResolver(final SynonymDatabase synonymDatabase,
                              final CardKeyNormalizer normalizer) {
    this.synonymDatabase = synonymDatabase;
    this.normalizer = normalizer;
    this.canonicalKeys = canonicalKeys(synonymDatabase);
  }

  /**
   * Canonical uid of a card. Cards without a set and number are identified by name.
   *
   * @param card the card
   * @return the uid
   */
  public String uid(final DeckCard card) {
    final String set = normalizer.normalizeSet(card.set().orElse(null));
    final String number = normalizer.normalizeNumber(card.number().orElse(null));
    final String raw = set.isEmpty() || number.isEmpty()
        ? card.name()
        : card.name() + UID_SEPARATOR + set + UID_SEPARATOR + number;
    return synonymDatabase.canonicalOf(raw);
  }

  /**
   * Canonical CardKey of a card.
   *
   * @param card the card
   * @return the card key, empty when the card has no set or number
   */
  public Optional<String> cardKey(final DeckCard card) {
    return cardKeyOfUid(uid(card));
  }

  /**
   * CardKey that a request card id resolves to. A reprint listed in the synonym database maps onto
   * the CardKey of its canonical printing, which is the key cards are counted under.
   *
   * @param cardKey the normalized card key
   * @return the canonical card key, or the input when it is not a listed variant
   */
  public String canonicalCardKey(final String cardKey) {
    return canonicalKeys.getOrDefault(cardKey, cardKey);
  }

  /**
   * CardKey encoded in a uid.
   *
   * @param uid the uid
   * @return the card key, empty for name only uids
   */
  public Optional<String> cardKeyOfUid(final String uid) {
    final String[] parts = splitUid(uid);
    if (parts == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(normalizer.normalize(parts[1], parts[2]));
  }

  /**
   * Card name encoded in a uid, or the uid itself for name only identities.
   *
   * @param uid the uid
   * @return the name
   */
  public String nameOfUid(final String uid) {
    final String[] parts = splitUid(uid);
    return parts == null ? uid : parts[0];
  }

  private Map<String, String> canonicalKeys(final SynonymDatabase synonyms) {
    final Map<String, String> keys = new HashMap<>();
    synonyms.synonyms().forEach((variant, canonical) -> {
      final Optional<String> variantKey = cardKeyOfUid(variant);
      final Optional<String> canonicalKey = cardKeyOfUid(synonyms.canonicalOf(canonical));
      if (variantKey.isPresent() && canonicalKey.isPresent() && !variantKey.equals(canonicalKey)) {
        keys.put(variantKey.get(), canonicalKey.get());
      }
    });
    return keys;
  }

  private String[] splitUid(final String uid) {
    if (uid == null) {
      return null;
    }
    final int last = uid.lastIndexOf(UID_SEPARATOR);
    if (last <= 0) {
      return null;
    }
    final int first = uid.lastIndexOf(UID_SEPARATOR, last - 1);
    if (first <= 0) {
      return null;
    }
    return new String[]{
        uid.substring(0, first),
        uid.substring(first + UID_SEPARATOR.length(), last),
        uid.substring(last + UID_SEPARATOR.length())
    };
  }
}
