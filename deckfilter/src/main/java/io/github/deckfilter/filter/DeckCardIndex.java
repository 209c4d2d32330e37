package io.github.deckfilter.filter;

import io.github.deckfilter.model.Deck;
import io.github.deckfilter.model.DeckCard;
import io.github.deckfilter.normalize.CardIdentityResolver;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per card, per deck copy counts over one pool. Decks are addressed by their position in the pool.
 * Built once per pool and never modified, so concurrent evaluations can share it.
 */
public final class DeckCardIndex {

  private static final int[] NO_COUNTS = new int[0];

  private final List<Deck> decks;
  private final Map<String, int[]> counts;
  private final Map<String, BitSet> presence;

  private DeckCardIndex(final List<Deck> decks,
                        final Map<String, int[]> counts,
                        final Map<String, BitSet> presence) {
    this.decks = decks;
    this.counts = counts;
    this.presence = presence;
  }

  /**
   * Index a pool. Same card copies within a deck, including reprints the identity resolver merges,
   * are summed. Cards without a CardKey are not indexed.
   *
   * @param pool             the decks
   * @param identityResolver the identity resolver
   * @return the index
   */
  public static DeckCardIndex build(final List<Deck> pool, final CardIdentityResolver identityResolver) {
    final List<Deck> decks = List.copyOf(pool);
    final Map<String, int[]> counts = new HashMap<>();
    final Map<String, BitSet> presence = new HashMap<>();
    for (int position = 0; position < decks.size(); position++) {
      for (DeckCard card : decks.get(position).cards()) {
        if (card.count() <= 0) {
          continue;
        }
        final Optional<String> cardKey = identityResolver.cardKey(card);
        if (cardKey.isEmpty()) {
          continue;
        }
        counts.computeIfAbsent(cardKey.get(), key -> new int[decks.size()])[position] += card.count();
        presence.computeIfAbsent(cardKey.get(), key -> new BitSet(decks.size())).set(position);
      }
    }
    return new DeckCardIndex(decks, counts, presence);
  }

  /**
   * Decks in the pool.
   *
   * @return the deck count
   */
  public int deckCount() {
    return decks.size();
  }

  /**
   * A fresh set holding every deck position.
   *
   * @return the bit set
   */
  public BitSet allDecks() {
    final BitSet all = new BitSet(decks.size());
    all.set(0, decks.size());
    return all;
  }

  /**
   * A fresh set of the decks containing the card.
   *
   * @param cardKey the card key
   * @return the bit set
   */
  public BitSet decksWith(final String cardKey) {
    final BitSet bits = presence.get(cardKey);
    return bits == null ? new BitSet(decks.size()) : (BitSet) bits.clone();
  }

  /**
   * Copies of the card in the deck at the position, zero when absent.
   *
   * @param cardKey  the card key
   * @param position the deck position
   * @return the copies
   */
  public int copies(final String cardKey, final int position) {
    final int[] perDeck = counts.getOrDefault(cardKey, NO_COUNTS);
    return position < perDeck.length ? perDeck[position] : 0;
  }

  /**
   * The decks at the given positions, in pool order.
   *
   * @param positions the positions
   * @return the decks
   */
  public List<Deck> decksAt(final BitSet positions) {
    final List<Deck> selected = new ArrayList<>(positions.cardinality());
    positions.stream().forEach(position -> selected.add(decks.get(position)));
    return selected;
  }

  /**
   * Indexed card keys.
   *
   * @return the card keys
   */
  public Set<String> cardKeys() {
    return Collections.unmodifiableSet(presence.keySet());
  }
}
