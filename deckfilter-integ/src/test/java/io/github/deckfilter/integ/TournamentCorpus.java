package io.github.deckfilter.integ;

import io.github.deckfilter.model.Deck;
import io.github.deckfilter.model.DeckCard;
import io.github.deckfilter.model.ImmutableDeck;
import io.github.deckfilter.model.ImmutableDeckCard;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded synthetic tournament: two analyzable archetypes with flexible slots and one archetype too
 * small to analyze.
 */
public final class TournamentCorpus {

  public static final String TOURNAMENT = "Online - Last 14 Days";
  public static final String GARDEVOIR = "Gardevoir ex";
  public static final String CHARIZARD = "Charizard ex";
  public static final String LOST_BOX = "Lost Box";

  private static final long SEED = 20240501L;

  private TournamentCorpus() {
  }

  /**
   * The decks.
   *
   * @return the decks
   */
  public static List<Deck> decks() {
    final Random random = new Random(SEED);
    final List<Deck> decks = new ArrayList<>();
    int placing = 1;
    for (int i = 0; i < 24; i++) {
      decks.add(deck("gar-" + i, GARDEVOIR, placing++, random,
          List.of(card("Ralts", "SVI", "84", 4), card("Kirlia", "SVI", "85", 2 + random.nextInt(2)),
              card("Gardevoir ex", "SVI", "86", 2)),
          List.of(card("Iono", "PAL", "185", 1), card("Super Rod", "PAL", "188", 1),
              card("Counter Catcher", "PAR", "160", 1), card("Drifloon", "SVI", "89", 1),
              card("Scream Tail", "PAR", "86", 1), card("Bravery Charm", "PAL", "173", 1))));
    }
    for (int i = 0; i < 14; i++) {
      decks.add(deck("zard-" + i, CHARIZARD, placing++, random,
          List.of(card("Charmander", "MEW", "4", 3), card("Charizard ex", "OBF", "125", 2),
              card("Rare Candy", "SVI", "191", 4)),
          List.of(card("Pidgeot ex", "OBF", "164", 1), card("Iono", "PAL", "185", 1),
              card("Lost Vacuum", "CRZ", "135", 1), card("Manaphy", "BRS", "41", 1))));
    }
    for (int i = 0; i < 3; i++) {
      decks.add(deck("box-" + i, LOST_BOX, placing++, random,
          List.of(card("Comfey", "LOR", "79", 4)),
          List.of(card("Iono", "PAL", "185", 1))));
    }
    return decks;
  }

  private static Deck deck(final String id,
                           final String archetype,
                           final int placing,
                           final Random random,
                           final List<DeckCard> core,
                           final List<DeckCard> flex) {
    final ImmutableDeck.Builder builder = ImmutableDeck.builder()
        .id(id)
        .archetype(archetype)
        .tournamentId("online-14")
        .placement(placing)
        .tournamentPlayers(64)
        .addAllCards(core);
    for (DeckCard card : flex) {
      if (random.nextInt(100) < 55) {
        builder.addCards(ImmutableDeckCard.builder().from(card).count(1 + random.nextInt(3)).build());
      }
    }
    return builder.build();
  }

  private static DeckCard card(final String name, final String set, final String number, final int count) {
    return ImmutableDeckCard.builder().name(name).set(set).number(number).count(count).build();
  }
}
