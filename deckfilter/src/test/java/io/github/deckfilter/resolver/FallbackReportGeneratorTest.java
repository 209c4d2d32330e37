package io.github.deckfilter.resolver;

import static io.github.deckfilter.DeckFixtures.card;
import static io.github.deckfilter.DeckFixtures.deck;
import static org.assertj.core.api.Assertions.assertThat;

import io.github.deckfilter.DeckFixtures;
import io.github.deckfilter.filter.DeckCardIndex;
import io.github.deckfilter.filter.PredicateEvaluator;
import io.github.deckfilter.model.Deck;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.ImmutableDeck;
import io.github.deckfilter.model.ImmutableFilterPredicate;
import io.github.deckfilter.model.ImmutableSynonymDatabase;
import io.github.deckfilter.model.IncludeFilter;
import io.github.deckfilter.model.SubsetReport;
import io.github.deckfilter.model.SynonymDatabase;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FallbackReportGeneratorTest {

  private static final FilterPredicate IONO = ImmutableFilterPredicate.builder()
      .addInclude(IncludeFilter.of("PAL~185"))
      .build();

  private FallbackReportGenerator generator;
  private List<Deck> corpus;

  @BeforeEach
  void setUp() {
    generator = DeckFixtures.fallback();
    corpus = new ArrayList<>(DeckFixtures.gardevoirPool());
    corpus.add(deck("l1", "Lugia VSTAR", card("Lugia V", "SIT", "138", 4), card("Iono", "PAL", "185", 2)));
  }

  @Test
  void generate_matchesAggregationOfTheSelectedDecks() {
    // given
    final DeckCardIndex index = DeckCardIndex.build(DeckFixtures.gardevoirPool(), DeckFixtures.identity());
    final SubsetReport expected = DeckFixtures.aggregator()
        .aggregate(index.decksAt(new PredicateEvaluator().evaluate(IONO, index)));

    // when
    final SubsetReport report = generator.generate(corpus, "Gardevoir ex", IONO, Optional.empty());

    // then
    assertThat(report).isEqualTo(expected);
    assertThat(report.deckTotal()).isEqualTo(6);
  }

  @Test
  void generate_reprintCardIdSelectsDecksRunningEitherPrinting() {
    // given
    final SynonymDatabase synonyms = ImmutableSynonymDatabase.builder()
        .putSynonyms("Iono::PAL::269", "Iono::PAL::185")
        .build();
    final List<Deck> decks = List.of(
        deck("r1", "Chien-Pao ex", card("Chien-Pao ex", "PAL", "61", 2), card("Iono", "PAL", "269", 2)),
        deck("r2", "Chien-Pao ex", card("Chien-Pao ex", "PAL", "61", 2), card("Iono", "PAL", "269", 1),
            card("Iono", "PAL", "185", 1)),
        deck("r3", "Chien-Pao ex", card("Chien-Pao ex", "PAL", "61", 2)));
    final FilterPredicate reprint = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("PAL~269"))
        .build();

    // when
    final SubsetReport report = DeckFixtures.fallback(synonyms)
        .generate(decks, "Chien-Pao ex", reprint, Optional.empty());

    // then
    assertThat(report.deckTotal()).isEqualTo(2);
    assertThat(report).isEqualTo(DeckFixtures.fallback(synonyms)
        .generate(decks, "Chien-Pao ex", IONO, Optional.empty()));
  }

  @Test
  void generate_acceptsArchetypeFileBase() {
    final SubsetReport report = generator.generate(corpus, "gardevoir_ex", IONO, Optional.empty());

    assertThat(report.deckTotal()).isEqualTo(6);
  }

  @Test
  void generate_unknownArchetype_isEmpty() {
    assertThat(generator.generate(corpus, "Chien-Pao ex", IONO, Optional.empty())).isEqualTo(SubsetReport.empty());
  }

  @Test
  void generate_noMatchingDeck_isEmpty() {
    final FilterPredicate predicate = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("SIT~138"))
        .build();

    final SubsetReport report = generator.generate(corpus, "Gardevoir ex", predicate, Optional.empty());

    assertThat(report.deckTotal()).isZero();
    assertThat(report.items()).isEmpty();
  }

  @Test
  void generate_appliesSuccessTag() {
    // given
    final List<Deck> placed = new ArrayList<>();
    final List<Deck> pool = DeckFixtures.gardevoirPool();
    for (int i = 0; i < pool.size(); i++) {
      placed.add(ImmutableDeck.builder().from(pool.get(i)).placement(i + 1).tournamentPlayers(64).build());
    }

    // when
    final SubsetReport report = generator.generate(placed, "Gardevoir ex", IONO, Optional.of("top4"));

    // then
    assertThat(report.deckTotal()).isEqualTo(4);
  }
}
