package io.github.deckfilter.resolver;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.deckfilter.model.Deck;
import io.github.deckfilter.model.ImmutableDeck;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SuccessTagsTest {

  private final SuccessTags successTags = new SuccessTags();

  @Test
  void derive_fromPlacementAndFieldSize() {
    assertThat(successTags.derive(placed(1, 64), Map.of()))
        .containsExactly("winner", "top2", "top4", "top8", "top16", "top10", "top25", "top50");
    assertThat(successTags.derive(placed(7, 64), Map.of()))
        .containsExactly("top8", "top16", "top10", "top25", "top50");
    assertThat(successTags.derive(placed(30, 64), Map.of())).containsExactly("top50");
  }

  @Test
  void derive_smallFieldGetsNoBroadTags() {
    assertThat(successTags.derive(placed(1, 6), Map.of())).containsExactly("winner", "top2");
  }

  @Test
  void derive_explicitTagsWin() {
    final Deck deck = ImmutableDeck.builder().from(placed(1, 64)).addSuccessTags("Top8").build();

    assertThat(successTags.derive(deck, Map.of())).containsExactly("top8");
  }

  @Test
  void derive_usesEstimatedFieldSize() {
    final Deck deck = ImmutableDeck.builder().tournamentId("t1").placement(3).build();

    assertThat(successTags.derive(deck, Map.of("t1", 16))).containsExactly("top4", "top8", "top25", "top50");
    assertThat(successTags.derive(deck, Map.of())).isEmpty();
  }

  @Test
  void filter_keepsTaggedDecks() {
    // given
    final List<Deck> decks = new ArrayList<>();
    for (int placing = 1; placing <= 32; placing++) {
      decks.add(ImmutableDeck.builder().id("d" + placing).tournamentId("t1").placement(placing).build());
    }

    // when
    final List<Deck> top8 = successTags.filter(decks, "TOP8");

    // then
    assertThat(top8).extracting(deck -> deck.id().orElseThrow())
        .containsExactly("d1", "d2", "d3", "d4", "d5", "d6", "d7", "d8");
  }

  @Test
  void filter_allOrUnknownKeepsEverything() {
    final List<Deck> decks = List.of(placed(1, 64), placed(40, 64));

    assertThat(successTags.filter(decks, "all")).isSameAs(decks);
    assertThat(successTags.filter(decks, " ")).isSameAs(decks);
    assertThat(successTags.filter(decks, "podium")).isSameAs(decks);
  }

  @Test
  void fieldSizes_fallsBackToDeckCount() {
    final List<Deck> decks = List.of(
        ImmutableDeck.builder().tournamentId("t1").build(),
        ImmutableDeck.builder().tournamentId("t1").build(),
        ImmutableDeck.builder().tournamentId("t2").placement(12).build());

    assertThat(successTags.fieldSizes(decks)).containsEntry("t1", 2).containsEntry("t2", 12);
  }

  private static Deck placed(final int placing, final int players) {
    return ImmutableDeck.builder().tournamentId("t1").placement(placing).tournamentPlayers(players).build();
  }
}
