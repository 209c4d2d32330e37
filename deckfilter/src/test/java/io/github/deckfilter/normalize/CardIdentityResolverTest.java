package io.github.deckfilter.normalize;

import static io.github.deckfilter.DeckFixtures.card;
import static org.assertj.core.api.Assertions.assertThat;

import io.github.deckfilter.DeckFixtures;
import io.github.deckfilter.model.ImmutableDeckCard;
import io.github.deckfilter.model.ImmutableSynonymDatabase;
import io.github.deckfilter.model.SynonymDatabase;
import org.junit.jupiter.api.Test;

class CardIdentityResolverTest {

  private final SynonymDatabase synonyms = ImmutableSynonymDatabase.builder()
      .putSynonyms("Iono::PAF::080", "Iono::PAL::185")
      .putCanonicals("Iono", "Iono::PAL::185")
      .build();

  @Test
  void uid_normalizesSetAndNumber() {
    final CardIdentityResolver resolver = DeckFixtures.identity();

    assertThat(resolver.uid(card("Ralts", "svi", "84", 4))).isEqualTo("Ralts::SVI::084");
    assertThat(resolver.cardKey(card("Ralts", "svi", "84", 4))).hasValue("SVI~084");
  }

  @Test
  void uid_reprintResolvesThroughSynonyms() {
    final CardIdentityResolver resolver = DeckFixtures.identity(synonyms);

    assertThat(resolver.uid(card("Iono", "PAF", "80", 1))).isEqualTo("Iono::PAL::185");
    assertThat(resolver.cardKey(card("Iono", "PAF", "80", 1))).hasValue("PAL~185");
  }

  @Test
  void uid_withoutSetUsesNameAndCanonicals() {
    final CardIdentityResolver resolver = DeckFixtures.identity(synonyms);

    assertThat(resolver.uid(ImmutableDeckCard.builder().name("Iono").count(1).build())).isEqualTo("Iono::PAL::185");
    assertThat(resolver.uid(ImmutableDeckCard.builder().name("Basic Psychic Energy").count(8).build()))
        .isEqualTo("Basic Psychic Energy");
    assertThat(resolver.cardKeyOfUid("Basic Psychic Energy")).isEmpty();
  }

  @Test
  void uid_unlistedPrintingDoesNotUseCanonicals() {
    final CardIdentityResolver resolver = DeckFixtures.identity(synonyms);

    assertThat(resolver.uid(card("Iono", "SVP", "124", 1))).isEqualTo("Iono::SVP::124");
  }

  @Test
  void canonicalCardKey_mapsListedReprintOnly() {
    final CardIdentityResolver resolver = DeckFixtures.identity(synonyms);

    assertThat(resolver.canonicalCardKey("PAF~080")).isEqualTo("PAL~185");
    assertThat(resolver.canonicalCardKey("PAL~185")).isEqualTo("PAL~185");
    assertThat(resolver.canonicalCardKey("SVP~124")).isEqualTo("SVP~124");
  }

  @Test
  void nameOfUid_returnsNamePart() {
    final CardIdentityResolver resolver = DeckFixtures.identity();

    assertThat(resolver.nameOfUid("Gardevoir ex::SVI::086")).isEqualTo("Gardevoir ex");
    assertThat(resolver.nameOfUid("Ultra Ball")).isEqualTo("Ultra Ball");
  }
}
