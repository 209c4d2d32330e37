package io.github.deckfilter.generator;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.deckfilter.DeckFixtures;
import io.github.deckfilter.filter.DeckCardIndex;
import io.github.deckfilter.filter.PredicateEvaluator;
import io.github.deckfilter.model.AppliedFilters;
import io.github.deckfilter.model.CardSummary;
import io.github.deckfilter.model.ExcludeFilter;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.ImmutableFilterPredicate;
import io.github.deckfilter.model.ImmutableGeneratorPolicy;
import io.github.deckfilter.model.IncludeFilter;
import io.github.deckfilter.model.QuantityOperator;
import io.github.deckfilter.model.SubsetDocument;
import io.github.deckfilter.model.SubsetResult;
import io.github.deckfilter.model.SubsetStatus;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SubsetBuilderTest {

  private SubsetBuilder builder;
  private DeckCardIndex index;
  private Map<String, CardSummary> cards;

  @BeforeEach
  void setUp() {
    builder = DeckFixtures.subsetBuilder(ImmutableGeneratorPolicy.builder().minSubsetSize(3).build());
    index = DeckCardIndex.build(DeckFixtures.gardevoirPool(), DeckFixtures.identity());
    cards = DeckFixtures.generator(DeckFixtures.POLICY)
        .plan(DeckFixtures.aggregator().aggregate(DeckFixtures.gardevoirPool()))
        .cards();
  }

  @Test
  void build_noMatch_isEmpty() {
    final SubsetResult result = builder.build("Gardevoir ex", include(IncludeFilter.of("XYZ~001")), index, cards);

    assertThat(result.status()).isEqualTo(SubsetStatus.EMPTY);
    assertThat(result.deckCount()).isZero();
    assertThat(result.document()).isEmpty();
  }

  @Test
  void build_excludeLeavingWholePool_isNoOp() {
    final FilterPredicate predicate = ImmutableFilterPredicate.builder()
        .addExclude(ExcludeFilter.of("XYZ~001"))
        .build();

    final SubsetResult result = builder.build("Gardevoir ex", predicate, index, cards);

    assertThat(result.status()).isEqualTo(SubsetStatus.NO_OP);
    assertThat(result.deckCount()).isEqualTo(10);
  }

  @Test
  void build_belowMinimumSize_isTooSmall() {
    final SubsetResult result = builder.build("Gardevoir ex",
        include(IncludeFilter.of("PAL~185", QuantityOperator.EQ, 2)), index, cards);

    assertThat(result.status()).isEqualTo(SubsetStatus.TOO_SMALL);
    assertThat(result.deckCount()).isEqualTo(2);
    assertThat(result.document()).isEmpty();
  }

  @Test
  void build_accepted_carriesReportAndFilterMetadata() {
    // given
    final FilterPredicate predicate = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("PAL~185"))
        .addExclude(ExcludeFilter.of("PAR~160"))
        .build();

    // when
    final SubsetResult result = builder.build("Gardevoir ex", predicate, index, cards);

    // then
    assertThat(result.status()).isEqualTo(SubsetStatus.ACCEPTED);
    assertThat(result.deckCount()).isEqualTo(3);
    final SubsetDocument document = result.document().orElseThrow();
    assertThat(document.deckTotal()).isEqualTo(3);
    assertThat(document.report()).isEqualTo(DeckFixtures.aggregator()
        .aggregate(index.decksAt(new PredicateEvaluator().evaluate(predicate, index))));
    final AppliedFilters filters = document.filters().orElseThrow();
    assertThat(filters.baseDeckTotal()).isEqualTo(10);
    assertThat(filters.include()).singleElement().satisfies(detail -> {
      assertThat(detail.id()).isEqualTo("PAL~185");
      assertThat(detail.name()).hasValue("Iono");
    });
    assertThat(filters.exclude()).singleElement().satisfies(detail ->
        assertThat(detail.name()).hasValue("Counter Catcher"));
    assertThat(document.source()).hasValueSatisfying(source -> {
      assertThat(source.archetype()).isEqualTo("Gardevoir ex");
      assertThat(source.generatedAt()).isEqualTo(DeckFixtures.CLOCK.instant());
    });
  }

  private static FilterPredicate include(final IncludeFilter filter) {
    return ImmutableFilterPredicate.builder().addInclude(filter).build();
  }
}
