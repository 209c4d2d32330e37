package io.github.deckfilter.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.deckfilter.DeckFixtures;
import io.github.deckfilter.model.ExcludeFilter;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.ImmutableFilterPredicate;
import io.github.deckfilter.model.ImmutableIncludeFilter;
import io.github.deckfilter.model.ImmutableSynonymDatabase;
import io.github.deckfilter.model.IncludeFilter;
import io.github.deckfilter.model.QuantityOperator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PredicateNormalizerTest {

  private final PredicateNormalizer normalizer = DeckFixtures.predicateNormalizer();

  @Test
  void filterKey_independentOfOrderAndDuplicates() {
    final FilterPredicate first = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("svi~84"), IncludeFilter.of("PAL~185"), IncludeFilter.of("SVI~084"))
        .addExclude(ExcludeFilter.of("PAR~160"))
        .build();
    final FilterPredicate second = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("PAL~185"), IncludeFilter.of("SVI~084"))
        .addExclude(ExcludeFilter.of("par~160"), ExcludeFilter.of("PAR~160"))
        .build();

    assertThat(normalizer.filterKey(first))
        .isEqualTo(normalizer.filterKey(second))
        .isEqualTo("inc:PAL~185+SVI~084|exc:PAR~160");
  }

  @ParameterizedTest
  @CsvSource({
      "=, 0",
      "<, 1",
      "<=, 0"
  })
  void normalize_zeroCopiesIncludeBecomesExclude(final String operator, final int count) {
    final FilterPredicate predicate = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("PAL~185", QuantityOperator.fromSymbol(operator), count))
        .build();

    final FilterPredicate normalized = normalizer.normalize(predicate);

    assertThat(normalized.include()).isEmpty();
    assertThat(normalized.exclude()).containsExactly(ExcludeFilter.of("PAL~185"));
  }

  @ParameterizedTest
  @CsvSource({
      ">, 0",
      ">=, 1",
      "any, 3"
  })
  void normalize_atLeastOneCopyBecomesPresence(final String operator, final int count) {
    final FilterPredicate predicate = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("PAL~185", QuantityOperator.fromSymbol(operator), count))
        .build();

    assertThat(normalizer.filterKey(predicate)).isEqualTo("inc:PAL~185|exc:");
  }

  @Test
  void filterKey_reprintIdsUseCanonicalPrinting() {
    final PredicateNormalizer withSynonyms = DeckFixtures.predicateNormalizer(ImmutableSynonymDatabase.builder()
        .putSynonyms("Iono::PAL::269", "Iono::PAL::185")
        .putSynonyms("Counter Catcher::CRZ::131", "Counter Catcher::PAR::160")
        .build());
    final FilterPredicate predicate = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("pal~269", QuantityOperator.GTE, 2), IncludeFilter.of("SVI~084"))
        .addExclude(ExcludeFilter.of("CRZ~131"))
        .build();

    assertThat(withSynonyms.filterKey(predicate)).isEqualTo("inc:PAL~185:>=2+SVI~084|exc:PAR~160");
  }

  @Test
  void normalize_countWithoutOperatorMeansExactly() {
    final FilterPredicate predicate = ImmutableFilterPredicate.builder()
        .addInclude(ImmutableIncludeFilter.builder().cardId("PAL~185").count(2).build())
        .build();

    assertThat(normalizer.filterKey(predicate)).isEqualTo("inc:PAL~185:=2|exc:");
  }

  @Test
  void normalize_keepsComparison() {
    final FilterPredicate predicate = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("svi~5", QuantityOperator.GTE, 2))
        .build();

    final FilterPredicate normalized = normalizer.normalize(predicate);

    assertThat(normalized.include()).containsExactly(IncludeFilter.of("SVI~005", QuantityOperator.GTE, 2));
    assertThat(FilterKeys.of(normalized)).isEqualTo("inc:SVI~005:>=2|exc:");
  }

  @Test
  void normalize_negativeCount_throws() {
    final FilterPredicate predicate = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("PAL~185", QuantityOperator.EQ, -1))
        .build();

    assertThatThrownBy(() -> normalizer.normalize(predicate))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Negative count");
  }

  @Test
  void normalize_blankCardId_throws() {
    final FilterPredicate predicate = ImmutableFilterPredicate.builder()
        .addExclude(ExcludeFilter.of(" "))
        .build();

    assertThatThrownBy(() -> normalizer.normalize(predicate)).isInstanceOf(IllegalArgumentException.class);
  }
}
