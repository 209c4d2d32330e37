package io.github.deckfilter.filter;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.deckfilter.model.ExcludeFilter;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.ImmutableFilterPredicate;
import io.github.deckfilter.model.IncludeFilter;
import io.github.deckfilter.model.QuantityOperator;
import org.junit.jupiter.api.Test;

class FilterKeysTest {

  @Test
  void of_sortsTokens() {
    final FilterPredicate first = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("SVI~084"), IncludeFilter.of("PAL~185"))
        .addExclude(ExcludeFilter.of("PAR~160"), ExcludeFilter.of("PAL~188"))
        .build();
    final FilterPredicate second = ImmutableFilterPredicate.builder()
        .addInclude(IncludeFilter.of("PAL~185"), IncludeFilter.of("SVI~084"))
        .addExclude(ExcludeFilter.of("PAL~188"), ExcludeFilter.of("PAR~160"))
        .build();

    assertThat(FilterKeys.of(first))
        .isEqualTo(FilterKeys.of(second))
        .isEqualTo("inc:PAL~185+SVI~084|exc:PAL~188+PAR~160");
  }

  @Test
  void of_emptyPredicate() {
    assertThat(FilterKeys.of(ImmutableFilterPredicate.builder().build())).isEqualTo("inc:|exc:");
  }

  @Test
  void token_countQualified() {
    assertThat(FilterKeys.token(IncludeFilter.of("SVI~005", QuantityOperator.GTE, 2))).isEqualTo("SVI~005:>=2");
    assertThat(FilterKeys.token(IncludeFilter.of("SVI~005"))).isEqualTo("SVI~005");
  }
}
