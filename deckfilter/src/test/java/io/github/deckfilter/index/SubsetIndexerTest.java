package io.github.deckfilter.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import io.github.deckfilter.DeckFixtures;
import io.github.deckfilter.filter.DeckCardIndex;
import io.github.deckfilter.generator.SubsetBuilder;
import io.github.deckfilter.model.ArchetypeArtifacts;
import io.github.deckfilter.model.ArchetypeIndex;
import io.github.deckfilter.model.ExcludeFilter;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.ImmutableCombinationPlan;
import io.github.deckfilter.model.ImmutableFilterPredicate;
import io.github.deckfilter.model.IncludeFilter;
import io.github.deckfilter.model.MaterializedSubset;
import io.github.deckfilter.model.SubsetResult;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class SubsetIndexerTest {

  private static final FilterPredicate EXCLUDE_CATCHER = ImmutableFilterPredicate.builder()
      .addExclude(ExcludeFilter.of("PAR~160"))
      .build();
  private static final FilterPredicate KIRLIA_WITHOUT_CATCHER = ImmutableFilterPredicate.builder()
      .addInclude(IncludeFilter.of("SVI~085"))
      .addExclude(ExcludeFilter.of("PAR~160"))
      .build();
  private static final FilterPredicate IONO = ImmutableFilterPredicate.builder()
      .addInclude(IncludeFilter.of("PAL~185"))
      .build();
  private static final FilterPredicate UNKNOWN = ImmutableFilterPredicate.builder()
      .addInclude(IncludeFilter.of("XYZ~001"))
      .build();

  @Test
  void index_mergesIdenticalSubsets() {
    // given
    final List<FilterPredicate> predicates = List.of(EXCLUDE_CATCHER, KIRLIA_WITHOUT_CATCHER, IONO, UNKNOWN);

    // when
    final ArchetypeArtifacts artifacts = index(predicates);

    // then
    assertThat(artifacts.archetype()).isEqualTo("Gardevoir ex");
    assertThat(artifacts.archetypeBase()).isEqualTo("Gardevoir_ex");
    assertThat(artifacts.subsets()).extracting(MaterializedSubset::id).containsExactly("subset_001", "subset_002");

    final MaterializedSubset merged = artifacts.subsets().get(0);
    assertThat(merged.primaryFilter()).isEqualTo(EXCLUDE_CATCHER);
    assertThat(merged.alternateFilters()).containsExactly(KIRLIA_WITHOUT_CATCHER);
    assertThat(merged.document().deckTotal()).isEqualTo(7);

    final ArchetypeIndex index = artifacts.index();
    assertThat(index.filterMap()).containsExactly(
        entry("inc:|exc:PAR~160", "subset_001"),
        entry("inc:SVI~085|exc:PAR~160", "subset_001"),
        entry("inc:PAL~185|exc:", "subset_002"));
    assertThat(index.subsets()).containsOnlyKeys("subset_001", "subset_002");
    assertThat(index.subsets().get("subset_001").alternateFilters()).containsExactly(KIRLIA_WITHOUT_CATCHER);
    assertThat(index.deckTotal()).isEqualTo(10);
    assertThat(index.totalCombinations()).isEqualTo(4);
    assertThat(index.uniqueSubsets()).isEqualTo(2);
    assertThat(index.deduplicationRate()).isEqualTo(50.0);
    assertThat(index.generatedAt()).isEqualTo(DeckFixtures.CLOCK.instant());
  }

  @Test
  void index_everyFilterMapValueNamesASubset() {
    final ArchetypeArtifacts artifacts = index(List.of(IONO, EXCLUDE_CATCHER, KIRLIA_WITHOUT_CATCHER));

    assertThat(artifacts.index().filterMap().values())
        .allMatch(id -> artifacts.index().subsets().containsKey(id));
    assertThat(artifacts.subsets().get(0).primaryFilter()).isEqualTo(IONO);
  }

  @Test
  void subsetId_isZeroPadded() {
    assertThat(SubsetIndexer.subsetId(7)).isEqualTo("subset_007");
    assertThat(SubsetIndexer.subsetId(1234)).isEqualTo("subset_1234");
  }

  private static ArchetypeArtifacts index(final List<FilterPredicate> predicates) {
    final DeckCardIndex deckIndex = DeckCardIndex.build(DeckFixtures.gardevoirPool(), DeckFixtures.identity());
    final SubsetBuilder builder = DeckFixtures.subsetBuilder(DeckFixtures.POLICY);
    final List<SubsetResult> results = predicates.stream()
        .map(predicate -> builder.build("Gardevoir ex", predicate, deckIndex, Map.of()))
        .collect(Collectors.toList());
    return DeckFixtures.indexer().index("Gardevoir ex", "Gardevoir_ex", 10,
        ImmutableCombinationPlan.builder()
            .combinations(predicates)
            .optionalCards(0)
            .alwaysIncludedCards(0)
            .qualifyingCards(0)
            .build(),
        results);
  }
}
