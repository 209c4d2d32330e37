package io.github.deckfilter.generator;

import io.github.deckfilter.filter.DeckCardIndex;
import io.github.deckfilter.filter.PredicateEvaluator;
import io.github.deckfilter.model.AppliedFilters;
import io.github.deckfilter.model.CardSummary;
import io.github.deckfilter.model.ExcludeFilter;
import io.github.deckfilter.model.FilterDetail;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.GeneratorPolicy;
import io.github.deckfilter.model.ImmutableAppliedFilters;
import io.github.deckfilter.model.ImmutableFilterDetail;
import io.github.deckfilter.model.ImmutableSubsetDocument;
import io.github.deckfilter.model.ImmutableSubsetResult;
import io.github.deckfilter.model.ImmutableSubsetSource;
import io.github.deckfilter.model.IncludeFilter;
import io.github.deckfilter.model.SubsetReport;
import io.github.deckfilter.model.SubsetResult;
import io.github.deckfilter.model.SubsetStatus;
import io.github.deckfilter.report.ReportAggregator;
import java.time.Clock;
import java.util.BitSet;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Evaluates one predicate against an archetype pool and, when the subset is worth storing, builds
 * its report document.
 */
@Singleton
public class SubsetBuilder {

  private final PredicateEvaluator evaluator;
  private final ReportAggregator aggregator;
  private final GeneratorPolicy policy;
  private final Clock clock;

  /**
   * Instantiates a new Subset builder.
   *
   * @param evaluator  the evaluator
   * @param aggregator the aggregator
   * @param policy     the policy
   * @param clock      the clock
   */
  @Inject
  public SubsetBuilder(final PredicateEvaluator evaluator,
                       final ReportAggregator aggregator,
                       final GeneratorPolicy policy,
                       final Clock clock) {
    this.evaluator = evaluator;
    this.aggregator = aggregator;
    this.policy = policy;
    this.clock = clock;
  }

  /**
   * Build the subset of a normalized predicate. Rejected when no deck matches, when an exclude only
   * predicate leaves the whole pool, or when fewer decks than the minimum subset size match.
   *
   * @param archetype the archetype display name
   * @param predicate the normalized predicate
   * @param index     the pool index
   * @param cards     card summaries for the filter metadata
   * @return the result
   */
  public SubsetResult build(final String archetype,
                            final FilterPredicate predicate,
                            final DeckCardIndex index,
                            final Map<String, CardSummary> cards) {
    final BitSet eligible = evaluator.evaluate(predicate, index);
    final int deckCount = eligible.cardinality();
    final ImmutableSubsetResult.Builder result = ImmutableSubsetResult.builder()
        .predicate(predicate)
        .deckCount(deckCount);

    if (deckCount == 0) {
      return result.status(SubsetStatus.EMPTY).build();
    }
    if (predicate.include().isEmpty() && deckCount == index.deckCount()) {
      return result.status(SubsetStatus.NO_OP).build();
    }
    if (deckCount < policy.minSubsetSize()) {
      return result.status(SubsetStatus.TOO_SMALL).build();
    }

    final SubsetReport report = aggregator.aggregate(index.decksAt(eligible));
    return result.status(SubsetStatus.ACCEPTED)
        .document(ImmutableSubsetDocument.builder()
            .deckTotal(report.deckTotal())
            .items(report.items())
            .filters(appliedFilters(predicate, cards, index.deckCount()))
            .source(ImmutableSubsetSource.builder()
                .archetype(archetype)
                .generatedAt(clock.instant())
                .build())
            .build())
        .build();
  }

  private AppliedFilters appliedFilters(final FilterPredicate predicate,
                                        final Map<String, CardSummary> cards,
                                        final int baseDeckTotal) {
    final ImmutableAppliedFilters.Builder builder = ImmutableAppliedFilters.builder()
        .baseDeckTotal(baseDeckTotal);
    for (IncludeFilter include : predicate.include()) {
      builder.addInclude(detail(include.cardId(), cards)
          .operator(include.operator())
          .count(include.count())
          .label(include.label())
          .build());
    }
    for (ExcludeFilter exclude : predicate.exclude()) {
      builder.addExclude(detail(exclude.cardId(), cards).build());
    }
    return builder.build();
  }

  private ImmutableFilterDetail.Builder detail(final String cardId, final Map<String, CardSummary> cards) {
    final ImmutableFilterDetail.Builder builder = ImmutableFilterDetail.builder().id(cardId);
    final Optional<CardSummary> card = Optional.ofNullable(cards.get(cardId));
    card.ifPresent(summary -> builder.name(summary.name()).set(summary.set()).number(summary.number()));
    return builder;
  }
}
