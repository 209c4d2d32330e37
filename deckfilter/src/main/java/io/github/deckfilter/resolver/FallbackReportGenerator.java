package io.github.deckfilter.resolver;

import io.github.deckfilter.filter.DeckCardIndex;
import io.github.deckfilter.filter.PredicateEvaluator;
import io.github.deckfilter.model.Deck;
import io.github.deckfilter.model.ExcludeFilter;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.ImmutableFilterPredicate;
import io.github.deckfilter.model.ImmutableIncludeFilter;
import io.github.deckfilter.model.SubsetReport;
import io.github.deckfilter.normalize.ArchetypeNames;
import io.github.deckfilter.normalize.CardIdentityResolver;
import io.github.deckfilter.report.ReportAggregator;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes a subset report directly from the raw deck corpus. It shares the count index, the
 * predicate evaluator and the aggregator with materialization, so for the same pool and predicate
 * the result equals what a materialized subset holds.
 */
@Singleton
public class FallbackReportGenerator {

  private static final Logger log = LoggerFactory.getLogger(FallbackReportGenerator.class);

  private final CardIdentityResolver identityResolver;
  private final PredicateEvaluator evaluator;
  private final ReportAggregator aggregator;
  private final SuccessTags successTags;

  /**
   * Instantiates a new Fallback report generator.
   *
   * @param identityResolver the identity resolver
   * @param evaluator        the evaluator
   * @param aggregator       the aggregator
   * @param successTags      the success tags
   */
  @Inject
  public FallbackReportGenerator(final CardIdentityResolver identityResolver,
                                 final PredicateEvaluator evaluator,
                                 final ReportAggregator aggregator,
                                 final SuccessTags successTags) {
    this.identityResolver = identityResolver;
    this.evaluator = evaluator;
    this.aggregator = aggregator;
    this.successTags = successTags;
  }

  /**
   * Generate the report. The success filter runs over the whole corpus so field sizes can be
   * estimated from every deck of a tournament; the archetype pool is selected afterwards.
   *
   * @param corpus     the raw deck corpus
   * @param archetype  the archetype name or file base
   * @param predicate  the normalized predicate; reprint card ids are mapped to their canonical
   *                   printing
   * @param successTag the success tag
   * @return the report, empty when nothing matches
   */
  public SubsetReport generate(final List<Deck> corpus,
                               final String archetype,
                               final FilterPredicate predicate,
                               final Optional<String> successTag) {
    final List<Deck> tagged = successTag.map(tag -> successTags.filter(corpus, tag)).orElse(corpus);
    final List<Deck> pool = tagged.stream()
        .filter(deck -> ArchetypeNames.sameArchetype(deck.archetype(), archetype))
        .collect(Collectors.toList());
    if (pool.isEmpty()) {
      log.info("No decks for archetype {} in corpus of {}", archetype, corpus.size());
      return SubsetReport.empty();
    }
    final DeckCardIndex index = DeckCardIndex.build(pool, identityResolver);
    final BitSet eligible = evaluator.evaluate(canonical(predicate), index);
    log.debug("Fallback for {}: {} of {} decks match", archetype, eligible.cardinality(), pool.size());
    return aggregator.aggregate(index.decksAt(eligible));
  }

  private FilterPredicate canonical(final FilterPredicate predicate) {
    final ImmutableFilterPredicate.Builder builder = ImmutableFilterPredicate.builder();
    predicate.include().forEach(filter -> builder.addInclude(ImmutableIncludeFilter.builder()
        .from(filter)
        .cardId(identityResolver.canonicalCardKey(filter.cardId()))
        .build()));
    predicate.exclude().forEach(filter ->
        builder.addExclude(ExcludeFilter.of(identityResolver.canonicalCardKey(filter.cardId()))));
    return builder.build();
  }
}
