package io.github.deckfilter.generator;

import io.github.deckfilter.filter.FilterKeys;
import io.github.deckfilter.filter.PredicateNormalizer;
import io.github.deckfilter.model.CardSummary;
import io.github.deckfilter.model.CardUsage;
import io.github.deckfilter.model.CombinationPlan;
import io.github.deckfilter.model.CopyDistribution;
import io.github.deckfilter.model.ExcludeFilter;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.GeneratorPolicy;
import io.github.deckfilter.model.ImmutableCardSummary;
import io.github.deckfilter.model.ImmutableCombinationPlan;
import io.github.deckfilter.model.ImmutableFilterPredicate;
import io.github.deckfilter.model.ImmutableIncludeFilter;
import io.github.deckfilter.model.IncludeFilter;
import io.github.deckfilter.model.QuantityOperator;
import io.github.deckfilter.model.SubsetReport;
import io.github.deckfilter.normalize.CardKeyNormalizer;
import io.github.deckfilter.report.Percentages;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the bounded set of include/exclude/quantity predicates materialized for an archetype.
 * Cross terms are limited to the top cards by usage, so growth is quadratic in that limit and
 * not in the number of optional cards.
 */
@Singleton
public class FilterCombinationGenerator {

  private static final Logger log = LoggerFactory.getLogger(FilterCombinationGenerator.class);

  private final GeneratorPolicy policy;
  private final CardKeyNormalizer cardKeyNormalizer;
  private final PredicateNormalizer predicateNormalizer;

  /**
   * Instantiates a new Filter combination generator.
   *
   * @param policy              the policy
   * @param cardKeyNormalizer   the card key normalizer
   * @param predicateNormalizer the predicate normalizer
   */
  @Inject
  public FilterCombinationGenerator(final GeneratorPolicy policy,
                                    final CardKeyNormalizer cardKeyNormalizer,
                                    final PredicateNormalizer predicateNormalizer) {
    this.policy = policy;
    this.cardKeyNormalizer = cardKeyNormalizer;
    this.predicateNormalizer = predicateNormalizer;
  }

  /**
   * Plan the combinations for an archetype's full pool report.
   *
   * @param report the full pool report
   * @return the plan
   */
  public CombinationPlan plan(final SubsetReport report) {
    final Map<String, CardSummary> cards = extractCards(report);
    final List<Map.Entry<String, CardSummary>> optional = cards.entrySet().stream()
        .filter(entry -> isOptional(entry.getValue()))
        .collect(Collectors.toList());

    final List<Map.Entry<String, CardSummary>> qualifying = optional.stream()
        .filter(entry -> entry.getValue().pct() >= policy.minCardUsagePercent())
        .sorted(Comparator.comparingDouble((Map.Entry<String, CardSummary> entry) -> entry.getValue().pct())
            .reversed())
        .collect(Collectors.toList());
    log.debug("{} optional cards, {} at or above {}% usage", optional.size(), qualifying.size(),
        policy.minCardUsagePercent());

    final Map<String, FilterPredicate> combinations = new LinkedHashMap<>();
    for (Map.Entry<String, CardSummary> card : qualifying) {
      add(combinations, List.of(IncludeFilter.of(card.getKey())), List.of());
      for (IncludeFilter countFilter : countFilters(card.getKey(), card.getValue())) {
        add(combinations, List.of(countFilter), List.of());
      }
    }
    for (Map.Entry<String, CardSummary> card : qualifying) {
      add(combinations, List.of(), List.of(ExcludeFilter.of(card.getKey())));
    }

    final List<Map.Entry<String, CardSummary>> crossCards =
        qualifying.subList(0, Math.min(policy.crossFilterCardLimit(), qualifying.size()));
    for (Map.Entry<String, CardSummary> includeCard : crossCards) {
      final List<IncludeFilter> countFilters = countFilters(includeCard.getKey(), includeCard.getValue());
      for (Map.Entry<String, CardSummary> excludeCard : crossCards) {
        if (includeCard.getKey().equals(excludeCard.getKey())) {
          continue;
        }
        final List<ExcludeFilter> exclude = List.of(ExcludeFilter.of(excludeCard.getKey()));
        add(combinations, List.of(IncludeFilter.of(includeCard.getKey())), exclude);
        if (!countFilters.isEmpty()) {
          add(combinations, List.of(countFilters.get(0)), exclude);
        }
      }
    }

    return ImmutableCombinationPlan.builder()
        .combinations(combinations.values())
        .cards(cards)
        .optionalCards(optional.size())
        .alwaysIncludedCards(cards.size() - optional.size())
        .qualifyingCards(qualifying.size())
        .build();
  }

  /**
   * Count filters of a card: "exactly N" for each of its most frequent copy counts, plus one
   * "N+" on the second smallest of those counts.
   *
   * @param cardId the card id
   * @param card   the card
   * @return the count filters
   */
  public List<IncludeFilter> countFilters(final String cardId, final CardSummary card) {
    final List<Integer> topCounts = card.dist().stream()
        .filter(bucket -> bucket.copies() > 0)
        .sorted(Comparator.comparingInt(CopyDistribution::players).reversed()
            .thenComparingInt(CopyDistribution::copies))
        .limit(policy.maxCountVariations())
        .map(CopyDistribution::copies)
        .sorted()
        .collect(Collectors.toList());

    final List<IncludeFilter> filters = new ArrayList<>();
    for (Integer count : topCounts) {
      filters.add(ImmutableIncludeFilter.builder()
          .cardId(cardId)
          .operator(QuantityOperator.EQ)
          .count(count)
          .label("exactly " + count)
          .build());
    }
    if (topCounts.size() >= 2) {
      final int minForCore = topCounts.get(1);
      filters.add(ImmutableIncludeFilter.builder()
          .cardId(cardId)
          .operator(QuantityOperator.GTE)
          .count(minForCore)
          .label(minForCore + "+")
          .build());
    }
    return filters;
  }

  private Map<String, CardSummary> extractCards(final SubsetReport report) {
    final Map<String, CardSummary> cards = new LinkedHashMap<>();
    for (CardUsage item : report.items()) {
      final String cardId = cardKeyNormalizer.normalize(item.set().orElse(null), item.number().orElse(null));
      if (cardId == null || cards.containsKey(cardId)) {
        continue;
      }
      final int total = item.total() > 0 ? item.total() : report.deckTotal();
      cards.put(cardId, ImmutableCardSummary.builder()
          .name(item.name())
          .set(item.set())
          .number(cardKeyNormalizer.normalizeNumber(item.number().orElse(null)))
          .pct(Percentages.percent(item.found(), total))
          .found(item.found())
          .total(total)
          .alwaysIncluded(item.found() == total)
          .dist(item.dist())
          .build());
    }
    return cards;
  }

  // 100% present cards still qualify when their copy count varies.
  private boolean isOptional(final CardSummary card) {
    return !card.alwaysIncluded() || card.dist().size() > 1;
  }

  private void add(final Map<String, FilterPredicate> combinations,
                   final List<IncludeFilter> include,
                   final List<ExcludeFilter> exclude) {
    final FilterPredicate predicate = predicateNormalizer.normalize(
        ImmutableFilterPredicate.builder().include(include).exclude(exclude).build());
    combinations.putIfAbsent(FilterKeys.of(predicate), predicate);
  }
}
