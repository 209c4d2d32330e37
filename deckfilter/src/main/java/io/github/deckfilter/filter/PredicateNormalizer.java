package io.github.deckfilter.filter;

import io.github.deckfilter.model.ExcludeFilter;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.ImmutableFilterPredicate;
import io.github.deckfilter.model.ImmutableIncludeFilter;
import io.github.deckfilter.model.IncludeFilter;
import io.github.deckfilter.model.QuantityOperator;
import io.github.deckfilter.normalize.CardIdentityResolver;
import io.github.deckfilter.normalize.CardKeyNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Validates predicates where they enter the system and rewrites them into one canonical shape.
 * Everything downstream of this class assumes:
 * <ul>
 *   <li>card ids are normalized CardKeys where they look like one, reprints mapped to the
 *   canonical printing</li>
 *   <li>an include is either a presence test or a comparison with a count</li>
 *   <li>"zero copies" includes are excludes</li>
 *   <li>no duplicate tokens, includes and excludes sorted</li>
 * </ul>
 */
@Singleton
public class PredicateNormalizer {

  private final CardKeyNormalizer cardKeyNormalizer;
  private final CardIdentityResolver identityResolver;

  /**
   * Instantiates a new Predicate normalizer.
   *
   * @param cardKeyNormalizer the card key normalizer
   * @param identityResolver  the identity resolver
   */
  @Inject
  public PredicateNormalizer(final CardKeyNormalizer cardKeyNormalizer,
                             final CardIdentityResolver identityResolver) {
    this.cardKeyNormalizer = cardKeyNormalizer;
    this.identityResolver = identityResolver;
  }

  /**
   * Normalize a predicate.
   *
   * @param predicate the predicate
   * @return the normalized predicate
   * @throws IllegalArgumentException on a blank card id or a negative count
   */
  public FilterPredicate normalize(final FilterPredicate predicate) {
    final Map<String, IncludeFilter> include = new TreeMap<>();
    final TreeSet<String> exclude = new TreeSet<>();

    for (IncludeFilter raw : predicate.include()) {
      final String cardId = cardId(raw.cardId());
      final Optional<Integer> count = raw.count();
      if (count.isPresent() && count.get() < 0) {
        throw new IllegalArgumentException("Negative count for " + cardId + ": " + count.get());
      }
      final QuantityOperator operator = raw.operator()
          .orElse(count.isPresent() ? QuantityOperator.EQ : QuantityOperator.ANY);

      if (operator == QuantityOperator.NONE || isZeroCopies(operator, count)) {
        exclude.add(cardId);
        continue;
      }
      final IncludeFilter normalized;
      if (operator == QuantityOperator.ANY || count.isEmpty() || isPresence(operator, count.get())) {
        normalized = ImmutableIncludeFilter.builder().cardId(cardId).label(raw.label()).build();
      } else {
        normalized = ImmutableIncludeFilter.builder()
            .cardId(cardId)
            .operator(operator)
            .count(count.get())
            .label(raw.label())
            .build();
      }
      include.putIfAbsent(FilterKeys.token(normalized), normalized);
    }
    for (ExcludeFilter raw : predicate.exclude()) {
      exclude.add(cardId(raw.cardId()));
    }

    final List<ExcludeFilter> excludes = new ArrayList<>(exclude.size());
    exclude.forEach(cardId -> excludes.add(ExcludeFilter.of(cardId)));
    return ImmutableFilterPredicate.builder()
        .include(include.values())
        .exclude(excludes)
        .build();
  }

  /**
   * Normalizes and encodes a predicate.
   *
   * @param predicate the predicate
   * @return the filter key
   */
  public String filterKey(final FilterPredicate predicate) {
    return FilterKeys.of(normalize(predicate));
  }

  private String cardId(final String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Card id must not be blank");
    }
    return identityResolver.canonicalCardKey(cardKeyNormalizer.normalizeCardId(raw));
  }

  private boolean isZeroCopies(final QuantityOperator operator, final Optional<Integer> count) {
    if (count.isEmpty()) {
      return false;
    }
    final int value = count.get();
    return (operator == QuantityOperator.EQ && value == 0)
        || (operator == QuantityOperator.LT && value == 1)
        || (operator == QuantityOperator.LTE && value == 0);
  }

  private boolean isPresence(final QuantityOperator operator, final int count) {
    return (operator == QuantityOperator.GT && count == 0)
        || (operator == QuantityOperator.GTE && count == 1);
  }
}
