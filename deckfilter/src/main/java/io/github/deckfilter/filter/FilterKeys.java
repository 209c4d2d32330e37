package io.github.deckfilter.filter;

import io.github.deckfilter.model.ExcludeFilter;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.IncludeFilter;
import java.util.TreeSet;

/**
 * Encodes predicates as FilterKeys: {@code inc:{tokens}|exc:{cardIds}}, tokens lexically sorted and
 * joined with {@code +}. A count qualified include is written as {@code SVI~005:>=2}.
 */
public final class FilterKeys {

  private FilterKeys() {
    // Utility
  }

  /**
   * The FilterKey of a normalized predicate. Token order and duplicates in the input do not
   * change the result.
   *
   * @param predicate the predicate
   * @return the filter key
   */
  public static String of(final FilterPredicate predicate) {
    final TreeSet<String> include = new TreeSet<>();
    for (IncludeFilter filter : predicate.include()) {
      include.add(token(filter));
    }
    final TreeSet<String> exclude = new TreeSet<>();
    for (ExcludeFilter filter : predicate.exclude()) {
      exclude.add(filter.cardId());
    }
    return "inc:" + String.join("+", include) + "|exc:" + String.join("+", exclude);
  }

  /**
   * The key token of one include filter.
   *
   * @param filter the filter
   * @return the token
   */
  public static String token(final IncludeFilter filter) {
    if (!filter.countQualified()) {
      return filter.cardId();
    }
    return filter.cardId() + ":" + filter.operator().orElseThrow().symbol() + filter.count().orElseThrow();
  }
}
