package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Require a card, optionally at a copy count.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableIncludeFilter.class)
@JsonDeserialize(as = ImmutableIncludeFilter.class)
public interface IncludeFilter {

  /**
   * Presence filter.
   *
   * @param cardId the card id
   * @return the include filter
   */
  static IncludeFilter of(final String cardId) {
    return ImmutableIncludeFilter.builder().cardId(cardId).build();
  }

  /**
   * Count qualified filter.
   *
   * @param cardId   the card id
   * @param operator the operator
   * @param count    the count
   * @return the include filter
   */
  static IncludeFilter of(final String cardId, final QuantityOperator operator, final int count) {
    return ImmutableIncludeFilter.builder().cardId(cardId).operator(operator).count(count).build();
  }

  /**
   * CardKey of the card.
   *
   * @return the card id
   */
  String cardId();

  /**
   * Operator.
   *
   * @return the operator
   */
  Optional<QuantityOperator> operator();

  /**
   * Literal count compared by the operator.
   *
   * @return the count
   */
  Optional<Integer> count();

  /**
   * Display label such as {@code exactly 2}; not part of the filter's identity.
   *
   * @return the label
   */
  @Value.Auxiliary
  Optional<String> label();

  /**
   * True when the filter compares against a literal count.
   *
   * @return true if count qualified
   */
  default boolean countQualified() {
    return operator().map(QuantityOperator::isComparison).orElse(false) && count().isPresent();
  }
}
