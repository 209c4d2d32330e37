package io.github.deckfilter.model;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A client request for the report of one archetype under include/exclude filters.
 */
@Value.Immutable
public interface ResolveRequest {

  String tournament();

  /**
   * Archetype display name or its file base ({@code Gardevoir_ex}).
   *
   * @return the archetype
   */
  String archetype();

  /**
   * Required cards.
   *
   * @return the include ids
   */
  List<String> includeIds();

  /**
   * Rejected cards.
   *
   * @return the exclude ids
   */
  List<String> excludeIds();

  /**
   * Copy count operator applied to every included card.
   *
   * @return the quantity operator
   */
  Optional<QuantityOperator> quantityOperator();

  /**
   * Copy count compared by the operator.
   *
   * @return the quantity count
   */
  Optional<Integer> quantityCount();

  /**
   * Success tag restricting the pool (winner, top8...).
   *
   * @return the success tag
   */
  Optional<String> successTag();

  /**
   * Quantity and success filters are only served by the fallback path.
   *
   * @return true when outside the precomputed set by policy
   */
  default boolean requiresFallback() {
    return quantityOperator().isPresent()
        || successTag().filter(tag -> !tag.isBlank() && !"all".equalsIgnoreCase(tag)).isPresent();
  }

  /**
   * Validates the request.
   */
  @Value.Check
  default void check() {
    if (tournament().isBlank() || archetype().isBlank()) {
      throw new IllegalArgumentException("tournament and archetype are required");
    }
    if (quantityCount().isPresent() && quantityCount().get() < 0) {
      throw new IllegalArgumentException("quantityCount must not be negative");
    }
    if (quantityOperator().isPresent() && includeIds().isEmpty()) {
      throw new IllegalArgumentException("a quantity operator needs at least one included card");
    }
  }
}
