package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A filter resolved against the archetype's cards, for display.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableFilterDetail.class)
@JsonDeserialize(as = ImmutableFilterDetail.class)
public interface FilterDetail {

  String id();

  Optional<String> name();

  Optional<String> set();

  Optional<String> number();

  Optional<QuantityOperator> operator();

  Optional<Integer> count();

  Optional<String> label();
}
