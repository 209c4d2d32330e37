package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Type data of one printing.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCardTypeInfo.class)
@JsonDeserialize(as = ImmutableCardTypeInfo.class)
public interface CardTypeInfo {

  Optional<String> category();

  Optional<String> trainerType();

  Optional<String> energyType();

  @Value.Default
  default boolean aceSpec() {
    return false;
  }
}
