package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import org.immutables.value.Value;

/**
 * Provenance of a subset blob.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSubsetSource.class)
@JsonDeserialize(as = ImmutableSubsetSource.class)
public interface SubsetSource {

  String archetype();

  Instant generatedAt();
}
