package io.github.deckfilter.model;

import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Outcome of one batch publication.
 */
@Value.Immutable
public interface PublishSummary {

  /**
   * Archetypes fully written.
   *
   * @return the published
   */
  List<String> published();

  /**
   * Archetype to failure message.
   *
   * @return the failures
   */
  Map<String, String> failures();

  /**
   * True when nothing failed.
   *
   * @return the success flag
   */
  default boolean isSuccess() {
    return failures().isEmpty();
  }
}
