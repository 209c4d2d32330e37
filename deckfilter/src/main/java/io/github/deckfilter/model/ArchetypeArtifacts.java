package io.github.deckfilter.model;

import java.util.List;
import org.immutables.value.Value;

/**
 * Everything one archetype publishes: its index and its unique subsets.
 */
@Value.Immutable
public interface ArchetypeArtifacts {

  /**
   * Display name.
   *
   * @return the archetype
   */
  String archetype();

  /**
   * Path segment under the tournament folder.
   *
   * @return the archetype base
   */
  String archetypeBase();

  ArchetypeIndex index();

  List<MaterializedSubset> subsets();
}
