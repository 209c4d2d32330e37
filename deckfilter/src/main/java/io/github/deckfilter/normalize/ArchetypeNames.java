package io.github.deckfilter.normalize;

import java.util.Locale;

/**
 * Archetype label comparison helpers.
 */
public final class ArchetypeNames {

  /**
   * Name used for decks without an archetype label.
   */
  public static final String UNKNOWN = "unknown";

  private ArchetypeNames() {
    // Utility
  }

  /**
   * Normalizes an archetype label for grouping and comparison: underscores become spaces,
   * whitespace collapses and the result is lowercased.
   *
   * @param name the name
   * @return the normalized name, {@code unknown} when blank
   */
  public static String normalize(final String name) {
    final String cleaned = name == null ? "" : name.replace('_', ' ').trim();
    if (cleaned.isEmpty()) {
      return UNKNOWN;
    }
    return cleaned.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }

  /**
   * Whether two labels name the same archetype.
   *
   * @param first  the first
   * @param second the second
   * @return true if equivalent
   */
  public static boolean sameArchetype(final String first, final String second) {
    return normalize(first).equals(normalize(second));
  }
}
