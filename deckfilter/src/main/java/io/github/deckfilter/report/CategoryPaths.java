package io.github.deckfilter.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds hierarchical category slugs such as {@code trainer/supporter} or
 * {@code trainer/tool/acespec}.
 */
public final class CategoryPaths {

  private CategoryPaths() {
    // Utility
  }

  /**
   * Compose the category slug.
   *
   * @param category    the category, may be null
   * @param trainerType the trainer type, may be null
   * @param energyType  the energy type, may be null
   * @param aceSpec     whether the card is an ace spec
   * @return the slug, empty without a category
   */
  public static String compose(final String category,
                               final String trainerType,
                               final String energyType,
                               final boolean aceSpec) {
    final String base = category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
    if (base.isEmpty()) {
      return "";
    }
    final List<String> parts = new ArrayList<>();
    parts.add(base);
    if ("trainer".equals(base)) {
      final String trainer = trainerType == null ? "" : trainerType.trim().toLowerCase(Locale.ROOT);
      if (!trainer.isEmpty()) {
        parts.add(trainer);
      }
      if (aceSpec) {
        if (!"tool".equals(trainer)) {
          parts.add("tool");
        }
        parts.add("acespec");
      }
    } else if ("energy".equals(base) && energyType != null && !energyType.isBlank()) {
      parts.add(energyType.trim().toLowerCase(Locale.ROOT));
    }
    return String.join("/", parts);
  }
}
