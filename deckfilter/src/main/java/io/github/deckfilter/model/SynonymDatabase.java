package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Reprint synonyms. Read only; the owner decides when to reload it.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSynonymDatabase.class)
@JsonDeserialize(as = ImmutableSynonymDatabase.class)
public interface SynonymDatabase {

  /**
   * Empty database.
   *
   * @return the synonym database
   */
  static SynonymDatabase empty() {
    return ImmutableSynonymDatabase.builder().build();
  }

  /**
   * Variant uid to canonical uid.
   *
   * @return the synonyms
   */
  Map<String, String> synonyms();

  /**
   * Card name to preferred canonical uid.
   *
   * @return the canonicals
   */
  Map<String, String> canonicals();

  /**
   * Canonical identifier of a uid ({@code Name::SET::NUMBER}) or a bare card name.
   * A uid resolves only through an explicit synonym: same named cards with different text stay
   * apart.
   *
   * @param identifier the identifier
   * @return the canonical identifier, or the input when unmapped
   */
  default String canonicalOf(final String identifier) {
    if (identifier == null || identifier.isEmpty()) {
      return identifier;
    }
    if (identifier.contains("::")) {
      return synonyms().getOrDefault(identifier, identifier);
    }
    final String canonical = canonicals().get(identifier);
    if (canonical != null) {
      return canonical;
    }
    return synonyms().getOrDefault(identifier, identifier);
  }

  /**
   * All uids mapping onto a canonical uid, the canonical first.
   *
   * @param canonicalUid the canonical uid
   * @return the variants
   */
  default List<String> variantsOf(final String canonicalUid) {
    final List<String> variants = new ArrayList<>();
    variants.add(canonicalUid);
    synonyms().forEach((uid, canonical) -> {
      if (canonical.equals(canonicalUid) && !uid.equals(canonicalUid)) {
        variants.add(uid);
      }
    });
    return variants;
  }
}
