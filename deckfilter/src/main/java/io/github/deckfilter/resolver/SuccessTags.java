package io.github.deckfilter.resolver;

import io.github.deckfilter.model.Deck;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Placement derived success buckets: winner, top2, top4, top8, top16 by placing, top10, top25 and
 * top50 by share of the field. Explicit tags on a deck take precedence over derived ones.
 */
@Singleton
public class SuccessTags {

  /**
   * Known tags, most exclusive first.
   */
  public static final List<String> HIERARCHY =
      List.of("winner", "top2", "top4", "top8", "top16", "top10", "top25", "top50");

  private static final Logger log = LoggerFactory.getLogger(SuccessTags.class);

  private static final List<PlacementRule> PLACEMENT_RULES = List.of(
      new PlacementRule("winner", 1, 2),
      new PlacementRule("top2", 2, 4),
      new PlacementRule("top4", 4, 8),
      new PlacementRule("top8", 8, 16),
      new PlacementRule("top16", 16, 32));

  private static final List<PercentRule> PERCENT_RULES = List.of(
      new PercentRule("top10", 0.1, 20),
      new PercentRule("top25", 0.25, 12),
      new PercentRule("top50", 0.5, 8));

  /**
   * Instantiates a new Success tags.
   */
  @Inject
  public SuccessTags() {
    // Stateless
  }

  /**
   * Keep the decks carrying the tag. A blank tag, {@code all} or an unknown tag keeps every deck.
   *
   * @param decks the decks, typically a whole tournament corpus so field sizes can be estimated
   * @param tag   the tag
   * @return the matching decks
   */
  public List<Deck> filter(final List<Deck> decks, final String tag) {
    if (tag == null || tag.isBlank() || "all".equalsIgnoreCase(tag.trim())) {
      return decks;
    }
    final String normalized = tag.trim().toLowerCase(Locale.ROOT);
    if (!HIERARCHY.contains(normalized)) {
      log.warn("Unknown success tag '{}', not filtering", tag);
      return decks;
    }
    final Map<String, Integer> fieldSizes = fieldSizes(decks);
    return decks.stream()
        .filter(deck -> derive(deck, fieldSizes).contains(normalized))
        .collect(Collectors.toList());
  }

  /**
   * Tags of a deck.
   *
   * @param deck       the deck
   * @param fieldSizes estimated field size per tournament
   * @return the tags
   */
  public List<String> derive(final Deck deck, final Map<String, Integer> fieldSizes) {
    final List<String> explicit = deck.successTags().stream()
        .filter(value -> value != null && !value.isBlank())
        .map(value -> value.toLowerCase(Locale.ROOT))
        .collect(Collectors.toList());
    if (!explicit.isEmpty()) {
      return explicit;
    }

    final int placing = deck.placement().orElse(0);
    int players = deck.tournamentPlayers().orElse(0);
    if (players <= 1) {
      players = tournamentOf(deck).map(fieldSizes::get).orElse(0);
    }
    if (placing <= 0 || players <= 1) {
      return List.of();
    }

    final List<String> tags = new ArrayList<>();
    for (PlacementRule rule : PLACEMENT_RULES) {
      if (players >= rule.minPlayers && placing <= rule.maxPlacing) {
        tags.add(rule.tag);
      }
    }
    for (PercentRule rule : PERCENT_RULES) {
      if (players >= rule.minPlayers && placing <= Math.max(1, (int) Math.ceil(players * rule.fraction))) {
        tags.add(rule.tag);
      }
    }
    return tags;
  }

  /**
   * Field size per tournament: the largest player count or placing seen, falling back to the
   * number of decks when neither is known.
   *
   * @param decks the decks
   * @return the field sizes
   */
  public Map<String, Integer> fieldSizes(final List<Deck> decks) {
    final Map<String, Integer> sizes = new HashMap<>();
    final Map<String, Integer> counts = new HashMap<>();
    for (Deck deck : decks) {
      final Optional<String> tournament = tournamentOf(deck);
      if (tournament.isEmpty()) {
        continue;
      }
      final int players = Math.max(deck.tournamentPlayers().orElse(0), deck.placement().orElse(0));
      if (players > 1 || deck.placement().orElse(0) > 0) {
        sizes.merge(tournament.get(), players, Math::max);
      }
      counts.merge(tournament.get(), 1, Integer::sum);
    }
    counts.forEach((tournament, count) -> {
      if (sizes.getOrDefault(tournament, 0) <= 1) {
        sizes.put(tournament, count);
      }
    });
    return sizes;
  }

  private Optional<String> tournamentOf(final Deck deck) {
    return deck.tournamentId().or(deck::tournamentName);
  }

  private static final class PlacementRule {
    private final String tag;
    private final int maxPlacing;
    private final int minPlayers;

    private PlacementRule(final String tag, final int maxPlacing, final int minPlayers) {
      this.tag = tag;
      this.maxPlacing = maxPlacing;
      this.minPlayers = minPlayers;
    }
  }

  private static final class PercentRule {
    private final String tag;
    private final double fraction;
    private final int minPlayers;

    private PercentRule(final String tag, final double fraction, final int minPlayers) {
      this.tag = tag;
      this.fraction = fraction;
      this.minPlayers = minPlayers;
    }
  }
}
