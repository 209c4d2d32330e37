package io.github.deckfilter.report;

import io.github.deckfilter.model.CardTypeDatabase;
import io.github.deckfilter.model.CardTypeInfo;
import io.github.deckfilter.model.CardUsage;
import io.github.deckfilter.model.CopyDistribution;
import io.github.deckfilter.model.Deck;
import io.github.deckfilter.model.DeckCard;
import io.github.deckfilter.model.ImmutableCardTypeInfo;
import io.github.deckfilter.model.ImmutableCardUsage;
import io.github.deckfilter.model.ImmutableCopyDistribution;
import io.github.deckfilter.model.ImmutableSubsetReport;
import io.github.deckfilter.model.SubsetReport;
import io.github.deckfilter.normalize.CardIdentityResolver;
import io.github.deckfilter.normalize.CardKeyNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Computes per card usage statistics over a deck pool. The materialized and the fallback paths
 * both produce their reports here, which keeps their output identical.
 */
@Singleton
public class ReportAggregator {

  private static final Comparator<Tally> ITEM_ORDER = Comparator
      .comparingInt((Tally tally) -> tally.counts.size()).reversed()
      .thenComparing(tally -> tally.name)
      .thenComparing(tally -> tally.uid);

  private final CardIdentityResolver identityResolver;
  private final CardTypeDatabase cardTypeDatabase;
  private final CardKeyNormalizer normalizer;

  /**
   * Instantiates a new Report aggregator.
   *
   * @param identityResolver the identity resolver
   * @param cardTypeDatabase the card type database
   * @param normalizer       the normalizer
   */
  @Inject
  public ReportAggregator(final CardIdentityResolver identityResolver,
                          final CardTypeDatabase cardTypeDatabase,
                          final CardKeyNormalizer normalizer) {
    this.identityResolver = identityResolver;
    this.cardTypeDatabase = cardTypeDatabase;
    this.normalizer = normalizer;
  }

  /**
   * Aggregate the decks. Same card copies within one deck are summed before they enter the copy
   * histogram, so every item satisfies {@code sum(dist.players) == found}.
   *
   * @param decks the decks
   * @return the report, empty for an empty pool
   */
  public SubsetReport aggregate(final List<Deck> decks) {
    if (decks == null || decks.isEmpty()) {
      return SubsetReport.empty();
    }
    final int deckTotal = decks.size();
    final Map<String, Tally> tallies = new HashMap<>();

    for (Deck deck : decks) {
      final Map<String, Integer> perDeck = new LinkedHashMap<>();
      for (DeckCard card : deck.cards()) {
        if (card.count() <= 0) {
          continue;
        }
        final String uid = identityResolver.uid(card);
        perDeck.merge(uid, card.count(), Integer::sum);
        tallies.computeIfAbsent(uid, this::newTally).observe(card);
      }
      perDeck.forEach((uid, copies) -> tallies.get(uid).counts.add(copies));
    }

    final List<Tally> sorted = new ArrayList<>(tallies.values());
    sorted.sort(ITEM_ORDER);

    final List<CardUsage> items = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      items.add(toUsage(sorted.get(i), i + 1, deckTotal));
    }
    return ImmutableSubsetReport.builder().deckTotal(deckTotal).items(items).build();
  }

  /**
   * Copy count histogram, ordered by copies ascending.
   *
   * @param counts per deck copy counts
   * @param found  decks containing the card
   * @return the distribution
   */
  public List<CopyDistribution> distribution(final List<Integer> counts, final int found) {
    final TreeMap<Integer, Integer> histogram = new TreeMap<>();
    counts.forEach(copies -> histogram.merge(copies, 1, Integer::sum));
    final List<CopyDistribution> dist = new ArrayList<>(histogram.size());
    histogram.forEach((copies, players) -> dist.add(ImmutableCopyDistribution.builder()
        .copies(copies)
        .players(players)
        .percent(Percentages.percent(players, found))
        .build()));
    return dist;
  }

  private Tally newTally(final String uid) {
    return new Tally(uid, normalizer.sanitizeForPath(identityResolver.nameOfUid(uid)));
  }

  private CardUsage toUsage(final Tally tally, final int rank, final int deckTotal) {
    final int found = tally.counts.size();
    final ImmutableCardUsage.Builder builder = ImmutableCardUsage.builder()
        .rank(rank)
        .name(tally.name)
        .found(found)
        .total(deckTotal)
        .pct(Percentages.percent(found, deckTotal))
        .dist(distribution(tally.counts, found));

    final Optional<String> cardKey = identityResolver.cardKeyOfUid(tally.uid);
    if (cardKey.isPresent()) {
      builder.uid(tally.uid);
      normalizer.split(cardKey.get()).ifPresent(parts -> builder.set(parts[0]).number(parts[1]));
    }

    final Optional<CardTypeInfo> typeInfo = tally.typeInfo != null
        ? Optional.of(tally.typeInfo)
        : cardKey.flatMap(cardTypeDatabase::lookup);
    typeInfo.ifPresent(info -> {
      info.trainerType().ifPresent(builder::trainerType);
      info.energyType().ifPresent(builder::energyType);
      builder.aceSpec(info.aceSpec());
      final String slug = CategoryPaths.compose(info.category().orElse(null),
          info.trainerType().orElse(null), info.energyType().orElse(null), info.aceSpec());
      if (!slug.isEmpty()) {
        builder.category(slug);
      }
    });
    return builder.build();
  }

  /**
   * Mutable accumulator for one uid, local to a single aggregation.
   */
  private static final class Tally {
    private final String uid;
    private final String name;
    private final List<Integer> counts = new ArrayList<>();
    private CardTypeInfo typeInfo;

    private Tally(final String uid, final String name) {
      this.uid = uid;
      this.name = name;
    }

    private void observe(final DeckCard card) {
      if (typeInfo != null) {
        return;
      }
      if (card.category().isPresent() || card.trainerType().isPresent()
          || card.energyType().isPresent() || card.aceSpec()) {
        typeInfo = ImmutableCardTypeInfo.builder()
            .category(card.category())
            .trainerType(card.trainerType())
            .energyType(card.energyType())
            .aceSpec(card.aceSpec())
            .build();
      }
    }
  }
}
