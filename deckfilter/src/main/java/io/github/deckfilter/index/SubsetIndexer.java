package io.github.deckfilter.index;

import io.github.deckfilter.filter.FilterKeys;
import io.github.deckfilter.model.ArchetypeArtifacts;
import io.github.deckfilter.model.CombinationPlan;
import io.github.deckfilter.model.FilterPredicate;
import io.github.deckfilter.model.ImmutableArchetypeArtifacts;
import io.github.deckfilter.model.ImmutableArchetypeIndex;
import io.github.deckfilter.model.ImmutableMaterializedSubset;
import io.github.deckfilter.model.ImmutableSubsetMetadata;
import io.github.deckfilter.model.MaterializedSubset;
import io.github.deckfilter.model.SubsetDocument;
import io.github.deckfilter.model.SubsetResult;
import io.github.deckfilter.model.SubsetStatus;
import io.github.deckfilter.report.Percentages;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges subsets with identical content and builds the archetype index. The first predicate
 * producing a given content hash owns the subset id; later ones become alternates. Every
 * predicate, primary or alternate, gets a filterMap entry.
 */
@Singleton
public class SubsetIndexer {

  private static final Logger log = LoggerFactory.getLogger(SubsetIndexer.class);

  private final ContentHasher hasher;
  private final Clock clock;

  /**
   * Instantiates a new Subset indexer.
   *
   * @param hasher the hasher
   * @param clock  the clock
   */
  @Inject
  public SubsetIndexer(final ContentHasher hasher, final Clock clock) {
    this.hasher = hasher;
    this.clock = clock;
  }

  /**
   * Subset id of the nth unique subset, starting at 1.
   *
   * @param ordinal the ordinal
   * @return the subset id
   */
  public static String subsetId(final int ordinal) {
    return String.format("subset_%03d", ordinal);
  }

  /**
   * Index the results of one archetype, in generation order. Results that were not accepted are
   * skipped.
   *
   * @param archetype     the archetype display name
   * @param archetypeBase the archetype path segment
   * @param deckTotal     the archetype pool size
   * @param plan          the combination plan
   * @param results       the subset results
   * @return the artifacts
   */
  public ArchetypeArtifacts index(final String archetype,
                                  final String archetypeBase,
                                  final int deckTotal,
                                  final CombinationPlan plan,
                                  final List<SubsetResult> results) {
    final Map<String, Entry> byHash = new LinkedHashMap<>();
    final Map<String, String> filterMap = new LinkedHashMap<>();

    for (SubsetResult result : results) {
      if (result.status() != SubsetStatus.ACCEPTED || result.document().isEmpty()) {
        continue;
      }
      final SubsetDocument document = result.document().get();
      final String contentHash = hasher.hash(document.items());
      Entry entry = byHash.get(contentHash);
      if (entry == null) {
        entry = new Entry(subsetId(byHash.size() + 1), contentHash, document, result.predicate());
        byHash.put(contentHash, entry);
      } else {
        entry.alternates.add(result.predicate());
      }
      filterMap.put(FilterKeys.of(result.predicate()), entry.id);
    }

    final int totalCombinations = plan.combinations().size();
    final List<MaterializedSubset> subsets = new ArrayList<>(byHash.size());
    final ImmutableArchetypeIndex.Builder index = ImmutableArchetypeIndex.builder()
        .archetype(archetype)
        .deckTotal(deckTotal)
        .totalCombinations(totalCombinations)
        .uniqueSubsets(byHash.size())
        .deduplicationRate(Percentages.percent(totalCombinations - byHash.size(), totalCombinations))
        .cards(plan.cards())
        .filterMap(filterMap)
        .generatedAt(clock.instant());

    for (Entry entry : byHash.values()) {
      final MaterializedSubset subset = ImmutableMaterializedSubset.builder()
          .id(entry.id)
          .contentHash(entry.contentHash)
          .document(entry.document)
          .primaryFilter(entry.primary)
          .alternateFilters(entry.alternates)
          .build();
      subsets.add(subset);
      index.putSubsets(entry.id, ImmutableSubsetMetadata.builder()
          .deckTotal(entry.document.deckTotal())
          .primaryFilters(entry.primary)
          .alternateFilters(entry.alternates)
          .build());
    }
    log.info("{}: {} unique subsets from {} combinations ({} filter keys)",
        archetype, byHash.size(), totalCombinations, filterMap.size());

    return ImmutableArchetypeArtifacts.builder()
        .archetype(archetype)
        .archetypeBase(archetypeBase)
        .index(index.build())
        .subsets(subsets)
        .build();
  }

  private static final class Entry {
    private final String id;
    private final String contentHash;
    private final SubsetDocument document;
    private final FilterPredicate primary;
    private final List<FilterPredicate> alternates = new ArrayList<>();

    private Entry(final String id,
                  final String contentHash,
                  final SubsetDocument document,
                  final FilterPredicate primary) {
      this.id = id;
      this.contentHash = contentHash;
      this.document = document;
      this.primary = primary;
    }
  }
}
