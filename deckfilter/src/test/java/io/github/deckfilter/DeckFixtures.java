/*
 * Copyright (c) 2023. Ned Wolpert
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.deckfilter;

import io.github.deckfilter.bsu.BlobStore;
import io.github.deckfilter.bsu.model.BlobStoreType;
import io.github.deckfilter.bsu.model.ImmutableBlobStoreConfig;
import io.github.deckfilter.dagger.CommonModule;
import io.github.deckfilter.filter.PredicateEvaluator;
import io.github.deckfilter.filter.PredicateNormalizer;
import io.github.deckfilter.generator.FilterCombinationGenerator;
import io.github.deckfilter.generator.SubsetBuilder;
import io.github.deckfilter.index.ContentHasher;
import io.github.deckfilter.index.SubsetIndexer;
import io.github.deckfilter.model.CardTypeDatabase;
import io.github.deckfilter.model.Configuration;
import io.github.deckfilter.model.Deck;
import io.github.deckfilter.model.DeckCard;
import io.github.deckfilter.model.GeneratorPolicy;
import io.github.deckfilter.model.ImmutableConfiguration;
import io.github.deckfilter.model.ImmutableDeck;
import io.github.deckfilter.model.ImmutableDeckCard;
import io.github.deckfilter.model.ImmutableGeneratorPolicy;
import io.github.deckfilter.model.SynonymDatabase;
import io.github.deckfilter.normalize.CardIdentityResolver;
import io.github.deckfilter.normalize.CardKeyNormalizer;
import io.github.deckfilter.pipeline.MaterializationPipeline;
import io.github.deckfilter.report.ReportAggregator;
import io.github.deckfilter.resolver.FallbackReportGenerator;
import io.github.deckfilter.resolver.SuccessTags;
import io.github.deckfilter.store.ArtifactPublisher;
import io.github.deckfilter.store.BlobKeys;
import io.github.deckfilter.store.IncludeExcludeStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Decks and hand wired components for unit tests.
 */
public final class DeckFixtures {

  public static final String TOURNAMENT = "Online - Last 14 Days";
  public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
  public static final CardKeyNormalizer NORMALIZER = new CardKeyNormalizer();
  public static final GeneratorPolicy POLICY = ImmutableGeneratorPolicy.builder().build();
  public static final ExecutorService PUBLISH_EXECUTOR = Executors.newFixedThreadPool(2, runnable -> {
    final Thread thread = new Thread(runnable, "fixture-publish");
    thread.setDaemon(true);
    return thread;
  });

  private DeckFixtures() {
  }

  public static DeckCard card(final String name, final String set, final String number, final int count) {
    return ImmutableDeckCard.builder().name(name).set(set).number(number).count(count).build();
  }

  public static Deck deck(final String id, final String archetype, final DeckCard... cards) {
    return ImmutableDeck.builder()
        .id(id)
        .archetype(archetype)
        .tournamentId("t1")
        .addCards(cards)
        .build();
  }

  public static CardIdentityResolver identity() {
    return identity(SynonymDatabase.empty());
  }

  public static CardIdentityResolver identity(final SynonymDatabase synonyms) {
    return new CardIdentityResolver(synonyms, NORMALIZER);
  }

  public static ReportAggregator aggregator() {
    return aggregator(SynonymDatabase.empty());
  }

  public static ReportAggregator aggregator(final SynonymDatabase synonyms) {
    return new ReportAggregator(identity(synonyms), CardTypeDatabase.empty(), NORMALIZER);
  }

  public static PredicateNormalizer predicateNormalizer() {
    return predicateNormalizer(SynonymDatabase.empty());
  }

  public static PredicateNormalizer predicateNormalizer(final SynonymDatabase synonyms) {
    return new PredicateNormalizer(NORMALIZER, identity(synonyms));
  }

  public static FilterCombinationGenerator generator(final GeneratorPolicy policy) {
    return new FilterCombinationGenerator(policy, NORMALIZER, predicateNormalizer());
  }

  public static SubsetBuilder subsetBuilder(final GeneratorPolicy policy) {
    return new SubsetBuilder(new PredicateEvaluator(), aggregator(), policy, CLOCK);
  }

  public static SubsetIndexer indexer() {
    return new SubsetIndexer(new ContentHasher(), CLOCK);
  }

  public static Configuration configuration() {
    return ImmutableConfiguration.builder()
        .blobStore(ImmutableBlobStoreConfig.builder().type(BlobStoreType.MEMORY).build())
        .build();
  }

  public static IncludeExcludeStore store(final BlobStore blobStore) {
    return new IncludeExcludeStore(blobStore, new CommonModule().objectMapper(), new BlobKeys(NORMALIZER));
  }

  public static MaterializationPipeline pipeline(final BlobStore blobStore) {
    final IncludeExcludeStore store = store(blobStore);
    return new MaterializationPipeline(aggregator(), generator(POLICY), subsetBuilder(POLICY), indexer(), identity(),
        new ArtifactPublisher(store, PUBLISH_EXECUTOR, configuration()), store, new BlobKeys(NORMALIZER), POLICY);
  }

  public static FallbackReportGenerator fallback() {
    return fallback(SynonymDatabase.empty());
  }

  public static FallbackReportGenerator fallback(final SynonymDatabase synonyms) {
    return new FallbackReportGenerator(identity(synonyms), new PredicateEvaluator(), aggregator(synonyms),
        new SuccessTags());
  }

  /**
   * Ten Gardevoir decks. Everyone plays 4 Ralts; Kirlia varies between 2 and 3; Iono is in six decks
   * (four with 1 copy, two with 2); Counter Catcher is in decks 0-2; Super Rod in decks 5-9.
   *
   * @return the decks
   */
  public static List<Deck> gardevoirPool() {
    final List<Deck> decks = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      final ImmutableDeck.Builder deck = ImmutableDeck.builder()
          .id("g" + i)
          .archetype("Gardevoir ex")
          .tournamentId("t1")
          .addCards(card("Ralts", "SVI", "84", 4))
          .addCards(card("Kirlia", "SVI", "85", i % 2 == 0 ? 2 : 3));
      if (i < 4) {
        deck.addCards(card("Iono", "PAL", "185", 1));
      } else if (i < 6) {
        deck.addCards(card("Iono", "PAL", "185", 2));
      }
      if (i < 3) {
        deck.addCards(card("Counter Catcher", "PAR", "160", 1));
      }
      if (i >= 5) {
        deck.addCards(card("Super Rod", "PAL", "188", 1));
      }
      decks.add(deck.build());
    }
    return decks;
  }
}
