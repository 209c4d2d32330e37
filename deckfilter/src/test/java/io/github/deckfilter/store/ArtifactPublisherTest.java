package io.github.deckfilter.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import io.github.deckfilter.DeckFixtures;
import io.github.deckfilter.bsu.BlobStoreException;
import io.github.deckfilter.bsu.impl.InMemoryBlobStore;
import io.github.deckfilter.model.ArchetypeArtifacts;
import io.github.deckfilter.model.ImmutableArchetypeArtifacts;
import io.github.deckfilter.model.PublishSummary;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ArtifactPublisherTest {

  @Mock private IncludeExcludeStore store;

  private ExecutorService executor;
  private ArtifactPublisher publisher;
  private ArchetypeArtifacts gardevoir;
  private ArchetypeArtifacts charizard;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2, runnable -> new Thread(runnable, "publish-test"));
    publisher = new ArtifactPublisher(store, executor, DeckFixtures.configuration());
    gardevoir = DeckFixtures.pipeline(new InMemoryBlobStore())
        .materialize("Gardevoir ex", DeckFixtures.gardevoirPool())
        .orElseThrow();
    charizard = ImmutableArchetypeArtifacts.builder()
        .from(gardevoir)
        .archetype("Charizard Pidgeot")
        .archetypeBase("Charizard_Pidgeot")
        .build();
  }

  @Test
  void publish_writesEveryArchetype() {
    // when
    final PublishSummary summary = publisher.publish(DeckFixtures.TOURNAMENT, List.of(gardevoir, charizard));

    // then
    assertThat(summary.isSuccess()).isTrue();
    assertThat(summary.published()).containsExactly("Gardevoir ex", "Charizard Pidgeot");
    verify(store).writeArtifacts(DeckFixtures.TOURNAMENT, gardevoir);
    verify(store).writeArtifacts(DeckFixtures.TOURNAMENT, charizard);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void publish_writesOnProvidedExecutorAndLeavesItRunning() {
    // given
    final List<String> threads = new CopyOnWriteArrayList<>();
    doAnswer(invocation -> {
      threads.add(Thread.currentThread().getName());
      return null;
    }).when(store).writeArtifacts(eq(DeckFixtures.TOURNAMENT), any());

    // when
    publisher.publish(DeckFixtures.TOURNAMENT, List.of(gardevoir, charizard));
    final PublishSummary second = publisher.publish(DeckFixtures.TOURNAMENT, List.of(gardevoir));

    // then
    assertThat(threads).hasSize(3).allMatch("publish-test"::equals);
    assertThat(second.published()).containsExactly("Gardevoir ex");
    assertThat(executor.isShutdown()).isFalse();
  }

  @Test
  void publish_failureIsIsolated() {
    // given
    lenient().doThrow(new BlobStoreException("bucket unavailable"))
        .when(store).writeArtifacts(eq(DeckFixtures.TOURNAMENT), eq(gardevoir));

    // when
    final PublishSummary summary = publisher.publish(DeckFixtures.TOURNAMENT, List.of(gardevoir, charizard));

    // then
    assertThat(summary.isSuccess()).isFalse();
    assertThat(summary.published()).containsExactly("Charizard Pidgeot");
    assertThat(summary.failures()).containsEntry("Gardevoir ex", "bucket unavailable");
  }

  @Test
  void publish_nothingToWrite() {
    final PublishSummary summary = publisher.publish(DeckFixtures.TOURNAMENT, List.of());

    assertThat(summary.isSuccess()).isTrue();
    assertThat(summary.published()).isEmpty();
    verifyNoInteractions(store);
  }
}
