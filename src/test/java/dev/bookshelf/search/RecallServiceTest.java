package dev.bookshelf.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dev.bookshelf.embedding.CachingEmbeddingProvider;
import dev.bookshelf.embedding.EmbeddingCache;
import dev.bookshelf.embedding.EmbeddingProvider;
import dev.bookshelf.fixture.BookmarkBuilder;
import dev.bookshelf.index.BookmarkIndex;
import dev.bookshelf.record.Bookmark;
import dev.bookshelf.storage.RecordStore;
import dev.bookshelf.storage.StorageLocation;
import dev.bookshelf.storage.StorageLocations;
import dev.bookshelf.storage.StorageProperties;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecallServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @TempDir Path root;

  StorageLocations locations;
  BookmarkIndex index;
  RecallProperties properties;

  @BeforeEach
  void setUp() {
    locations =
        StorageLocations.of(
            new StorageLocation("work", root.resolve("work"), true),
            new StorageLocation("home", root.resolve("home"), false));
    RecordStore store =
        new RecordStore(
            locations, new StorageProperties(null, null), Clock.fixed(NOW, ZoneOffset.UTC));
    index = new BookmarkIndex(store);
    properties = new RecallProperties();
    properties.validate();
  }

  private RecallService service(EmbeddingProvider provider) {
    return new RecallService(
        index, locations, new SemanticScorer(provider, new EmbeddingCache(1000)), properties);
  }

  private void addPythonCorpus() {
    index.upsert(new BookmarkBuilder().id("p1").title("Python tricks").build());
    index.upsert(new BookmarkBuilder().id("p2").title("Django tutorial").build());
    index.upsert(new BookmarkBuilder().id("j").title("Java streams").build());
    index.upsert(new BookmarkBuilder().id("n").title("Cooking recipes").build());
  }

  @Test
  void lexical_fallback_ranks_by_score_then_newest_then_id() {
    index.upsert(
        new BookmarkBuilder()
            .id("a")
            .title("Java streams")
            .createdAt("2026-01-10T00:00:00Z")
            .build());
    index.upsert(
        new BookmarkBuilder()
            .id("c")
            .title("Java generics")
            .createdAt("2026-02-01T00:00:00Z")
            .build());
    index.upsert(
        new BookmarkBuilder()
            .id("d")
            .title("Java records")
            .createdAt("2026-01-10T00:00:00Z")
            .build());
    index.upsert(
        new BookmarkBuilder()
            .id("b")
            .title("Intro")
            .keywords("java")
            .createdAt("2026-03-01T00:00:00Z")
            .build());

    RecallResult result =
        service(new KeywordVectorProvider().failing()).recall(new RecallRequest("java"));

    assertThat(result.mode()).isEqualTo(RecallMode.LEXICAL);
    assertThat(result.fallbackReason()).isEqualTo(FallbackReason.EMBEDDING_UNAVAILABLE);
    assertThat(result.semanticAvailable()).isFalse();
    assertThat(result.results())
        .extracting(hit -> hit.bookmark().id())
        .containsExactly("c", "a", "d", "b");
    assertThat(result.results().get(0).score()).isCloseTo(1.0 / 3.2, within(1e-9));
    assertThat(result.results().get(3).score()).isCloseTo(0.8 / 3.2, within(1e-9));
    assertThat(result.results().get(0).breakdown().semantic()).isNull();
  }

  @Test
  void hybrid_mode_merges_semantic_and_lexical_scores() {
    addPythonCorpus();

    RecallResult result = service(new KeywordVectorProvider()).recall(new RecallRequest("python"));

    assertThat(result.mode()).isEqualTo(RecallMode.HYBRID);
    assertThat(result.fallbackReason()).isNull();
    assertThat(result.semanticAvailable()).isTrue();
    assertThat(result.candidateCount()).isEqualTo(4);
    assertThat(result.results()).extracting(hit -> hit.bookmark().id()).containsExactly("p1", "p2");

    RecallHit lexicalAndSemantic = result.results().get(0);
    assertThat(lexicalAndSemantic.score()).isCloseTo(0.55 + 0.45 * (1.0 / 3.2), within(1e-9));
    assertThat(lexicalAndSemantic.matchedFields()).containsExactly(MatchedField.TITLE);

    RecallHit semanticOnly = result.results().get(1);
    assertThat(semanticOnly.score()).isCloseTo(0.55, within(1e-9));
    assertThat(semanticOnly.breakdown().lexical()).isZero();
    assertThat(semanticOnly.breakdown().semantic()).isCloseTo(1.0, within(1e-9));
    assertThat(semanticOnly.matchedFields()).isEmpty();
  }

  @Test
  void disabled_semantic_search_runs_lexically_without_embedding() {
    addPythonCorpus();
    properties.setSemanticEnabled(false);
    KeywordVectorProvider provider = new KeywordVectorProvider();

    RecallResult result = service(provider).recall(new RecallRequest("python"));

    assertThat(result.mode()).isEqualTo(RecallMode.LEXICAL);
    assertThat(result.fallbackReason()).isEqualTo(FallbackReason.SEMANTIC_SEARCH_DISABLED);
    assertThat(result.results()).extracting(hit -> hit.bookmark().id()).containsExactly("p1");
    assertThat(provider.embedCalls()).isZero();
  }

  @Test
  void unconfigured_backend_counts_as_disabled() {
    addPythonCorpus();

    RecallResult result =
        service(mock(EmbeddingProvider.class)).recall(new RecallRequest("python"));

    assertThat(result.mode()).isEqualTo(RecallMode.LEXICAL);
    assertThat(result.fallbackReason()).isEqualTo(FallbackReason.SEMANTIC_SEARCH_DISABLED);
  }

  @Test
  void record_whose_embedding_fails_is_still_ranked_lexically() {
    addPythonCorpus();
    index.upsert(new BookmarkBuilder().id("p3").title("Python django guide").build());

    RecallResult result =
        service(new KeywordVectorProvider().refusing("django")).recall(new RecallRequest("python"));

    assertThat(result.mode()).isEqualTo(RecallMode.HYBRID);
    assertThat(result.semanticSkipped()).isEqualTo(2);
    assertThat(result.results()).extracting(hit -> hit.bookmark().id()).containsExactly("p1", "p3");
    RecallHit unscored = result.results().get(1);
    assertThat(unscored.breakdown().semantic()).isNull();
    assertThat(unscored.score()).isCloseTo(0.45 * (1.0 / 3.2), within(1e-9));
  }

  @Test
  void blank_query_is_rejected_before_any_work() {
    KeywordVectorProvider provider = new KeywordVectorProvider();
    RecallService service = service(provider);

    assertThatThrownBy(() -> service.recall(new RecallRequest("   ")))
        .isInstanceOf(InvalidQueryException.class);
    assertThat(provider.embedCalls()).isZero();
  }

  @Test
  void oversized_query_and_non_positive_limit_are_rejected() {
    RecallService service = service(new KeywordVectorProvider());

    assertThatThrownBy(() -> service.recall(new RecallRequest("x".repeat(2001))))
        .isInstanceOf(InvalidQueryException.class);
    assertThatThrownBy(() -> service.recall(new RecallRequest("java", "all", 0)))
        .isInstanceOf(InvalidQueryException.class);
  }

  @Test
  void unknown_scope_is_rejected() {
    KeywordVectorProvider provider = new KeywordVectorProvider();

    assertThatThrownBy(() -> service(provider).recall(new RecallRequest("java", "nowhere", null)))
        .isInstanceOf(InvalidScopeException.class)
        .hasMessageContaining("nowhere");
    assertThat(provider.embedCalls()).isZero();
  }

  @Test
  void limit_defaults_and_is_clamped() {
    for (int i = 0; i < 60; i++) {
      index.upsert(new BookmarkBuilder().id(String.format("n%02d", i)).title("Note " + i).build());
    }
    properties.setSemanticEnabled(false);
    RecallService service = service(new KeywordVectorProvider());

    assertThat(service.recall(new RecallRequest("note")).results()).hasSize(20);
    assertThat(service.recall(new RecallRequest("note", "all", 100)).results()).hasSize(50);
    assertThat(service.recall(new RecallRequest("note", "all", 5)).results()).hasSize(5);
  }

  @Test
  void scope_selects_locations() {
    index.upsert(
        new BookmarkBuilder()
            .id("w")
            .title("Python at work")
            .storageLocation("work")
            .build());
    index.upsert(
        new BookmarkBuilder()
            .id("h")
            .title("Python at home")
            .storageLocation("home")
            .build());
    RecallService service = service(new KeywordVectorProvider());

    RecallResult current = service.recall(new RecallRequest("python", "current", null));
    RecallResult home = service.recall(new RecallRequest("python", "home", null));
    RecallResult all = service.recall(new RecallRequest("python", "all", null));

    assertThat(current.results()).extracting(hit -> hit.bookmark().id()).containsExactly("w");
    assertThat(current.searchedLocations()).containsExactly("work");
    assertThat(home.results()).extracting(hit -> hit.bookmark().id()).containsExactly("h");
    assertThat(all.results())
        .extracting(hit -> hit.bookmark().id())
        .containsExactlyInAnyOrder("w", "h");
    assertThat(all.searchedLocations()).containsExactly("work", "home");
  }

  @Test
  void deleted_records_need_include_deleted() {
    index.upsert(new BookmarkBuilder().id("live").title("Python live").build());
    index.upsert(new BookmarkBuilder().id("gone").title("Python gone").deleted(NOW).build());
    RecallService service = service(new KeywordVectorProvider());

    RecallResult live = service.recall(new RecallRequest("python"));
    RecallResult withDeleted =
        service.recall(new RecallRequest("python", "all", null, true, null));

    assertThat(live.results()).extracting(hit -> hit.bookmark().id()).containsExactly("live");
    assertThat(withDeleted.results())
        .extracting(hit -> hit.bookmark().id())
        .containsExactlyInAnyOrder("live", "gone");
  }

  @Test
  void folder_filter_restricts_candidates() {
    index.upsert(new BookmarkBuilder().id("a").title("Python a").folderPath("dev").build());
    index.upsert(new BookmarkBuilder().id("b").title("Python b").folderPath("misc").build());

    RecallResult result =
        service(new KeywordVectorProvider())
            .recall(new RecallRequest("python", "all", null, false, "dev"));

    assertThat(result.candidateCount()).isEqualTo(1);
    assertThat(result.results()).extracting(hit -> hit.bookmark().id()).containsExactly("a");
  }

  @Test
  void result_reports_the_stripped_query() {
    addPythonCorpus();

    RecallResult result =
        service(new KeywordVectorProvider()).recall(new RecallRequest("  python \n"));

    assertThat(result.query()).isEqualTo("python");
  }

  @Test
  void recall_never_modifies_records() {
    Bookmark bookmark = new BookmarkBuilder().id("a").title("Python").build();
    index.upsert(bookmark);

    service(new KeywordVectorProvider()).recall(new RecallRequest("python"));

    assertThat(index.get("work", "a")).contains(bookmark);
  }

  @Test
  void query_embedding_timeout_falls_back_to_ranked_lexical_hits() {
    index.upsert(new BookmarkBuilder().id("x").title("Python code samples").build());
    index.upsert(
        new BookmarkBuilder().id("y").title("Snippets").description("Python code review").build());
    index.upsert(new BookmarkBuilder().id("z").title("Java streams").build());
    EmbeddingModel model = mock(EmbeddingModel.class);
    when(model.embed(anyString()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(3_000);
              throw new IllegalStateException("too late");
            });
    EmbeddingCache cache = new EmbeddingCache(100);
    ExecutorService executor = Executors.newCachedThreadPool();
    try {
      CachingEmbeddingProvider provider =
          new CachingEmbeddingProvider(
              model, "slow-model", cache, executor, Duration.ofMillis(150), 8);
      RecallService service =
          new RecallService(index, locations, new SemanticScorer(provider, cache), properties);

      long start = System.nanoTime();
      RecallResult result = service.recall(new RecallRequest("python code"));
      Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

      assertThat(result.mode()).isEqualTo(RecallMode.LEXICAL);
      assertThat(result.fallbackReason()).isEqualTo(FallbackReason.EMBEDDING_UNAVAILABLE);
      assertThat(result.results())
          .extracting(hit -> hit.bookmark().id())
          .containsExactly("x", "y");
      assertThat(result.results().get(0).score()).isCloseTo(1.0 / 3.2, within(1e-9));
      assertThat(result.results().get(1).score()).isCloseTo(0.5 / 3.2, within(1e-9));
      assertThat(elapsed).isLessThan(Duration.ofSeconds(2));
    } finally {
      executor.shutdownNow();
    }
  }
}
