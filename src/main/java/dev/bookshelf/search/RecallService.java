package dev.bookshelf.search;

import dev.bookshelf.embedding.EmbeddingUnavailableException;
import dev.bookshelf.index.BookmarkIndex;
import dev.bookshelf.index.IndexQuery;
import dev.bookshelf.record.Bookmark;
import dev.bookshelf.record.RecordKey;
import dev.bookshelf.storage.StorageLocation;
import dev.bookshelf.storage.StorageLocations;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Recall orchestration: validate the request, resolve candidates from the {@link BookmarkIndex},
 * score them lexically and, when the query can be embedded, semantically, then merge and rank.
 *
 * <p>Pipeline: validate -> candidates for scope -> lexical score per candidate -> embed query
 * (fallback to lexical on {@link EmbeddingUnavailableException}) -> semantic score per candidate
 * -> combine -> drop non-positive -> sort -> truncate.
 *
 * <p>Combined score in hybrid mode is {@code semanticWeight * max(0, cosine) + lexicalWeight *
 * lexical / 3.2}; in lexical mode it is {@code lexical / 3.2}. Records are never modified.
 */
@Service
public class RecallService {

  private static final Logger log = LoggerFactory.getLogger(RecallService.class);

  /** Longest accepted query text. */
  static final int MAX_QUERY_LENGTH = 2000;

  private final BookmarkIndex index;
  private final StorageLocations locations;
  private final SemanticScorer semanticScorer;
  private final RecallProperties properties;

  public RecallService(
      BookmarkIndex index,
      StorageLocations locations,
      SemanticScorer semanticScorer,
      RecallProperties properties) {
    this.index = index;
    this.locations = locations;
    this.semanticScorer = semanticScorer;
    this.properties = properties;
  }

  /**
   * Runs a recall query.
   *
   * @param request query text, scope, limit and filters
   * @return ranked hits with the scoring mode
   * @throws InvalidQueryException on blank or oversized text or a non-positive limit
   * @throws InvalidScopeException on an unknown scope
   */
  public RecallResult recall(RecallRequest request) {
    String query = validateQuery(request.query());
    int limit = effectiveLimit(request.limit());
    @Nullable String location = resolveScope(request.scope());
    List<String> searched = location == null ? locations.names() : List.of(location);

    IndexQuery scope = new IndexQuery(location, request.includeDeleted(), request.folder());
    List<Bookmark> candidates = index.query(scope);

    RecallMode mode = RecallMode.HYBRID;
    @Nullable FallbackReason fallback = null;
    Map<RecordKey, Double> semantic = Map.of();
    if (!properties.isSemanticEnabled() || !semanticScorer.isAvailable()) {
      mode = RecallMode.LEXICAL;
      fallback = FallbackReason.SEMANTIC_SEARCH_DISABLED;
    } else {
      try {
        float[] queryVector = semanticScorer.embedQuery(query);
        semantic = semanticScorer.score(queryVector, candidates);
      } catch (EmbeddingUnavailableException e) {
        log.info("Recall falls back to lexical mode ({}): {}", e.reason(), e.getMessage());
        mode = RecallMode.LEXICAL;
        fallback = FallbackReason.EMBEDDING_UNAVAILABLE;
      }
    }

    List<RecallHit> hits = new ArrayList<>();
    for (Bookmark bookmark : candidates) {
      LexicalScore lexical = LexicalScorer.score(query, bookmark);
      @Nullable Double cosine = mode == RecallMode.HYBRID ? semantic.get(bookmark.key()) : null;
      double combined = combine(mode, lexical, cosine);
      if (combined <= 0.0) {
        continue;
      }
      hits.add(
          new RecallHit(
              bookmark,
              combined,
              new ScoreBreakdown(lexical.normalized(), cosine),
              lexical.matchedFields(),
              Snippets.build(query, bookmark)));
    }
    hits.sort(RecallRanking.HITS);
    List<RecallHit> top = hits.size() > limit ? hits.subList(0, limit) : hits;

    int skipped = mode == RecallMode.HYBRID ? candidates.size() - semantic.size() : 0;
    log.debug(
        "Recall '{}' in {} mode: {} candidates, {} hits, {} returned",
        query,
        mode.value(),
        candidates.size(),
        hits.size(),
        top.size());
    return new RecallResult(
        query,
        mode,
        fallback,
        mode == RecallMode.HYBRID,
        top,
        searched,
        candidates.size(),
        skipped);
  }

  private double combine(RecallMode mode, LexicalScore lexical, @Nullable Double cosine) {
    if (mode == RecallMode.LEXICAL) {
      return lexical.normalized();
    }
    double semantic = cosine == null ? 0.0 : Math.max(0.0, cosine);
    return properties.getSemanticWeight() * semantic
        + properties.getLexicalWeight() * lexical.normalized();
  }

  private static String validateQuery(@Nullable String query) {
    if (query == null || query.isBlank()) {
      throw new InvalidQueryException("Query text must not be blank");
    }
    String trimmed = query.strip();
    if (trimmed.length() > MAX_QUERY_LENGTH) {
      throw new InvalidQueryException(
          "Query text must be at most " + MAX_QUERY_LENGTH + " characters");
    }
    return trimmed;
  }

  private int effectiveLimit(@Nullable Integer requested) {
    if (requested == null) {
      return properties.getDefaultLimit();
    }
    if (requested < 1) {
      throw new InvalidQueryException("limit must be at least 1, got: " + requested);
    }
    return Math.min(requested, properties.getMaxLimit());
  }

  /** Returns the single location a scope selects, or null for every location. */
  private @Nullable String resolveScope(@Nullable String scope) {
    if (scope == null || scope.isBlank() || RecallRequest.SCOPE_ALL.equals(scope)) {
      return null;
    }
    if (RecallRequest.SCOPE_CURRENT.equals(scope)) {
      return locations
          .current()
          .map(StorageLocation::name)
          .orElseThrow(() -> new InvalidScopeException(scope));
    }
    if (!locations.contains(scope)) {
      throw new InvalidScopeException(scope);
    }
    return scope;
  }
}
