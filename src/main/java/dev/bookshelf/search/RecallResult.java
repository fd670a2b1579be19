package dev.bookshelf.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a recall query. In {@link RecallMode#LEXICAL} mode {@code fallbackReason} says why
 * semantic scoring was skipped.
 *
 * @param query the query text with surrounding whitespace stripped
 * @param mode how the hits were scored
 * @param fallbackReason set only in lexical mode
 * @param semanticAvailable whether semantic scores contributed
 * @param results hits in rank order
 * @param searchedLocations storage locations the candidates came from
 * @param candidateCount records considered before scoring
 * @param semanticSkipped candidates left without a semantic score because their embedding failed
 */
public record RecallResult(
    String query,
    RecallMode mode,
    @JsonProperty("fallback_reason") @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable
        FallbackReason fallbackReason,
    boolean semanticAvailable,
    List<RecallHit> results,
    List<String> searchedLocations,
    int candidateCount,
    int semanticSkipped) {

  public RecallResult {
    results = List.copyOf(results);
    searchedLocations = List.copyOf(searchedLocations);
  }
}
