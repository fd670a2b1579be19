package dev.bookshelf.search;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.bookshelf.record.Bookmark;
import java.util.Set;

/**
 * One ranked record in a {@link RecallResult}.
 *
 * @param bookmark the matching record, serialized as {@code record}
 * @param score combined score in [0, 1]
 * @param breakdown lexical and semantic components of {@code score}
 * @param matchedFields fields containing the query text
 * @param snippet best matching field text, at most {@value Snippets#MAX_LENGTH} characters
 */
public record RecallHit(
    @JsonProperty("record") Bookmark bookmark,
    double score,
    ScoreBreakdown breakdown,
    Set<MatchedField> matchedFields,
    String snippet) {}
