package dev.bookshelf.search;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lexical relevance of one record to one query.
 *
 * @param score sum of the weights of {@code matchedFields}, in [0, {@value MatchedField#MAX_SCORE}]
 * @param matchedFields fields whose value contains the query
 */
public record LexicalScore(double score, Set<MatchedField> matchedFields) {

  static final LexicalScore NONE = new LexicalScore(0.0, Set.of());

  public LexicalScore {
    matchedFields =
        matchedFields.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(matchedFields));
  }

  /** The score scaled to [0, 1]. */
  public double normalized() {
    return Math.min(1.0, score / MatchedField.MAX_SCORE);
  }

  public boolean matched() {
    return score > 0.0;
  }
}
