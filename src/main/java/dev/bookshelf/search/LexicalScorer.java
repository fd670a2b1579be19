package dev.bookshelf.search;

import dev.bookshelf.record.Bookmark;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Pure static utility scoring a record against a query by weighted field containment.
 *
 * <p>A field matches when its value contains the whole trimmed query, case-insensitively. Each
 * field contributes its {@link MatchedField#weight()} at most once; list fields (keywords, tags)
 * match when any element contains the query.
 */
public final class LexicalScorer {

  private LexicalScorer() {}

  /**
   * Scores one record.
   *
   * @param query the user query; only its trimmed form is matched
   * @param bookmark the candidate record
   * @return the score and matched fields; {@link LexicalScore#NONE} for a blank query
   */
  public static LexicalScore score(String query, Bookmark bookmark) {
    String needle = query.strip().toLowerCase(Locale.ROOT);
    if (needle.isEmpty()) {
      return LexicalScore.NONE;
    }

    Set<MatchedField> matched = EnumSet.noneOf(MatchedField.class);
    if (contains(bookmark.title(), needle)) {
      matched.add(MatchedField.TITLE);
    }
    if (bookmark.keywords().stream().anyMatch(k -> contains(k, needle))) {
      matched.add(MatchedField.KEYWORDS);
    }
    if (bookmark.tags().stream().anyMatch(t -> contains(t, needle))) {
      matched.add(MatchedField.TAGS);
    }
    if (bookmark.description() != null && contains(bookmark.description(), needle)) {
      matched.add(MatchedField.DESCRIPTION);
    }
    if (contains(bookmark.url(), needle)) {
      matched.add(MatchedField.URL);
    }

    if (matched.isEmpty()) {
      return LexicalScore.NONE;
    }
    double score = 0.0;
    for (MatchedField field : matched) {
      score += field.weight();
    }
    return new LexicalScore(score, matched);
  }

  private static boolean contains(String value, String lowerNeedle) {
    return value.toLowerCase(Locale.ROOT).contains(lowerNeedle);
  }
}
