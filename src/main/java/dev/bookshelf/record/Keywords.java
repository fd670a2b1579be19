package dev.bookshelf.record;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Static helpers for the ordered keyword list of a {@link Bookmark}.
 *
 * <p>Order encodes priority: index 0 is the most important keyword. User-specified keywords always
 * precede keywords derived from page content.
 */
public final class Keywords {

  private Keywords() {
    // utility class
  }

  /**
   * Strips every keyword and drops blank entries, preserving order.
   *
   * @param keywords raw keywords, may be null
   * @return an unmodifiable cleaned list
   */
  public static List<String> clean(@Nullable List<String> keywords) {
    if (keywords == null || keywords.isEmpty()) {
      return List.of();
    }
    List<String> cleaned = new ArrayList<>(keywords.size());
    for (String keyword : keywords) {
      if (keyword != null && !keyword.isBlank()) {
        cleaned.add(keyword.strip());
      }
    }
    return List.copyOf(cleaned);
  }

  /**
   * Merges user-specified and derived keywords into a list of at most {@link
   * Bookmark#MAX_KEYWORDS}: user keywords first, then derived ones, skipping case-insensitive
   * duplicates.
   *
   * @param userKeywords keywords typed by the user, highest priority
   * @param derivedKeywords keywords suggested by content analysis
   * @return the merged, truncated list
   */
  public static List<String> merge(
      @Nullable List<String> userKeywords, @Nullable List<String> derivedKeywords) {
    List<String> merged = new ArrayList<>(Bookmark.MAX_KEYWORDS);
    Set<String> seen = new HashSet<>();
    appendDistinct(merged, seen, clean(userKeywords));
    appendDistinct(merged, seen, clean(derivedKeywords));
    return List.copyOf(merged);
  }

  private static void appendDistinct(List<String> target, Set<String> seen, List<String> source) {
    for (String keyword : source) {
      if (target.size() == Bookmark.MAX_KEYWORDS) {
        return;
      }
      if (seen.add(keyword.toLowerCase(Locale.ROOT))) {
        target.add(keyword);
      }
    }
  }
}
