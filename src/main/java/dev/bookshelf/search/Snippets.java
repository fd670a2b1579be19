package dev.bookshelf.search;

import dev.bookshelf.record.Bookmark;
import java.util.Locale;

/** Builds the short text shown with a hit. */
final class Snippets {

  static final int MAX_LENGTH = 180;
  private static final String ELLIPSIS = "...";

  private Snippets() {}

  /**
   * Picks the first of title, description, keywords and URL that contains the query, falling back
   * to the title, and cuts it to {@link #MAX_LENGTH} characters.
   */
  static String build(String query, Bookmark bookmark) {
    String needle = query.strip().toLowerCase(Locale.ROOT);
    String best = bookmark.title();
    for (String text :
        new String[] {
          bookmark.title(),
          bookmark.description() == null ? "" : bookmark.description(),
          String.join(", ", bookmark.keywords()),
          bookmark.url()
        }) {
      if (!needle.isEmpty() && text.toLowerCase(Locale.ROOT).contains(needle)) {
        best = text;
        break;
      }
    }
    String snippet = best.strip();
    if (snippet.length() > MAX_LENGTH) {
      int cut = MAX_LENGTH - ELLIPSIS.length();
      if (Character.isHighSurrogate(snippet.charAt(cut - 1))) {
        cut--;
      }
      snippet = snippet.substring(0, cut) + ELLIPSIS;
    }
    return snippet;
  }
}
