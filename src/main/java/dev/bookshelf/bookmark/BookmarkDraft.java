package dev.bookshelf.bookmark;

import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Input for {@link BookmarkService#create}.
 *
 * @param url absolute http(s) URL
 * @param title required title
 * @param storageLocation target location name; null means the current location
 * @param keywords keywords chosen by the user, kept ahead of derived ones
 * @param derivedKeywords keywords proposed by an analyzer, used to fill the remaining slots
 * @param description optional notes
 * @param tags optional tags
 * @param folderPath optional relative folder path
 */
public record BookmarkDraft(
    String url,
    String title,
    @Nullable String storageLocation,
    List<String> keywords,
    List<String> derivedKeywords,
    @Nullable String description,
    Set<String> tags,
    @Nullable String folderPath) {

  public BookmarkDraft {
    keywords = keywords == null ? List.of() : keywords;
    derivedKeywords = derivedKeywords == null ? List.of() : derivedKeywords;
    tags = tags == null ? Set.of() : tags;
  }

  /** A draft with only the required fields, stored in the current location. */
  public static BookmarkDraft of(String url, String title) {
    return new BookmarkDraft(url, title, null, List.of(), List.of(), null, Set.of(), null);
  }
}
