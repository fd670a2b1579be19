package dev.bookshelf.bookmark;

import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Partial update for {@link BookmarkService#update}. A null component leaves the field unchanged.
 */
public record BookmarkChanges(
    @Nullable String title,
    @Nullable String url,
    @Nullable String description,
    @Nullable List<String> keywords,
    @Nullable Set<String> tags,
    @Nullable String folderPath) {

  public static BookmarkChanges none() {
    return new BookmarkChanges(null, null, null, null, null, null);
  }

  public BookmarkChanges withTitle(String newTitle) {
    return new BookmarkChanges(newTitle, url, description, keywords, tags, folderPath);
  }

  public BookmarkChanges withDescription(String newDescription) {
    return new BookmarkChanges(title, url, newDescription, keywords, tags, folderPath);
  }

  public BookmarkChanges withKeywords(List<String> newKeywords) {
    return new BookmarkChanges(title, url, description, newKeywords, tags, folderPath);
  }

  public BookmarkChanges withTags(Set<String> newTags) {
    return new BookmarkChanges(title, url, description, keywords, newTags, folderPath);
  }

  public BookmarkChanges withFolderPath(String newFolderPath) {
    return new BookmarkChanges(title, url, description, keywords, tags, newFolderPath);
  }
}
