package dev.bookshelf.index;

import org.jspecify.annotations.Nullable;

/**
 * Scope filter for {@link BookmarkIndex#query}.
 *
 * @param location storage location name, or null for every indexed location
 * @param includeDeleted whether soft-deleted records are part of the result
 * @param folderPath exact folder path to restrict to, or null for any folder
 */
public record IndexQuery(
    @Nullable String location, boolean includeDeleted, @Nullable String folderPath) {

  /** Every live record across all locations. */
  public static IndexQuery all() {
    return new IndexQuery(null, false, null);
  }

  /** Every live record of one location. */
  public static IndexQuery location(String location) {
    return new IndexQuery(location, false, null);
  }

  public IndexQuery withDeleted() {
    return new IndexQuery(location, true, folderPath);
  }

  public IndexQuery inFolder(@Nullable String folder) {
    return new IndexQuery(location, includeDeleted, folder);
  }
}
