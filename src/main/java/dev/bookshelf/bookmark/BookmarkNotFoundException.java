package dev.bookshelf.bookmark;

import org.jspecify.annotations.Nullable;

/** No record with the given id exists in the requested location (or in any, when none given). */
public class BookmarkNotFoundException extends RuntimeException {

  public BookmarkNotFoundException(String id, @Nullable String location) {
    super(
        location == null
            ? "Bookmark not found: " + id
            : "Bookmark not found: " + id + " in " + location);
  }
}
