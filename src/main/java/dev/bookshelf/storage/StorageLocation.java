package dev.bookshelf.storage;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * A named partition of the collection backed by one directory.
 *
 * <p>Layout under {@code root}: {@code bookmarks/<id>.yaml} for records, {@code favicons/} for
 * shared per-domain icons and {@code screenshots/} for per-record captures.
 *
 * @param name the location name (e.g. {@code work}, {@code personal})
 * @param root the root directory
 * @param current whether this location is the active one
 */
public record StorageLocation(String name, Path root, boolean current) {

  static final String RECORD_SUFFIX = ".yaml";

  private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_-]+");
  private static final Pattern RECORD_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

  public StorageLocation {
    if (name == null || !NAME.matcher(name).matches()) {
      throw new IllegalArgumentException(
          "Storage name must contain only letters, numbers, dashes, and underscores: " + name);
    }
    if (root == null) {
      throw new IllegalArgumentException("Storage path is required for " + name);
    }
    root = root.toAbsolutePath().normalize();
  }

  public Path bookmarksDir() {
    return root.resolve("bookmarks");
  }

  public Path faviconsDir() {
    return root.resolve("favicons");
  }

  public Path screenshotsDir() {
    return root.resolve("screenshots");
  }

  /**
   * Resolves the record file for an id, rejecting ids that could escape the bookmarks directory.
   *
   * @param id the record id
   * @return path of {@code bookmarks/<id>.yaml}
   */
  public Path recordFile(String id) {
    if (id == null || !RECORD_ID.matcher(id).matches()) {
      throw new IllegalArgumentException("Illegal record id: " + id);
    }
    return bookmarksDir().resolve(id + RECORD_SUFFIX);
  }
}
