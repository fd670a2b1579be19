package dev.bookshelf.record;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A single bookmark entry, the unit of storage and indexing.
 *
 * <p>Instances are immutable and validated on construction: title, keywords and tags are stripped,
 * blank keywords and tags are dropped, and a record that is not deleted never carries a {@code
 * deletedAt} timestamp. Construction fails with {@link IllegalArgumentException} when a required
 * field is missing or malformed, which is how the record store detects corrupt files.
 *
 * <p>Property names follow the on-disk YAML format ({@code created_at}, {@code folder_path}, ...).
 * Asset references are written as {@code favicon_path} / {@code screenshot_path} and also read
 * from {@code favicon_ref} / {@code screenshot_ref}.
 *
 * @param id opaque unique identifier, immutable once created
 * @param url absolute http(s) URL; several records may share one
 * @param title required short title
 * @param keywords at most {@value #MAX_KEYWORDS} keywords, index 0 has the highest priority
 * @param description optional free-text notes
 * @param tags user-defined tags in insertion order
 * @param folderPath optional relative folder path, e.g. {@code development/java}
 * @param createdAt creation time, immutable
 * @param lastModified last edit time
 * @param lastAccessed last access time
 * @param deleted soft-delete flag
 * @param deletedAt when the record was soft-deleted; null unless {@code deleted}
 * @param faviconRef optional reference to a favicon asset
 * @param screenshotRef optional reference to a screenshot asset
 * @param storageLocation name of the storage location owning the record
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
  "id",
  "url",
  "title",
  "keywords",
  "created_at",
  "description",
  "tags",
  "folder_path",
  "last_modified",
  "last_accessed",
  "deleted",
  "deleted_at",
  "favicon_path",
  "screenshot_path",
  "storage_location"
})
public record Bookmark(
    @JsonProperty("id") String id,
    @JsonProperty("url") String url,
    @JsonProperty("title") String title,
    @JsonProperty("keywords") List<String> keywords,
    @JsonProperty("description") @Nullable String description,
    @JsonProperty("tags") @JsonDeserialize(as = LinkedHashSet.class) Set<String> tags,
    @JsonProperty("folder_path") @Nullable String folderPath,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("last_modified") @Nullable Instant lastModified,
    @JsonProperty("last_accessed") @Nullable Instant lastAccessed,
    @JsonProperty("deleted") boolean deleted,
    @JsonProperty("deleted_at") @Nullable Instant deletedAt,
    @JsonProperty("favicon_path") @JsonAlias("favicon_ref") @Nullable String faviconRef,
    @JsonProperty("screenshot_path") @JsonAlias("screenshot_ref") @Nullable String screenshotRef,
    @JsonProperty("storage_location") String storageLocation) {

  /** Maximum number of keywords a record may carry. */
  public static final int MAX_KEYWORDS = 4;

  /** Compact constructor validating and normalising fields. */
  public Bookmark {
    id = requireText(id, "id");
    url = requireHttpUrl(url);
    title = requireText(title, "title");
    keywords = Keywords.clean(keywords);
    if (keywords.size() > MAX_KEYWORDS) {
      throw new IllegalArgumentException(
          "At most " + MAX_KEYWORDS + " keywords allowed, got " + keywords.size());
    }
    tags = cleanTags(tags);
    folderPath = validateFolderPath(folderPath);
    if (createdAt == null) {
      throw new IllegalArgumentException("created_at is required");
    }
    storageLocation = requireText(storageLocation, "storage_location");
    if (!deleted) {
      deletedAt = null;
    }
  }

  /** Identity of this record within the whole collection. */
  public RecordKey key() {
    return new RecordKey(storageLocation, id);
  }

  /** Returns a soft-deleted copy stamped with {@code when}. */
  public Bookmark markDeleted(Instant when) {
    return new Bookmark(
        id, url, title, keywords, description, tags, folderPath, createdAt, lastModified,
        lastAccessed, true, when, faviconRef, screenshotRef, storageLocation);
  }

  /** Returns a live copy with the deletion timestamp cleared. */
  public Bookmark restore() {
    return new Bookmark(
        id, url, title, keywords, description, tags, folderPath, createdAt, lastModified,
        lastAccessed, false, null, faviconRef, screenshotRef, storageLocation);
  }

  /** Returns a copy with {@code lastAccessed} set to {@code when}. */
  public Bookmark accessedAt(Instant when) {
    return new Bookmark(
        id, url, title, keywords, description, tags, folderPath, createdAt, lastModified, when,
        deleted, deletedAt, faviconRef, screenshotRef, storageLocation);
  }

  /** Returns a copy re-homed to another storage location name. */
  public Bookmark inLocation(String location) {
    return new Bookmark(
        id, url, title, keywords, description, tags, folderPath, createdAt, lastModified,
        lastAccessed, deleted, deletedAt, faviconRef, screenshotRef, location);
  }

  private static String requireText(@Nullable String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return value.strip();
  }

  private static String requireHttpUrl(@Nullable String value) {
    String url = requireText(value, "url");
    try {
      URI uri = new URI(url);
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if (!uri.isAbsolute() || !(scheme.equals("http") || scheme.equals("https"))) {
        throw new IllegalArgumentException("url must be an absolute http(s) URL: " + url);
      }
      if (uri.getHost() == null) {
        throw new IllegalArgumentException("url has no host: " + url);
      }
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("url is not a valid URI: " + url, e);
    }
    return url;
  }

  private static Set<String> cleanTags(@Nullable Set<String> tags) {
    if (tags == null || tags.isEmpty()) {
      return Set.of();
    }
    Set<String> cleaned = new LinkedHashSet<>();
    for (String tag : tags) {
      if (tag != null && !tag.isBlank()) {
        cleaned.add(tag.strip());
      }
    }
    return Collections.unmodifiableSet(cleaned);
  }

  private static @Nullable String validateFolderPath(@Nullable String folderPath) {
    if (folderPath == null) {
      return null;
    }
    String stripped = folderPath.strip();
    if (stripped.contains("..") || stripped.startsWith("/") || stripped.startsWith("\\")) {
      throw new IllegalArgumentException(
          "folder_path cannot contain '..' or start with / or \\: " + folderPath);
    }
    return stripped.isEmpty() ? null : stripped;
  }
}
