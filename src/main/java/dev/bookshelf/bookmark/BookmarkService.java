package dev.bookshelf.bookmark;

import dev.bookshelf.embedding.EmbeddingCache;
import dev.bookshelf.index.BookmarkIndex;
import dev.bookshelf.index.IndexQuery;
import dev.bookshelf.record.Bookmark;
import dev.bookshelf.record.Keywords;
import dev.bookshelf.storage.DeleteMode;
import dev.bookshelf.storage.RecordReadResult;
import dev.bookshelf.storage.RecordStore;
import dev.bookshelf.storage.ScopedLock;
import dev.bookshelf.storage.StorageException;
import dev.bookshelf.storage.StorageLocation;
import dev.bookshelf.storage.StorageLocations;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Write-side orchestration of bookmark records and the only writer of {@link BookmarkIndex}
 * entries.
 *
 * <p>Every mutation holds the record lock for its whole read, modify, write, index-update cycle,
 * so the index never diverges from the committed file by more than the mutation in flight. The
 * current state is always re-read from the {@link RecordStore}, not from the index.
 *
 * <p>Lookups take an optional location; without one the id is resolved through the index across
 * all locations.
 */
@Service
public class BookmarkService {

  private static final Logger log = LoggerFactory.getLogger(BookmarkService.class);

  private static final Comparator<Bookmark> NEWEST_FIRST =
      Comparator.comparing(Bookmark::createdAt).reversed().thenComparing(Bookmark::id);

  private final RecordStore store;
  private final BookmarkIndex index;
  private final StorageLocations locations;
  private final EmbeddingCache embeddingCache;
  private final Clock clock;

  public BookmarkService(
      RecordStore store,
      BookmarkIndex index,
      StorageLocations locations,
      EmbeddingCache embeddingCache,
      Clock clock) {
    this.store = store;
    this.index = index;
    this.locations = locations;
    this.embeddingCache = embeddingCache;
    this.clock = clock;
  }

  /**
   * Creates a record with a fresh id. User keywords come first; derived keywords fill the
   * remaining slots.
   *
   * @param draft the new record's fields
   * @return the committed record
   * @throws IllegalArgumentException if a field is invalid
   * @throws StorageException if the location is unknown or the write fails
   */
  public Bookmark create(BookmarkDraft draft) {
    String location = draft.storageLocation() != null ? draft.storageLocation() : currentLocation();
    Bookmark bookmark =
        new Bookmark(
            UUID.randomUUID().toString(),
            draft.url(),
            draft.title(),
            Keywords.merge(draft.keywords(), draft.derivedKeywords()),
            draft.description(),
            draft.tags(),
            draft.folderPath(),
            clock.instant(),
            null,
            null,
            false,
            null,
            null,
            null,
            location);
    try (ScopedLock lock = store.lock(location, bookmark.id())) {
      store.write(bookmark);
      index.upsert(bookmark);
    }
    log.info("Created bookmark {}: {}", bookmark.key(), bookmark.title());
    return bookmark;
  }

  /**
   * Returns a record from the index.
   *
   * @throws BookmarkNotFoundException if no such record is indexed
   */
  public Bookmark get(String id, @Nullable String location) {
    Optional<Bookmark> found = location == null ? index.find(id) : index.get(location, id);
    return found.orElseThrow(() -> new BookmarkNotFoundException(id, location));
  }

  /**
   * Lists records newest first.
   *
   * @param query location, deleted and folder filters
   */
  public List<Bookmark> list(IndexQuery query) {
    return index.query(query).stream().sorted(NEWEST_FIRST).toList();
  }

  /**
   * Applies a partial update and stamps {@code last_modified}.
   *
   * @throws BookmarkNotFoundException if the record does not exist
   */
  public Bookmark update(String id, @Nullable String location, BookmarkChanges changes) {
    Bookmark updated = mutate(id, location, existing -> applyChanges(existing, changes));
    log.info("Updated bookmark {}", updated.key());
    return updated;
  }

  /**
   * Marks a record deleted. It stays on disk and in the index, visible only to queries that
   * include deleted records.
   *
   * @throws IllegalStateException if the record is already deleted
   */
  public Bookmark softDelete(String id, @Nullable String location) {
    String home = locate(id, location);
    try (ScopedLock lock = store.lock(home, id)) {
      Bookmark existing = readCurrent(home, id);
      if (existing.deleted()) {
        throw new IllegalStateException("Bookmark " + id + " is already deleted");
      }
      Bookmark deleted =
          store
              .delete(home, id, DeleteMode.SOFT)
              .orElseThrow(() -> new BookmarkNotFoundException(id, home));
      index.upsert(deleted);
      log.info("Soft deleted bookmark {}", deleted.key());
      return deleted;
    }
  }

  /**
   * Clears the deleted flag of a soft-deleted record.
   *
   * @throws IllegalStateException if the record is not deleted
   */
  public Bookmark restore(String id, @Nullable String location) {
    Bookmark restored =
        mutate(
            id,
            location,
            existing -> {
              if (!existing.deleted()) {
                throw new IllegalStateException("Bookmark " + id + " is not deleted");
              }
              return existing.restore();
            });
    log.info("Restored bookmark {}", restored.key());
    return restored;
  }

  /**
   * Permanently removes a soft-deleted record, its file and its screenshot.
   *
   * @throws IllegalStateException if the record was not soft-deleted first
   */
  public void hardDelete(String id, @Nullable String location) {
    String home = locate(id, location);
    try (ScopedLock lock = store.lock(home, id)) {
      Bookmark existing = readCurrent(home, id);
      if (!existing.deleted()) {
        throw new IllegalStateException(
            "Bookmark " + id + " must be soft-deleted before hard delete");
      }
      store.delete(home, id, DeleteMode.HARD);
      index.remove(home, id);
      embeddingCache.unbind(existing.key().toString());
    }
    log.warn("Hard deleted bookmark {}/{} permanently", home, id);
  }

  /** Stamps {@code last_accessed} with the current time. */
  public Bookmark trackAccess(String id, @Nullable String location) {
    Instant now = clock.instant();
    Bookmark accessed = mutate(id, location, existing -> existing.accessedAt(now));
    log.debug("Tracked access for bookmark {}", accessed.key());
    return accessed;
  }

  private Bookmark mutate(String id, @Nullable String location, UnaryOperator<Bookmark> change) {
    String home = locate(id, location);
    try (ScopedLock lock = store.lock(home, id)) {
      Bookmark updated = change.apply(readCurrent(home, id));
      store.write(updated);
      index.upsert(updated);
      return updated;
    }
  }

  private Bookmark readCurrent(String location, String id) {
    RecordReadResult result =
        store.read(location, id).orElseThrow(() -> new BookmarkNotFoundException(id, location));
    if (result instanceof RecordReadResult.Corrupt corrupt) {
      index.remove(location, id);
      throw new StorageException(
          "Bookmark " + id + " cannot be read from " + corrupt.path() + ": " + corrupt.reason());
    }
    Bookmark bookmark = ((RecordReadResult.Parsed) result).bookmark();
    return bookmark.storageLocation().equals(location) ? bookmark : bookmark.inLocation(location);
  }

  private String locate(String id, @Nullable String location) {
    if (location != null) {
      locations.require(location);
      return location;
    }
    return index
        .find(id)
        .map(Bookmark::storageLocation)
        .orElseThrow(() -> new BookmarkNotFoundException(id, null));
  }

  private String currentLocation() {
    return locations
        .current()
        .map(StorageLocation::name)
        .orElseThrow(() -> new StorageException("No storage location configured"));
  }

  private Bookmark applyChanges(Bookmark existing, BookmarkChanges changes) {
    return new Bookmark(
        existing.id(),
        changes.url() != null ? changes.url() : existing.url(),
        changes.title() != null ? changes.title() : existing.title(),
        changes.keywords() != null
            ? Keywords.merge(changes.keywords(), List.of())
            : existing.keywords(),
        changes.description() != null ? changes.description() : existing.description(),
        changes.tags() != null ? changes.tags() : existing.tags(),
        changes.folderPath() != null ? changes.folderPath() : existing.folderPath(),
        existing.createdAt(),
        clock.instant(),
        existing.lastAccessed(),
        existing.deleted(),
        existing.deletedAt(),
        existing.faviconRef(),
        existing.screenshotRef(),
        existing.storageLocation());
  }
}
