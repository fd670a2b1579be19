package dev.bookshelf.index;

import dev.bookshelf.record.Bookmark;
import dev.bookshelf.storage.RecordReadResult;
import dev.bookshelf.storage.RecordStore;
import dev.bookshelf.storage.ScopedLock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory view of every record (live and soft-deleted) keyed by {@code (location, id)}, derived
 * from the {@link RecordStore}.
 *
 * <p>Lifecycle: {@link #rebuild} repopulates a location from disk at startup or after external
 * changes; {@link #upsert} and {@link #remove} are applied by the writer that just committed a
 * store write, while it still holds the record lock. The store is the source of truth: when a
 * record cannot be read back ({@link #refresh}), it is dropped from the view.
 *
 * <p>Each location keeps a folder to ids secondary index so folder-scoped queries touch only the
 * records of that folder. A rebuild of a location excludes concurrent upserts and removes of that
 * location; queries never block.
 */
@Component
public class BookmarkIndex {

  private static final Logger log = LoggerFactory.getLogger(BookmarkIndex.class);

  private final RecordStore store;
  private final ConcurrentHashMap<String, Partition> partitions = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, ReentrantReadWriteLock> guards =
      new ConcurrentHashMap<>();

  public BookmarkIndex(RecordStore store) {
    this.store = store;
  }

  /**
   * Replaces the view of one location with a fresh scan of the record store. Corrupt files are
   * logged and skipped; duplicate ids keep the most recently modified record.
   *
   * @param location the storage location name
   * @return counts and messages describing the scan
   */
  public RebuildReport rebuild(String location) {
    ReentrantReadWriteLock.WriteLock writeLock = guard(location).writeLock();
    writeLock.lock();
    try {
      Partition fresh = new Partition();
      List<String> corrupt = new ArrayList<>();
      List<String> conflicts = new ArrayList<>();
      Map<String, String> sourceFiles = new HashMap<>();

      try (Stream<RecordReadResult> results = store.scan(location)) {
        results.forEach(
            result -> {
              if (result instanceof RecordReadResult.Parsed parsed) {
                Bookmark bookmark = homed(parsed.bookmark(), location);
                String file = parsed.path().getFileName().toString();
                Bookmark existing = fresh.byId.get(bookmark.id());
                if (existing != null) {
                  String message =
                      "Conflict for bookmark ID "
                          + bookmark.id()
                          + ": "
                          + sourceFiles.get(bookmark.id())
                          + " vs "
                          + file;
                  log.warn(message);
                  conflicts.add(message);
                  if (!isNewer(bookmark, existing)) {
                    return;
                  }
                }
                fresh.put(bookmark);
                sourceFiles.put(bookmark.id(), file);
              } else if (result instanceof RecordReadResult.Corrupt corruptFile) {
                String message =
                    "Corrupted YAML in "
                        + corruptFile.path().getFileName()
                        + ": "
                        + corruptFile.reason();
                log.warn(message);
                corrupt.add(message);
              }
            });
      }

      fresh.corruptCount = corrupt.size();
      fresh.conflictCount = conflicts.size();
      partitions.put(location, fresh);
      log.info(
          "Loaded {} bookmarks from {} ({} errors, {} conflicts)",
          fresh.byId.size(),
          location,
          corrupt.size(),
          conflicts.size());
      return new RebuildReport(location, fresh.byId.size(), corrupt, conflicts);
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Inserts or replaces the view of a record that was just written to the store.
   *
   * @param bookmark the committed record
   */
  public void upsert(Bookmark bookmark) {
    String location = bookmark.storageLocation();
    ReentrantReadWriteLock.ReadLock readLock = guard(location).readLock();
    readLock.lock();
    try {
      partition(location).put(bookmark);
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Removes a record from the view after it was hard-deleted from the store.
   *
   * @param location the storage location name
   * @param id the record id
   */
  public void remove(String location, String id) {
    ReentrantReadWriteLock.ReadLock readLock = guard(location).readLock();
    readLock.lock();
    try {
      Partition partition = partitions.get(location);
      if (partition != null) {
        partition.drop(id);
      }
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Re-reads one record from the store under its lock and applies the result: a parsed record
   * replaces the view, a corrupt or missing file drops it.
   *
   * @param location the storage location name
   * @param id the record id
   * @return the record now in the view, or empty if it was dropped
   */
  public Optional<Bookmark> refresh(String location, String id) {
    try (ScopedLock lock = store.lock(location, id)) {
      Optional<RecordReadResult> result = store.read(location, id);
      if (result.isPresent() && result.get() instanceof RecordReadResult.Parsed parsed) {
        Bookmark bookmark = homed(parsed.bookmark(), location);
        upsert(bookmark);
        return Optional.of(bookmark);
      }
      result.ifPresent(
          r ->
              log.warn(
                  "Dropping {}/{} from index: {}",
                  location,
                  id,
                  ((RecordReadResult.Corrupt) r).reason()));
      remove(location, id);
      return Optional.empty();
    }
  }

  /**
   * Returns the candidate set for a scope. Order is unspecified.
   *
   * @param query location, deleted and folder filters
   * @return matching records; empty for a location that was never indexed
   */
  public List<Bookmark> query(IndexQuery query) {
    Collection<Partition> scoped;
    if (query.location() == null) {
      scoped = partitions.values();
    } else {
      Partition partition = partitions.get(query.location());
      scoped = partition == null ? List.of() : List.of(partition);
    }

    List<Bookmark> result = new ArrayList<>();
    for (Partition partition : scoped) {
      partition.collect(query.folderPath(), query.includeDeleted(), result);
    }
    return result;
  }

  public Optional<Bookmark> get(String location, String id) {
    Partition partition = partitions.get(location);
    return partition == null ? Optional.empty() : Optional.ofNullable(partition.byId.get(id));
  }

  /** Looks an id up across every location, in no particular location order. */
  public Optional<Bookmark> find(String id) {
    for (Partition partition : partitions.values()) {
      Bookmark bookmark = partition.byId.get(id);
      if (bookmark != null) {
        return Optional.of(bookmark);
      }
    }
    return Optional.empty();
  }

  /** Locations that have been rebuilt or written to. */
  public Set<String> locations() {
    return Set.copyOf(partitions.keySet());
  }

  /**
   * Counts for one location.
   *
   * @param location the storage location name
   * @return zero counts for a location that was never indexed
   */
  public IndexStats stats(String location) {
    Partition partition = partitions.get(location);
    if (partition == null) {
      return new IndexStats(0, 0, 0, 0, 0);
    }
    int total = 0;
    int deleted = 0;
    for (Bookmark bookmark : partition.byId.values()) {
      total++;
      if (bookmark.deleted()) {
        deleted++;
      }
    }
    return new IndexStats(
        total, total - deleted, deleted, partition.corruptCount, partition.conflictCount);
  }

  private Partition partition(String location) {
    return partitions.computeIfAbsent(location, l -> new Partition());
  }

  private ReentrantReadWriteLock guard(String location) {
    return guards.computeIfAbsent(location, l -> new ReentrantReadWriteLock());
  }

  private static Bookmark homed(Bookmark bookmark, String location) {
    if (bookmark.storageLocation().equals(location)) {
      return bookmark;
    }
    log.debug(
        "Record {} declares location {} but is stored in {}",
        bookmark.id(),
        bookmark.storageLocation(),
        location);
    return bookmark.inLocation(location);
  }

  /** Last-writer-wins ordering: last_modified, then created_at; ties go to the later file. */
  private static boolean isNewer(Bookmark candidate, Bookmark existing) {
    return !stamp(candidate).isBefore(stamp(existing));
  }

  private static Instant stamp(Bookmark bookmark) {
    return bookmark.lastModified() != null ? bookmark.lastModified() : bookmark.createdAt();
  }

  /** The records of one location with their folder secondary index. */
  private static final class Partition {

    private final ConcurrentHashMap<String, Bookmark> byId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> idsByFolder = new ConcurrentHashMap<>();
    private volatile int corruptCount;
    private volatile int conflictCount;

    void put(Bookmark bookmark) {
      Bookmark previous = byId.put(bookmark.id(), bookmark);
      if (previous != null && !Objects.equals(previous.folderPath(), bookmark.folderPath())) {
        unlinkFolder(previous);
      }
      if (bookmark.folderPath() != null) {
        idsByFolder.compute(
            bookmark.folderPath(),
            (folder, ids) -> {
              Set<String> target = ids != null ? ids : ConcurrentHashMap.newKeySet();
              target.add(bookmark.id());
              return target;
            });
      }
    }

    void drop(String id) {
      Bookmark previous = byId.remove(id);
      if (previous != null) {
        unlinkFolder(previous);
      }
    }

    void collect(@Nullable String folder, boolean includeDeleted, List<Bookmark> sink) {
      if (folder == null) {
        for (Bookmark bookmark : byId.values()) {
          if (includeDeleted || !bookmark.deleted()) {
            sink.add(bookmark);
          }
        }
        return;
      }
      Set<String> ids = idsByFolder.get(folder);
      if (ids == null) {
        return;
      }
      for (String id : ids) {
        Bookmark bookmark = byId.get(id);
        // the folder link may briefly lag a concurrent move to another folder
        if (bookmark != null
            && folder.equals(bookmark.folderPath())
            && (includeDeleted || !bookmark.deleted())) {
          sink.add(bookmark);
        }
      }
    }

    private void unlinkFolder(Bookmark bookmark) {
      if (bookmark.folderPath() == null) {
        return;
      }
      idsByFolder.computeIfPresent(
          bookmark.folderPath(),
          (folder, ids) -> {
            ids.remove(bookmark.id());
            return ids.isEmpty() ? null : ids;
          });
    }
  }
}
