package dev.bookshelf.storage;

import dev.bookshelf.record.Bookmark;
import dev.bookshelf.record.RecordKey;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authoritative on-disk store: one YAML file per bookmark under {@code <location>/bookmarks/}.
 *
 * <p>Writes and deletes run under a per-record {@link ScopedLock} acquired with a bounded wait
 * ({@link LockTimeoutException} on expiry). Files are replaced by writing a temporary sibling and
 * renaming it over the target, so readers observe either the previous or the new content, never a
 * partial file. Parse failures are reported as {@link RecordReadResult.Corrupt} values and never
 * abort a scan.
 *
 * <p>Callers that must keep a derived view consistent (the index) take {@link #lock} themselves
 * and perform their update before releasing it; the locks are reentrant.
 */
@Component
public class RecordStore {

  private static final Logger log = LoggerFactory.getLogger(RecordStore.class);

  private static final String TEMP_SUFFIX = ".tmp";

  private final StorageLocations locations;
  private final RecordCodec codec = new RecordCodec();
  private final RecordLocks locks;
  private final Clock clock;

  public RecordStore(StorageLocations locations, StorageProperties properties, Clock clock) {
    this.locations = locations;
    this.locks = new RecordLocks(properties.lockTimeout());
    this.clock = clock;
  }

  /**
   * Acquires the per-record lock for {@code (location, id)}.
   *
   * @return the held lock; release it with try-with-resources
   * @throws StorageException if the location is unknown
   * @throws LockTimeoutException if the lock is not acquired within the configured wait
   */
  public ScopedLock lock(String location, String id) {
    locations.require(location);
    return locks.acquire(new RecordKey(location, id));
  }

  /**
   * Serializes the full record and atomically replaces its file.
   *
   * @param bookmark the record to persist; its storage location must be configured
   * @return the record as written
   * @throws StorageException on unknown location, serialization or I/O failure
   * @throws LockTimeoutException if the record lock is not acquired in time
   */
  public Bookmark write(Bookmark bookmark) {
    StorageLocation location = locations.require(bookmark.storageLocation());
    Path target = location.recordFile(bookmark.id());
    try (ScopedLock lock = lock(bookmark.storageLocation(), bookmark.id())) {
      byte[] content = codec.encode(bookmark);
      replaceAtomically(target, content);
    }
    log.debug("Wrote record {}", bookmark.key());
    return bookmark;
  }

  /**
   * Reads one record under its lock.
   *
   * @return empty if no file exists, otherwise the parsed or corrupt result
   * @throws StorageException if the location is unknown
   */
  public Optional<RecordReadResult> read(String location, String id) {
    Path file = locations.require(location).recordFile(id);
    try (ScopedLock lock = lock(location, id)) {
      return readFile(file);
    }
  }

  /**
   * Lazily reads every record file of a location. Each call lists the directory afresh. The
   * returned stream holds an open directory handle and must be closed.
   *
   * @param location the storage location name
   * @return one result per {@code *.yaml} file; unreadable files yield {@link
   *     RecordReadResult.Corrupt}
   * @throws StorageException if the location is unknown or its directory cannot be listed
   */
  public Stream<RecordReadResult> scan(String location) {
    Path dir = locations.require(location).bookmarksDir();
    DirectoryStream<Path> files;
    try {
      files = Files.newDirectoryStream(dir, RecordStore::isRecordFile);
    } catch (IOException e) {
      throw new StorageException("Failed to list records in " + dir, e);
    }
    return StreamSupport.stream(files.spliterator(), false)
        .map(this::readFile)
        .flatMap(Optional::stream)
        .onClose(() -> closeListing(files, dir));
  }

  /**
   * Deletes a record.
   *
   * <p>{@link DeleteMode#SOFT} sets {@code deleted}/{@code deleted_at} and rewrites the file; an
   * already deleted record is returned unchanged. {@link DeleteMode#HARD} removes the record file
   * and the record's screenshot; favicons are shared per domain and kept.
   *
   * @return the record as it was soft-deleted, or as it was before hard deletion; empty if no
   *     record file exists
   * @throws StorageException if a soft delete targets a corrupt file or I/O fails
   */
  public Optional<Bookmark> delete(String location, String id, DeleteMode mode) {
    StorageLocation storage = locations.require(location);
    Path file = storage.recordFile(id);
    try (ScopedLock lock = lock(location, id)) {
      Optional<RecordReadResult> current = readFile(file);
      if (current.isEmpty()) {
        return Optional.empty();
      }
      @Nullable Bookmark existing =
          current.get() instanceof RecordReadResult.Parsed parsed ? parsed.bookmark() : null;
      if (mode == DeleteMode.SOFT) {
        if (existing == null) {
          throw new StorageException(
              "Cannot soft-delete corrupt record "
                  + file
                  + ": "
                  + ((RecordReadResult.Corrupt) current.get()).reason());
        }
        if (existing.deleted()) {
          return Optional.of(existing);
        }
        return Optional.of(write(existing.markDeleted(clock.instant())));
      }
      hardDelete(storage, file, existing);
      return Optional.ofNullable(existing);
    }
  }

  private void hardDelete(StorageLocation storage, Path file, @Nullable Bookmark existing) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      throw new StorageException("Failed to delete record file " + file, e);
    }
    if (existing != null && existing.screenshotRef() != null) {
      Path screenshot = storage.root().resolve(existing.screenshotRef()).normalize();
      if (screenshot.startsWith(storage.screenshotsDir())) {
        try {
          Files.deleteIfExists(screenshot);
        } catch (IOException e) {
          log.warn(
              "Record {} deleted but screenshot {} could not be removed: {}",
              existing.key(),
              screenshot,
              e.getMessage());
        }
      }
    }
    log.warn("Hard deleted record file {}", file);
  }

  long heldLockCount() {
    return locks.size();
  }

  private Optional<RecordReadResult> readFile(Path file) {
    byte[] content;
    try {
      content = Files.readAllBytes(file);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      return Optional.of(new RecordReadResult.Corrupt(file, "Unreadable file: " + e.getMessage()));
    }
    return Optional.of(codec.decode(file, content));
  }

  private static void replaceAtomically(Path target, byte[] content) {
    Path temp =
        target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
    try {
      Files.write(temp, content);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteTemp(temp);
      throw new StorageException("Failed to write record file " + target, e);
    }
  }

  private static void deleteTemp(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
    }
  }

  private static boolean isRecordFile(Path path) {
    String name = path.getFileName().toString();
    return name.endsWith(StorageLocation.RECORD_SUFFIX)
        && !name.startsWith(".")
        && Files.isRegularFile(path);
  }

  private static void closeListing(DirectoryStream<Path> files, Path dir) {
    try {
      files.close();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close listing of " + dir, e);
    }
  }
}
