package dev.bookshelf.storage;

import dev.bookshelf.record.Bookmark;
import java.nio.file.Path;

/**
 * Outcome of reading one record file: either a parsed {@link Bookmark} or a corrupt file with the
 * reason it could not be parsed. Consumers must handle both variants; parse failures are never
 * thrown past the store.
 */
public sealed interface RecordReadResult permits RecordReadResult.Parsed, RecordReadResult.Corrupt {

  /** The file the result was read from. */
  Path path();

  /**
   * A successfully parsed record.
   *
   * @param path the record file
   * @param bookmark the parsed record
   */
  record Parsed(Path path, Bookmark bookmark) implements RecordReadResult {}

  /**
   * A record file that does not parse or lacks required fields.
   *
   * @param path the record file
   * @param reason human-readable parse failure
   */
  record Corrupt(Path path, String reason) implements RecordReadResult {}
}
