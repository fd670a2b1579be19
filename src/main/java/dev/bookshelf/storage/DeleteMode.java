package dev.bookshelf.storage;

/** How {@link RecordStore#delete} removes a record. */
public enum DeleteMode {
  /** Flag the record as deleted and rewrite it; reversible. */
  SOFT,
  /** Remove the record file and its own assets; irreversible. */
  HARD
}
