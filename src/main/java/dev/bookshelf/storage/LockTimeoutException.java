package dev.bookshelf.storage;

import dev.bookshelf.record.RecordKey;
import java.time.Duration;

/**
 * A per-record lock could not be acquired within the configured wait. The operation performed no
 * changes and may be retried.
 */
public class LockTimeoutException extends RuntimeException {

  private final RecordKey key;

  public LockTimeoutException(RecordKey key, Duration waited) {
    super("Could not acquire lock on " + key + " after " + waited.toMillis() + " ms");
    this.key = key;
  }

  public LockTimeoutException(RecordKey key, Duration waited, InterruptedException cause) {
    super("Interrupted while waiting " + waited.toMillis() + " ms for lock on " + key, cause);
    this.key = key;
  }

  public RecordKey key() {
    return key;
  }
}
