package dev.bookshelf.storage;

import dev.bookshelf.record.RecordKey;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A held per-record lock, released by {@link #close()}. Intended for try-with-resources so the
 * lock is released on every exit path.
 *
 * <pre>{@code
 * try (ScopedLock lock = recordStore.lock("work", id)) {
 *   // read, modify, write, update index
 * }
 * }</pre>
 */
public final class ScopedLock implements AutoCloseable {

  private final RecordKey key;
  private final ReentrantLock lock;
  private boolean released;

  ScopedLock(RecordKey key, ReentrantLock lock) {
    this.key = key;
    this.lock = lock;
  }

  public RecordKey key() {
    return key;
  }

  /** Releases the lock; further calls are no-ops. */
  @Override
  public void close() {
    if (!released) {
      released = true;
      lock.unlock();
    }
  }
}
