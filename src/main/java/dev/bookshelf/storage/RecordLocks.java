package dev.bookshelf.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.bookshelf.record.RecordKey;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process mutexes keyed by {@link RecordKey}, acquired with a bounded wait.
 *
 * <p>Locks are reentrant so a holder may call store operations that lock the same record again.
 * Values are weakly held: a lock stays registered while any {@link ScopedLock} or waiting thread
 * references it, and is collected once nobody does.
 */
final class RecordLocks {

  private final Cache<RecordKey, ReentrantLock> locks = Caffeine.newBuilder().weakValues().build();
  private final Duration timeout;

  RecordLocks(Duration timeout) {
    this.timeout = timeout;
  }

  ScopedLock acquire(RecordKey key) {
    ReentrantLock lock = locks.get(key, k -> new ReentrantLock());
    boolean acquired;
    try {
      acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LockTimeoutException(key, timeout, e);
    }
    if (!acquired) {
      throw new LockTimeoutException(key, timeout);
    }
    return new ScopedLock(key, lock);
  }

  long size() {
    locks.cleanUp();
    return locks.estimatedSize();
  }
}
