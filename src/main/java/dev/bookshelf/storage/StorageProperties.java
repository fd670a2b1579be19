package dev.bookshelf.storage;

import java.time.Duration;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Storage configuration bound from {@code bookshelf.storage.*}.
 *
 * @param lockTimeout maximum wait for a per-record lock (default 5s)
 * @param locations the configured storage locations
 */
@ConfigurationProperties(prefix = "bookshelf.storage")
public record StorageProperties(
    @Nullable Duration lockTimeout, @Nullable List<Location> locations) {

  static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

  public StorageProperties {
    lockTimeout = lockTimeout == null ? DEFAULT_LOCK_TIMEOUT : lockTimeout;
    if (lockTimeout.isNegative() || lockTimeout.isZero()) {
      throw new IllegalStateException(
          "bookshelf.storage.lock-timeout must be positive, got: " + lockTimeout);
    }
    locations = locations == null ? List.of() : List.copyOf(locations);
  }

  /**
   * One configured storage location.
   *
   * @param name display name, letters, digits, dashes and underscores only
   * @param path root directory of the location
   * @param current whether this is the active location for {@code current} scoped recall
   */
  public record Location(String name, String path, boolean current) {}
}
