package dev.bookshelf.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Registry of the configured storage locations, validated once at startup.
 *
 * <p>Names must be unique and at most one location may be flagged current; when none is, the first
 * configured location is treated as current. Each location's directory layout is created if
 * missing.
 */
@Component
public class StorageLocations {

  private static final Logger log = LoggerFactory.getLogger(StorageLocations.class);

  private final Map<String, StorageLocation> byName;
  private final List<String> orderedNames;

  @Autowired
  public StorageLocations(StorageProperties properties) {
    this(toLocations(properties.locations()));
  }

  public StorageLocations(Collection<StorageLocation> locations) {
    Map<String, StorageLocation> map = new LinkedHashMap<>();
    long currentCount = locations.stream().filter(StorageLocation::current).count();
    if (currentCount > 1) {
      throw new IllegalStateException("At most one storage location may be current");
    }
    for (StorageLocation location : locations) {
      if (map.putIfAbsent(location.name(), location) != null) {
        throw new IllegalStateException("Duplicate storage location name: " + location.name());
      }
      ensureLayout(location);
    }
    this.byName = Map.copyOf(map);
    this.orderedNames = List.copyOf(map.keySet());
    log.info("Configured {} storage location(s): {}", map.size(), orderedNames);
  }

  /** Convenience factory for tests and tooling. */
  public static StorageLocations of(StorageLocation... locations) {
    return new StorageLocations(List.of(locations));
  }

  public Optional<StorageLocation> find(String name) {
    return Optional.ofNullable(byName.get(name));
  }

  /**
   * Looks up a location by name.
   *
   * @param name the location name
   * @return the location
   * @throws StorageException if no such location is configured
   */
  public StorageLocation require(String name) {
    StorageLocation location = byName.get(name);
    if (location == null) {
      throw new StorageException("Storage not found: " + name);
    }
    return location;
  }

  public boolean contains(String name) {
    return byName.containsKey(name);
  }

  /** Location names in configuration order. */
  public List<String> names() {
    return orderedNames;
  }

  /** The location flagged current, or the first configured one. */
  public Optional<StorageLocation> current() {
    Optional<StorageLocation> flagged =
        orderedNames.stream().map(byName::get).filter(StorageLocation::current).findFirst();
    if (flagged.isPresent()) {
      return flagged;
    }
    return orderedNames.stream().findFirst().map(byName::get);
  }

  private static List<StorageLocation> toLocations(List<StorageProperties.Location> configured) {
    List<StorageLocation> locations = new ArrayList<>(configured.size());
    for (StorageProperties.Location location : configured) {
      if (location.path() == null || location.path().isBlank()) {
        throw new IllegalStateException("Storage path cannot be empty for " + location.name());
      }
      locations.add(
          new StorageLocation(location.name(), Path.of(location.path()), location.current()));
    }
    return locations;
  }

  private static void ensureLayout(StorageLocation location) {
    try {
      Files.createDirectories(location.bookmarksDir());
      Files.createDirectories(location.faviconsDir());
      Files.createDirectories(location.screenshotsDir());
    } catch (IOException e) {
      throw new StorageException(
          "Failed to create storage structure for " + location.name() + " at " + location.root(),
          e);
    }
    if (!Files.isWritable(location.bookmarksDir())) {
      throw new StorageException(
          "Cannot access storage "
              + location.name()
              + ": "
              + location.bookmarksDir()
              + " is not writable");
    }
  }
}
