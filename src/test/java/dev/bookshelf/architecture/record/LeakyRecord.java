package dev.bookshelf.architecture.record;

import dev.bookshelf.storage.StorageLocations;

/** A record-layer class that reaches into storage, for checking that the layering rule fires. */
public class LeakyRecord {

  private final StorageLocations locations;

  public LeakyRecord(StorageLocations locations) {
    this.locations = locations;
  }

  public StorageLocations locations() {
    return locations;
  }
}
