package dev.bookshelf.record;

/**
 * Identity of a bookmark across the whole collection: ids are unique within a storage location.
 *
 * @param storageLocation the owning storage location name
 * @param id the bookmark id
 */
public record RecordKey(String storageLocation, String id) {

  @Override
  public String toString() {
    return storageLocation + "/" + id;
  }
}
