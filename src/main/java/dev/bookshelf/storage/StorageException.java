package dev.bookshelf.storage;

/** Raised when the record store cannot complete an I/O operation or a location is unknown. */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
