package dev.bookshelf.search;

/** A recall request was rejected before any work: blank text or a non-positive limit. */
public class InvalidQueryException extends IllegalArgumentException {

  public InvalidQueryException(String message) {
    super(message);
  }
}
