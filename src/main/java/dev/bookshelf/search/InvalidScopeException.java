package dev.bookshelf.search;

/** A recall request named a scope that is neither a keyword nor a configured location. */
public class InvalidScopeException extends IllegalArgumentException {

  private final String scope;

  public InvalidScopeException(String scope) {
    super("Unknown recall scope: " + scope);
    this.scope = scope;
  }

  public String scope() {
    return scope;
  }
}
