package dev.bookshelf.search;

import com.fasterxml.jackson.annotation.JsonValue;

/** Why a recall ran in {@link RecallMode#LEXICAL} mode. */
public enum FallbackReason {
  EMBEDDING_UNAVAILABLE("embedding_unavailable"),
  SEMANTIC_SEARCH_DISABLED("semantic_search_disabled");

  private final String value;

  FallbackReason(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
