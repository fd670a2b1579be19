package dev.bookshelf.search;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a recall result was scored. */
public enum RecallMode {
  HYBRID("hybrid"),
  LEXICAL("lexical");

  private final String value;

  RecallMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
