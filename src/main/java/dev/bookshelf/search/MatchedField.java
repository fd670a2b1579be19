package dev.bookshelf.search;

import com.fasterxml.jackson.annotation.JsonValue;

/** Record fields the lexical scorer inspects, with their fixed weights. */
public enum MatchedField {
  TITLE("title", 1.0),
  KEYWORDS("keywords", 0.8),
  TAGS("tags", 0.6),
  DESCRIPTION("description", 0.5),
  URL("url", 0.3);

  /** Sum of all field weights: the highest lexical score a record can reach. */
  public static final double MAX_SCORE = 3.2;

  private final String jsonName;
  private final double weight;

  MatchedField(String jsonName, double weight) {
    this.jsonName = jsonName;
    this.weight = weight;
  }

  public double weight() {
    return weight;
  }

  @JsonValue
  public String jsonName() {
    return jsonName;
  }
}
