package dev.bookshelf.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for recall ranking.
 *
 * <p>Properties are bound from {@code bookshelf.recall.*} in application.yml.
 *
 * <ul>
 *   <li>{@code semantic-enabled} - whether queries are embedded at all (default true)
 *   <li>{@code semantic-weight} / {@code lexical-weight} - hybrid merge weights (default 0.55 /
 *       0.45, each in [0, 1], sum positive)
 *   <li>{@code default-limit} - hits returned when the request has no limit (default 20)
 *   <li>{@code max-limit} - upper clamp for requested limits (default 50, bounded [1, 500])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "bookshelf.recall")
public class RecallProperties {

  private boolean semanticEnabled = true;
  private double semanticWeight = 0.55;
  private double lexicalWeight = 0.45;
  private int defaultLimit = 20;
  private int maxLimit = 50;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (semanticWeight < 0.0 || semanticWeight > 1.0) {
      throw new IllegalStateException(
          "bookshelf.recall.semantic-weight must be in [0.0, 1.0], got: " + semanticWeight);
    }
    if (lexicalWeight < 0.0 || lexicalWeight > 1.0) {
      throw new IllegalStateException(
          "bookshelf.recall.lexical-weight must be in [0.0, 1.0], got: " + lexicalWeight);
    }
    if (semanticWeight + lexicalWeight <= 0.0) {
      throw new IllegalStateException("bookshelf.recall weights must not both be zero");
    }
    if (maxLimit < 1 || maxLimit > 500) {
      throw new IllegalStateException(
          "bookshelf.recall.max-limit must be in [1, 500], got: " + maxLimit);
    }
    if (defaultLimit < 1 || defaultLimit > maxLimit) {
      throw new IllegalStateException(
          "bookshelf.recall.default-limit must be in [1, max-limit], got: " + defaultLimit);
    }
  }

  public boolean isSemanticEnabled() {
    return semanticEnabled;
  }

  public void setSemanticEnabled(boolean semanticEnabled) {
    this.semanticEnabled = semanticEnabled;
  }

  public double getSemanticWeight() {
    return semanticWeight;
  }

  public void setSemanticWeight(double semanticWeight) {
    this.semanticWeight = semanticWeight;
  }

  public double getLexicalWeight() {
    return lexicalWeight;
  }

  public void setLexicalWeight(double lexicalWeight) {
    this.lexicalWeight = lexicalWeight;
  }

  public int getDefaultLimit() {
    return defaultLimit;
  }

  public void setDefaultLimit(int defaultLimit) {
    this.defaultLimit = defaultLimit;
  }

  public int getMaxLimit() {
    return maxLimit;
  }

  public void setMaxLimit(int maxLimit) {
    this.maxLimit = maxLimit;
  }
}
