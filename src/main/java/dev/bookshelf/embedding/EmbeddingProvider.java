package dev.bookshelf.embedding;

import java.util.List;
import java.util.Map;

/**
 * Capability boundary around the external embedding service: text in, fixed-length vector out.
 *
 * <p>Implementations make a single bounded attempt per call; retry policy, if any, belongs to the
 * caller.
 */
public interface EmbeddingProvider {

  /** Whether a backend is configured at all. When false every call fails with NOT_CONFIGURED. */
  boolean isConfigured();

  /** Identifier of the model producing the vectors; part of every cache key. */
  String modelName();

  /**
   * Embeds one text.
   *
   * @param text the exact text to embed
   * @return the vector
   * @throws EmbeddingUnavailableException on backend failure, timeout or missing configuration
   */
  float[] embed(String text);

  /**
   * Embeds many texts, batching cache misses. Texts whose batch failed are absent from the result;
   * the failure is logged, not thrown.
   *
   * @param texts texts to embed
   * @return vectors keyed by text, for every text that could be embedded
   */
  Map<String, float[]> embedAll(List<String> texts);
}
