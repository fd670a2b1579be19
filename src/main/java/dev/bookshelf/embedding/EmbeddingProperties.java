package dev.bookshelf.embedding;

import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Embedding backend configuration bound from {@code bookshelf.embedding.*}.
 *
 * <ul>
 *   <li>{@code provider} - {@code openai}, {@code onnx} (in-process bge-small-en-v1.5) or {@code
 *       none}; default {@code openai}
 *   <li>{@code model-name} - defaults to {@code text-embedding-3-small} for OpenAI
 *   <li>{@code timeout} - bound on every embedding call (default 1200ms, [100ms, 10s])
 *   <li>{@code cache-max-entries} - vectors kept in memory (default 10000)
 *   <li>{@code batch-size} - texts per batch when filling record vectors (default 32)
 * </ul>
 */
@ConfigurationProperties(prefix = "bookshelf.embedding")
public record EmbeddingProperties(
    @Nullable Provider provider,
    @Nullable String modelName,
    @Nullable String apiKey,
    @Nullable String baseUrl,
    @Nullable Duration timeout,
    @Nullable Integer cacheMaxEntries,
    @Nullable Integer batchSize) {

  static final Duration MIN_TIMEOUT = Duration.ofMillis(100);
  static final Duration MAX_TIMEOUT = Duration.ofSeconds(10);

  public EmbeddingProperties {
    provider = provider == null ? Provider.OPENAI : provider;
    if (modelName == null || modelName.isBlank()) {
      modelName = provider.defaultModelName();
    }
    timeout = timeout == null ? Duration.ofMillis(1200) : timeout;
    if (timeout.compareTo(MIN_TIMEOUT) < 0 || timeout.compareTo(MAX_TIMEOUT) > 0) {
      throw new IllegalStateException(
          "bookshelf.embedding.timeout must be in [100ms, 10s], got: " + timeout);
    }
    cacheMaxEntries = cacheMaxEntries == null ? 10_000 : cacheMaxEntries;
    if (cacheMaxEntries < 1) {
      throw new IllegalStateException(
          "bookshelf.embedding.cache-max-entries must be positive, got: " + cacheMaxEntries);
    }
    batchSize = batchSize == null ? 32 : batchSize;
    if (batchSize < 1 || batchSize > 256) {
      throw new IllegalStateException(
          "bookshelf.embedding.batch-size must be in [1, 256], got: " + batchSize);
    }
  }

  /** Defaults for the given backend. */
  public static EmbeddingProperties defaults(Provider provider) {
    return new EmbeddingProperties(provider, null, null, null, null, null, null);
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }

  /** Supported embedding backends. */
  public enum Provider {
    OPENAI("text-embedding-3-small"),
    ONNX("bge-small-en-v1.5-q"),
    NONE("none");

    private final String defaultModelName;

    Provider(String defaultModelName) {
      this.defaultModelName = defaultModelName;
    }

    String defaultModelName() {
      return defaultModelName;
    }
  }
}
