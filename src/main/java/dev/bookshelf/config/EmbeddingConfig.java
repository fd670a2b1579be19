package dev.bookshelf.config;

import dev.bookshelf.embedding.CachingEmbeddingProvider;
import dev.bookshelf.embedding.EmbeddingCache;
import dev.bookshelf.embedding.EmbeddingProperties;
import dev.bookshelf.embedding.EmbeddingProvider;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding backend, its vector cache and the executor that bounds every call.
 *
 * <p>The backend is selected by {@code bookshelf.embedding.provider}:
 *
 * <ul>
 *   <li>{@code openai} (default) - LangChain4j {@link OpenAiEmbeddingModel}; only created when an
 *       API key is configured
 *   <li>{@code onnx} - the in-process bge-small-en-v1.5 quantized model (384 dimensions)
 *   <li>{@code none} - no model bean; recall runs lexically
 * </ul>
 *
 * <p>The OpenAI client is built with {@code maxRetries(0)}: the provider makes one bounded attempt
 * per call and the recall path falls back to lexical scoring instead of retrying.
 *
 * @see dev.bookshelf.search.SemanticScorer
 */
@Configuration
public class EmbeddingConfig {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

  @Bean
  @ConditionalOnExpression(
      "'${bookshelf.embedding.provider:openai}'.equalsIgnoreCase('openai')"
          + " and !'${bookshelf.embedding.api-key:}'.isBlank()")
  public EmbeddingModel openAiEmbeddingModel(EmbeddingProperties properties) {
    var builder =
        OpenAiEmbeddingModel.builder()
            .apiKey(properties.apiKey())
            .modelName(properties.modelName())
            .timeout(properties.timeout())
            .maxRetries(0);
    if (properties.baseUrl() != null && !properties.baseUrl().isBlank()) {
      builder.baseUrl(properties.baseUrl());
    }
    return builder.build();
  }

  /**
   * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  @ConditionalOnProperty(prefix = "bookshelf.embedding", name = "provider", havingValue = "onnx")
  public EmbeddingModel onnxEmbeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  @Bean
  public EmbeddingCache embeddingCache(EmbeddingProperties properties) {
    return new EmbeddingCache(properties.cacheMaxEntries());
  }

  /** Daemon threads running embedding calls, so a hung backend call never blocks shutdown. */
  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService embeddingExecutor() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newCachedThreadPool(
        runnable -> {
          Thread thread = new Thread(runnable, "embedding-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  @Bean
  public EmbeddingProvider embeddingProvider(
      ObjectProvider<EmbeddingModel> model,
      EmbeddingProperties properties,
      EmbeddingCache embeddingCache,
      ExecutorService embeddingExecutor) {
    EmbeddingModel backend = model.getIfAvailable();
    if (backend == null
        && properties.provider() == EmbeddingProperties.Provider.OPENAI
        && !properties.hasApiKey()) {
      log.warn("No OpenAI API key configured; recall runs in lexical mode");
    } else if (backend == null) {
      log.info(
          "No embedding backend for provider '{}'; recall runs in lexical mode",
          properties.provider().name().toLowerCase(Locale.ROOT));
    } else {
      log.info(
          "Embedding backend {} (timeout {}ms, batch size {})",
          properties.modelName(),
          properties.timeout().toMillis(),
          properties.batchSize());
    }
    return new CachingEmbeddingProvider(
        backend,
        properties.modelName(),
        embeddingCache,
        embeddingExecutor,
        properties.timeout(),
        properties.batchSize());
  }
}
