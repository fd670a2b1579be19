package dev.bookshelf.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EmbeddingProvider} over a LangChain4j {@link EmbeddingModel}, with an {@link
 * EmbeddingCache} in front and a hard timeout on every backend call.
 *
 * <p>Backend calls run on a dedicated executor and are abandoned (cancelled) once the timeout
 * elapses. A missing model means embeddings are not configured. Batch filling stops at the first
 * failed batch so a dead backend costs at most one timeout per recall.
 */
public class CachingEmbeddingProvider implements EmbeddingProvider {

  private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingProvider.class);

  private final @Nullable EmbeddingModel model;
  private final String modelName;
  private final EmbeddingCache cache;
  private final Executor executor;
  private final Duration timeout;
  private final int batchSize;

  public CachingEmbeddingProvider(
      @Nullable EmbeddingModel model,
      String modelName,
      EmbeddingCache cache,
      Executor executor,
      Duration timeout,
      int batchSize) {
    this.model = model;
    this.modelName = modelName;
    this.cache = cache;
    this.executor = executor;
    this.timeout = timeout;
    this.batchSize = batchSize;
  }

  @Override
  public boolean isConfigured() {
    return model != null;
  }

  @Override
  public String modelName() {
    return modelName;
  }

  @Override
  public float[] embed(String text) {
    EmbeddingModel backend = requireModel();
    String key = EmbeddingCache.keyFor(modelName, text);
    float[] cached = cache.get(key);
    if (cached != null) {
      return cached;
    }
    float[] vector = bounded(() -> backend.embed(text).content().vector());
    cache.put(key, vector);
    return vector;
  }

  @Override
  public Map<String, float[]> embedAll(List<String> texts) {
    Map<String, float[]> vectors = new HashMap<>();
    if (texts.isEmpty()) {
      return vectors;
    }
    EmbeddingModel backend = requireModel();

    Set<String> misses = new LinkedHashSet<>();
    for (String text : texts) {
      float[] cached = cache.get(EmbeddingCache.keyFor(modelName, text));
      if (cached != null) {
        vectors.put(text, cached);
      } else {
        misses.add(text);
      }
    }

    List<String> pending = new ArrayList<>(misses);
    for (int start = 0; start < pending.size(); start += batchSize) {
      List<String> batch = pending.subList(start, Math.min(start + batchSize, pending.size()));
      List<TextSegment> segments = batch.stream().map(TextSegment::from).toList();
      @Nullable List<Embedding> embeddings;
      try {
        embeddings = bounded(() -> backend.embedAll(segments).content());
      } catch (EmbeddingUnavailableException e) {
        log.warn(
            "Embedding batch failed ({}), {} of {} texts left without vectors: {}",
            e.reason(),
            pending.size() - start,
            texts.size(),
            e.getMessage());
        break;
      }
      if (embeddings == null || embeddings.size() != batch.size()) {
        log.warn(
            "Embedding backend returned {} vectors for {} texts, batch skipped",
            embeddings == null ? 0 : embeddings.size(),
            batch.size());
        continue;
      }
      for (int i = 0; i < batch.size(); i++) {
        float[] vector = embeddings.get(i).vector();
        cache.put(EmbeddingCache.keyFor(modelName, batch.get(i)), vector);
        vectors.put(batch.get(i), vector);
      }
    }
    if (!misses.isEmpty()) {
      long filled = misses.stream().filter(vectors::containsKey).count();
      log.debug("Embedded {} of {} uncached texts", filled, misses.size());
    }
    return vectors;
  }

  private EmbeddingModel requireModel() {
    if (model == null) {
      throw new EmbeddingUnavailableException(
          EmbeddingUnavailableException.Reason.NOT_CONFIGURED, "No embedding backend configured");
    }
    return model;
  }

  private <T> T bounded(Supplier<T> call) {
    CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new EmbeddingUnavailableException(
          EmbeddingUnavailableException.Reason.TIMEOUT,
          "Embedding call exceeded " + timeout.toMillis() + "ms",
          e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new EmbeddingUnavailableException(
          EmbeddingUnavailableException.Reason.INTERRUPTED, "Interrupted waiting for embedding", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new EmbeddingUnavailableException(
          EmbeddingUnavailableException.Reason.BACKEND_ERROR,
          "Embedding backend failed: " + cause.getMessage(),
          cause);
    }
  }
}
