package dev.bookshelf.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;

/**
 * Bounded, thread-safe vector cache keyed by a SHA-256 of the model name and the exact text that
 * was embedded. Editing any embedded field of a record changes its text and therefore its key, so
 * stale vectors are never served.
 *
 * <p>Callers may {@link #bind} an owner (a record key) to the key of its current text; rebinding
 * to a different key evicts the previous vector. Concurrent fills of the same key converge on the
 * last written vector.
 */
public class EmbeddingCache {

  private final Cache<String, float[]> vectors;
  private final ConcurrentHashMap<String, String> keysByOwner = new ConcurrentHashMap<>();

  public EmbeddingCache(int maxEntries) {
    this.vectors = Caffeine.newBuilder().maximumSize(maxEntries).build();
  }

  /**
   * Computes the cache key for a text embedded by a model.
   *
   * @param modelName the embedding model identifier
   * @param text the exact embedded text
   * @return lowercase hex SHA-256 of {@code modelName + '\0' + text}
   */
  public static String keyFor(String modelName, String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      digest.update(modelName.getBytes(StandardCharsets.UTF_8));
      digest.update((byte) 0);
      digest.update(text.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest.digest());
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  public float @Nullable [] get(String key) {
    return vectors.getIfPresent(key);
  }

  public void put(String key, float[] vector) {
    vectors.put(key, vector);
  }

  /**
   * Records that {@code owner} is now described by {@code key}, evicting the vector of the text it
   * was previously bound to.
   *
   * @param owner stable identity of the embedded item
   * @param key cache key of the item's current text
   */
  public void bind(String owner, String key) {
    String previous = keysByOwner.put(owner, key);
    if (previous != null && !previous.equals(key)) {
      vectors.invalidate(previous);
    }
  }

  /** Forgets an owner and evicts the vector it was bound to. */
  public void unbind(String owner) {
    String previous = keysByOwner.remove(owner);
    if (previous != null) {
      vectors.invalidate(previous);
    }
  }

  public long size() {
    vectors.cleanUp();
    return vectors.estimatedSize();
  }
}
