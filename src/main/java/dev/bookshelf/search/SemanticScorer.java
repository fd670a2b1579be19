package dev.bookshelf.search;

import dev.bookshelf.embedding.EmbeddingCache;
import dev.bookshelf.embedding.EmbeddingProvider;
import dev.bookshelf.record.Bookmark;
import dev.bookshelf.record.RecordKey;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cosine similarity between a query vector and the vectors of candidate records.
 *
 * <p>Record vectors come from the {@link EmbeddingProvider} cache and are embedded lazily, in
 * batches, when missing. A record whose embedding fails is left out of the returned map; it is
 * still ranked lexically by the caller.
 */
@Component
public class SemanticScorer {

  private static final Logger log = LoggerFactory.getLogger(SemanticScorer.class);

  private final EmbeddingProvider provider;
  private final EmbeddingCache cache;

  public SemanticScorer(EmbeddingProvider provider, EmbeddingCache cache) {
    this.provider = provider;
    this.cache = cache;
  }

  /** Whether an embedding backend is configured. */
  public boolean isAvailable() {
    return provider.isConfigured();
  }

  /**
   * Embeds the query text.
   *
   * @throws dev.bookshelf.embedding.EmbeddingUnavailableException if no vector can be produced
   */
  public float[] embedQuery(String query) {
    return provider.embed(query);
  }

  /**
   * Scores candidates against a query vector.
   *
   * @param queryVector the embedded query
   * @param candidates records to score
   * @return cosine similarity per record, for every record that has a vector
   */
  public Map<RecordKey, Double> score(float[] queryVector, List<Bookmark> candidates) {
    Map<RecordKey, String> texts = new HashMap<>();
    List<String> batch = new ArrayList<>();
    for (Bookmark bookmark : candidates) {
      String text = recordText(bookmark);
      texts.put(bookmark.key(), text);
      batch.add(text);
      cache.bind(bookmark.key().toString(), EmbeddingCache.keyFor(provider.modelName(), text));
    }

    Map<String, float[]> vectors = provider.embedAll(batch);
    Map<RecordKey, Double> scores = new HashMap<>();
    for (Bookmark bookmark : candidates) {
      float[] vector = vectors.get(texts.get(bookmark.key()));
      if (vector != null) {
        scores.put(bookmark.key(), cosine(queryVector, vector));
      }
    }
    if (scores.size() < candidates.size()) {
      log.debug(
          "{} of {} candidates have no vector",
          candidates.size() - scores.size(),
          candidates.size());
    }
    return scores;
  }

  /**
   * Cosine similarity of two vectors.
   *
   * @return a value in [-1, 1]; 0.0 when either vector has zero magnitude or the dimensions differ
   */
  public static double cosine(float[] a, float[] b) {
    if (a.length == 0 || a.length != b.length) {
      return 0.0;
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
    return Math.max(-1.0, Math.min(1.0, cosine));
  }

  /** The text embedded for a record: title, URL, description, keywords and tags, one per line. */
  static String recordText(Bookmark bookmark) {
    return String.join(
        "\n",
        bookmark.title(),
        bookmark.url(),
        bookmark.description() == null ? "" : bookmark.description(),
        String.join(" ", bookmark.keywords()),
        String.join(" ", bookmark.tags()));
  }
}
