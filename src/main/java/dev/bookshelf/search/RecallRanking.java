package dev.bookshelf.search;

import dev.bookshelf.record.Bookmark;
import java.util.Comparator;

/** Total order of recall hits: combined score descending, then newest first, then id. */
final class RecallRanking {

  /** Ordering between records of equal score. */
  static final Comparator<Bookmark> TIE_BREAK =
      Comparator.comparing(Bookmark::createdAt).reversed().thenComparing(Bookmark::id);

  static final Comparator<RecallHit> HITS =
      Comparator.comparingDouble(RecallHit::score)
          .reversed()
          .thenComparing(RecallHit::bookmark, TIE_BREAK);

  private RecallRanking() {}
}
