package dev.bookshelf.search;

import org.jspecify.annotations.Nullable;

/**
 * Components of a combined score.
 *
 * @param lexical lexical score scaled to [0, 1]
 * @param semantic cosine similarity to the query; null when the record was not scored semantically
 */
public record ScoreBreakdown(double lexical, @Nullable Double semantic) {}
