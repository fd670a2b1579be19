package dev.bookshelf.search;

import org.jspecify.annotations.Nullable;

/**
 * Parameters for a recall query. Validation happens in {@link RecallService#recall} so that a
 * malformed request is rejected with {@link InvalidQueryException} or {@link
 * InvalidScopeException}.
 *
 * @param query natural-language query text
 * @param scope {@code all}, {@code current} or a storage location name; null means {@code all}
 * @param limit maximum hits; null means the configured default, larger values are clamped
 * @param includeDeleted whether soft-deleted records are candidates
 * @param folder optional exact folder path filter
 */
public record RecallRequest(
    String query,
    @Nullable String scope,
    @Nullable Integer limit,
    boolean includeDeleted,
    @Nullable String folder) {

  /** Scope covering every configured location. */
  public static final String SCOPE_ALL = "all";

  /** Scope covering only the location flagged as current. */
  public static final String SCOPE_CURRENT = "current";

  /** Convenience constructor: all locations, default limit, live records only. */
  public RecallRequest(String query) {
    this(query, SCOPE_ALL, null, false, null);
  }

  /** Convenience constructor with scope and limit, live records only. */
  public RecallRequest(String query, @Nullable String scope, @Nullable Integer limit) {
    this(query, scope, limit, false, null);
  }
}
