package dev.papersearch.query;

import org.jspecify.annotations.Nullable;

/**
 * A search request ready for compilation: either a {@link SimpleQuery} or an {@link
 * AdvancedQuery}.
 *
 * <p>Callers dispatch on the variant through {@link #accept(Visitor)}, so adding a variant forces
 * every compiler stage to handle it.
 */
public sealed interface SearchQuery permits SimpleQuery, AdvancedQuery {

  Page page();

  /**
   * Sort key, or null for relevance order. A leading {@code -} requests descending order, e.g.
   * {@code -submitted_date}.
   */
  @Nullable String order();

  <R> R accept(Visitor<R> visitor);

  /** Exhaustive dispatch over the query variants. */
  interface Visitor<R> {

    R visitSimple(SimpleQuery query);

    R visitAdvanced(AdvancedQuery query);
  }
}
