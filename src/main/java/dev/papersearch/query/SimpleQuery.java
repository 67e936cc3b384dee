package dev.papersearch.query;

import org.jspecify.annotations.Nullable;

/**
 * Single free-text query.
 *
 * @param term the text to search for
 * @param field the field to search, or null for every field in {@link
 *     SearchField#ALL_SEARCH_FIELDS}
 * @param page requested page
 * @param order optional sort key
 */
public record SimpleQuery(
    String term, @Nullable SearchField field, Page page, @Nullable String order)
    implements SearchQuery {

  public SimpleQuery {
    if (term == null) {
      throw new IllegalArgumentException("term must not be null");
    }
    if (page == null) {
      page = Page.first();
    }
    if (order != null && order.isBlank()) {
      order = null;
    }
  }

  public SimpleQuery(String term) {
    this(term, null, Page.first(), null);
  }

  public SimpleQuery(String term, @Nullable SearchField field) {
    this(term, field, Page.first(), null);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitSimple(this);
  }
}
