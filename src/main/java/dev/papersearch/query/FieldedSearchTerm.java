package dev.papersearch.query;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One fielded clause of an advanced query.
 *
 * @param operator how this clause joins the clauses before it; null only for the leading clause
 * @param field the field to match against
 * @param term the text to match
 */
public record FieldedSearchTerm(@Nullable Operator operator, SearchField field, String term) {

  public FieldedSearchTerm {
    Objects.requireNonNull(field, "field must not be null");
    Objects.requireNonNull(term, "term must not be null");
  }

  /** Creates a leading clause, which has no operator. */
  public static FieldedSearchTerm leading(SearchField field, String term) {
    return new FieldedSearchTerm(null, field, term);
  }

  @Override
  public String toString() {
    return (operator == null ? "" : operator + " ") + field.value() + ":" + term;
  }
}
