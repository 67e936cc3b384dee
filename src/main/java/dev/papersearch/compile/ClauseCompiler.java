package dev.papersearch.compile;

import dev.papersearch.error.QueryError;
import dev.papersearch.query.FieldedSearchTerm;
import dev.papersearch.query.SearchField;
import java.util.List;

/**
 * Compiles a single fielded clause into a match primitive.
 *
 * <p>A field with one index representation compiles to a bare {@link CompiledQuery.Match}. A field
 * with several representations compiles to a disjunction of matches, one per representation, all
 * using the same text.
 */
public final class ClauseCompiler {

  private ClauseCompiler() {}

  /**
   * @throws QueryError if the clause text is blank, since an empty clause would match everything
   */
  public static CompiledQuery compile(FieldedSearchTerm term) {
    return compile(term.field(), term.term());
  }

  /**
   * Compiles free text against one field.
   *
   * @throws QueryError if {@code text} is blank
   */
  public static CompiledQuery compile(SearchField field, String text) {
    if (text == null || text.isBlank()) {
      throw new QueryError("Search term for field '" + field.value() + "' must not be empty");
    }
    String trimmed = text.strip();
    if (!field.hasMultipleRepresentations()) {
      return new CompiledQuery.Match(field.indexFields().get(0), trimmed);
    }
    List<CompiledQuery> matches =
        field.indexFields().stream()
            .<CompiledQuery>map(indexField -> new CompiledQuery.Match(indexField, trimmed))
            .toList();
    return CompiledQuery.Bool.should(matches);
  }

  /**
   * Compiles free text against every field in {@code fields}: a disjunction of each field's
   * compiled clause, or the bare clause when only one field is given.
   */
  public static CompiledQuery compileAcross(List<SearchField> fields, String text) {
    if (fields.isEmpty()) {
      throw new IllegalArgumentException("At least one field is required");
    }
    if (fields.size() == 1) {
      return compile(fields.get(0), text);
    }
    List<CompiledQuery> perField = fields.stream().map(field -> compile(field, text)).toList();
    return CompiledQuery.Bool.should(perField);
  }
}
