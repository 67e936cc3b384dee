package dev.papersearch.compile;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Backend-agnostic boolean query tree, rendered to the backend DSL by {@link QueryRenderer}.
 *
 * <p>{@link Bool} carries the combinator semantics: every {@code must} clause has to match, at
 * least {@code minimumShouldMatch} of the {@code should} clauses have to match, and no {@code
 * mustNot} clause may match.
 */
public sealed interface CompiledQuery
    permits CompiledQuery.Match,
        CompiledQuery.Bool,
        CompiledQuery.Range,
        CompiledQuery.Nested,
        CompiledQuery.MatchAll {

  /** Full-text match of {@code text} against one index field. */
  record Match(String field, String text) implements CompiledQuery {}

  record Bool(
      List<CompiledQuery> must,
      List<CompiledQuery> should,
      List<CompiledQuery> mustNot,
      @Nullable Integer minimumShouldMatch)
      implements CompiledQuery {

    public Bool {
      must = List.copyOf(must);
      should = List.copyOf(should);
      mustNot = List.copyOf(mustNot);
    }

    /** Conjunction of all clauses. */
    public static Bool must(List<CompiledQuery> clauses) {
      return new Bool(clauses, List.of(), List.of(), null);
    }

    /** Disjunction of all clauses: at least one has to match. */
    public static Bool should(List<CompiledQuery> clauses) {
      return new Bool(List.of(), clauses, List.of(), 1);
    }

    /** {@code include} has to match and {@code exclude} must not. */
    public static Bool mustNot(CompiledQuery include, CompiledQuery exclude) {
      return new Bool(List.of(include), List.of(), List.of(exclude), null);
    }
  }

  /**
   * Range over a date field. Absent bounds are left open.
   *
   * @param gte inclusive lower bound in canonical timestamp form
   * @param lt exclusive upper bound in canonical timestamp form
   */
  record Range(String field, @Nullable String gte, @Nullable String lt) implements CompiledQuery {

    public Range {
      if (gte == null && lt == null) {
        throw new IllegalArgumentException("Range on " + field + " needs at least one bound");
      }
    }
  }

  /** Query evaluated inside the nested-object scope at {@code path}. */
  record Nested(String path, CompiledQuery query) implements CompiledQuery {}

  /** Matches every document; used only when a query has no conditions at all. */
  record MatchAll() implements CompiledQuery {}
}
