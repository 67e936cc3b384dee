package dev.papersearch.compile;

import dev.papersearch.query.AdvancedQuery;
import dev.papersearch.query.SearchField;
import dev.papersearch.query.SearchQuery;
import dev.papersearch.query.SimpleQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point of the compiler: turns a {@link SearchQuery} into one {@link CompiledQuery}.
 *
 * <p>Pipeline for advanced queries: group clauses by precedence -> lower the grouped tree ->
 * compile date and classification filters -> AND the present parts together. Parts that constrain
 * nothing are omitted; a single present part is returned without a wrapper.
 *
 * <p>Pure and stateless: safe to share across concurrent requests.
 */
@Component
public class QueryCompiler {

  private static final Logger log = LoggerFactory.getLogger(QueryCompiler.class);

  /**
   * Compiles a query.
   *
   * @param query the validated query
   * @return the combined query tree
   * @throws dev.papersearch.error.QueryError if any clause is empty or the clause tree is malformed
   */
  public CompiledQuery compile(SearchQuery query) {
    CompiledQuery compiled =
        query.accept(
            new SearchQuery.Visitor<CompiledQuery>() {
              @Override
              public CompiledQuery visitSimple(SimpleQuery simple) {
                return compileSimple(simple);
              }

              @Override
              public CompiledQuery visitAdvanced(AdvancedQuery advanced) {
                return compileAdvanced(advanced);
              }
            });
    log.debug("Compiled {} into {}", query, compiled);
    return compiled;
  }

  CompiledQuery compileSimple(SimpleQuery query) {
    List<SearchField> fields =
        query.field() == null ? SearchField.ALL_SEARCH_FIELDS : List.of(query.field());
    return ClauseCompiler.compileAcross(fields, query.term());
  }

  CompiledQuery compileAdvanced(AdvancedQuery query) {
    GroupedExpression grouped = PrecedenceGrouper.group(query.terms());
    log.debug("Grouped clauses as {}", grouped);

    List<CompiledQuery> parts = new ArrayList<>(4);
    ExpressionTreeCompiler.compile(grouped).ifPresent(parts::add);
    FilterCompiler.compileDateRange(query.dateRange()).ifPresent(parts::add);
    FilterCompiler.compileClassifications(
            FilterCompiler.PRIMARY_CLASSIFICATION, query.primaryClassification())
        .ifPresent(parts::add);
    FilterCompiler.compileClassifications(
            FilterCompiler.SECONDARY_CLASSIFICATION, query.secondaryClassification())
        .ifPresent(parts::add);
    return combine(parts).orElseGet(CompiledQuery.MatchAll::new);
  }

  private static Optional<CompiledQuery> combine(List<CompiledQuery> parts) {
    if (parts.isEmpty()) {
      return Optional.empty();
    }
    if (parts.size() == 1) {
      return Optional.of(parts.get(0));
    }
    return Optional.of(CompiledQuery.Bool.must(parts));
  }
}
