package dev.papersearch.compile;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.papersearch.error.QueryError;
import dev.papersearch.query.AdvancedQuery;
import dev.papersearch.query.FieldedSearchTerm;
import dev.papersearch.query.SearchField;
import dev.papersearch.query.SearchQuery;
import dev.papersearch.query.SimpleQuery;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Renders {@link CompiledQuery} trees into the Elasticsearch query DSL.
 *
 * <p>{@link #renderSearch} produces the complete search body: the query, the {@code from}/{@code
 * size} slice of the requested page, the sort order and highlighting over the fields the query
 * matched against.
 */
@Component
public class QueryRenderer {

  private final ObjectMapper objectMapper;

  public QueryRenderer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** Renders the query clause alone, e.g. {@code {"match": {"title.tex": "muon"}}}. */
  public ObjectNode render(CompiledQuery query) {
    ObjectNode node = objectMapper.createObjectNode();
    if (query instanceof CompiledQuery.Match match) {
      node.putObject("match").put(match.field(), match.text());
    } else if (query instanceof CompiledQuery.Bool bool) {
      ObjectNode body = node.putObject("bool");
      putClauses(body, "must", bool.must());
      putClauses(body, "should", bool.should());
      putClauses(body, "must_not", bool.mustNot());
      if (bool.minimumShouldMatch() != null) {
        body.put("minimum_should_match", bool.minimumShouldMatch());
      }
    } else if (query instanceof CompiledQuery.Range range) {
      ObjectNode bounds = node.putObject("range").putObject(range.field());
      if (range.gte() != null) {
        bounds.put("gte", range.gte());
      }
      if (range.lt() != null) {
        bounds.put("lt", range.lt());
      }
    } else if (query instanceof CompiledQuery.Nested nested) {
      ObjectNode body = node.putObject("nested");
      body.put("path", nested.path());
      body.set("query", render(nested.query()));
    } else if (query instanceof CompiledQuery.MatchAll) {
      node.putObject("match_all");
    } else {
      throw new IllegalArgumentException("Unsupported query node: " + query);
    }
    return node;
  }

  /**
   * Renders the complete search request body for one page of {@code source}.
   *
   * @param source the query as submitted, supplying page, order and matched fields
   * @param compiled the compiled form of {@code source}
   */
  public ObjectNode renderSearch(SearchQuery source, CompiledQuery compiled) {
    ObjectNode body = objectMapper.createObjectNode();
    body.set("query", render(compiled));
    body.put("from", source.page().start());
    body.put("size", source.page().size());
    if (source.order() != null) {
      body.set("sort", renderSort(source.order()));
    }
    Set<String> highlighted = highlightFields(source);
    if (!highlighted.isEmpty()) {
      ObjectNode fields = body.putObject("highlight").putObject("fields");
      highlighted.forEach(fields::putObject);
    }
    return body;
  }

  /**
   * @throws QueryError if the order names no field, e.g. a bare {@code -}
   */
  ArrayNode renderSort(String order) {
    boolean descending = order.startsWith("-");
    String field = descending ? order.substring(1) : order;
    if (field.isBlank()) {
      throw new QueryError("Sort order '" + order + "' names no field");
    }
    ArrayNode sort = objectMapper.createArrayNode();
    if (descending) {
      sort.addObject().putObject(field).put("order", "desc");
    } else {
      sort.add(order);
    }
    return sort;
  }

  private void putClauses(ObjectNode body, String occur, List<CompiledQuery> clauses) {
    if (clauses.isEmpty()) {
      return;
    }
    ArrayNode array = body.putArray(occur);
    clauses.forEach(clause -> array.add(render(clause)));
  }

  /** Index sub-fields of every field the query's text conditions match against. */
  private static Set<String> highlightFields(SearchQuery source) {
    List<SearchField> fields =
        source.accept(
            new SearchQuery.Visitor<List<SearchField>>() {
              @Override
              public List<SearchField> visitSimple(SimpleQuery query) {
                return query.field() == null
                    ? SearchField.ALL_SEARCH_FIELDS
                    : List.of(query.field());
              }

              @Override
              public List<SearchField> visitAdvanced(AdvancedQuery query) {
                return query.terms().terms().stream().map(FieldedSearchTerm::field).toList();
              }
            });
    Set<String> indexFields = new LinkedHashSet<>();
    fields.forEach(field -> indexFields.addAll(field.indexFields()));
    return indexFields;
  }
}
