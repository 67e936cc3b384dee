package dev.papersearch.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.papersearch.compile.CompiledQuery;
import dev.papersearch.compile.QueryCompiler;
import dev.papersearch.compile.QueryRenderer;
import dev.papersearch.document.Document;
import dev.papersearch.document.DocumentSet;
import dev.papersearch.query.SearchQuery;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Session with the search index: the single entry point for searching, fetching and indexing
 * documents.
 *
 * <p>Pipeline for {@link #search}: bounds-check the page -> compile -> render -> execute -> map
 * hits. Every compilation and paging error is raised before the backend is contacted, so partial
 * queries are never sent.
 *
 * <p>Constructed once by Spring and shared; it holds no per-request state.
 */
@Service
public class SearchSession {

  private static final Logger log = LoggerFactory.getLogger(SearchSession.class);

  private final SearchTransport transport;
  private final QueryCompiler compiler;
  private final QueryRenderer renderer;
  private final ResultTransformer transformer;
  private final PaginationGuard paginationGuard;
  private final String index;
  private final int bulkChunkSize;

  public SearchSession(
      SearchTransport transport,
      QueryCompiler compiler,
      QueryRenderer renderer,
      ResultTransformer transformer,
      PaginationGuard paginationGuard,
      ElasticsearchProperties elasticsearchProperties,
      SearchProperties searchProperties) {
    this.transport = transport;
    this.compiler = compiler;
    this.renderer = renderer;
    this.transformer = transformer;
    this.paginationGuard = paginationGuard;
    this.index = elasticsearchProperties.index();
    this.bulkChunkSize = searchProperties.getBulkChunkSize();
  }

  /**
   * Runs a search and returns one page of results.
   *
   * @param query the validated query
   * @return the requested page; an empty page (count 0) when nothing matches
   * @throws dev.papersearch.error.OutsideAllowedRange if the page is beyond the allowed depth
   * @throws dev.papersearch.error.QueryError if the query is malformed or rejected by the backend
   * @throws dev.papersearch.error.IndexConnectionError if the backend cannot be reached
   */
  public DocumentSet search(SearchQuery query) {
    int maxPages = paginationGuard.check(query.page());

    CompiledQuery compiled = compiler.compile(query);
    ObjectNode body = renderer.renderSearch(query, compiled);
    log.debug("Search on index '{}': {}", index, body);

    JsonNode response = transport.search(index, body).orElseThrow(FaultTranslator::translate);
    DocumentSet results = transformer.toDocumentSet(query.page(), maxPages, response);
    log.debug(
        "Search matched {} documents, returning {}", results.count(), results.results().size());
    return results;
  }

  /**
   * Fetches a document by its index id.
   *
   * @throws dev.papersearch.error.DocumentNotFound if no document has that id
   */
  public Document getDocument(String documentId) {
    JsonNode response =
        transport.get(index, documentId).orElseThrow(FaultTranslator::translate);
    return transformer.toDocument(response);
  }

  /**
   * Indexes a document under {@link Document#indexId()}, overwriting any existing version.
   *
   * @throws dev.papersearch.error.IndexingError if the document cannot be serialized
   * @throws dev.papersearch.error.MappingError if the index mapping rejects the document
   */
  public void addDocument(Document document) {
    String id = document.indexId();
    log.debug("{}: index document", id);
    transport.index(index, id, withoutHit(document)).orElseThrow(FaultTranslator::translate);
  }

  /**
   * Indexes documents through the bulk API, {@code papersearch.search.bulk-chunk-size} per request.
   *
   * @throws dev.papersearch.error.IndexingError if any document is rejected
   */
  public void bulkAddDocuments(List<Document> documents) {
    for (int from = 0; from < documents.size(); from += bulkChunkSize) {
      int to = Math.min(from + bulkChunkSize, documents.size());
      List<Document> chunk = documents.subList(from, to);
      Map<String, Document> byId = new LinkedHashMap<>();
      chunk.forEach(document -> byId.put(document.indexId(), withoutHit(document)));
      transport.bulk(index, byId).orElseThrow(FaultTranslator::translate);
    }
    log.debug("Added {} documents to index '{}'", documents.size(), index);
  }

  /** Whether the cluster answers a health check with at least yellow status. */
  public boolean clusterAvailable() {
    TransportResult<JsonNode> health = transport.clusterHealth();
    if (health instanceof TransportResult.Failure<JsonNode> failure) {
      log.debug("Health check failed: {}", failure.fault().reason());
      return false;
    }
    return true;
  }

  private static Document withoutHit(Document document) {
    if (document.score() == null && document.type() == null) {
      return document;
    }
    return document.withHit(null, null);
  }
}
