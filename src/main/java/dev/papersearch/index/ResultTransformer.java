package dev.papersearch.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.papersearch.document.Document;
import dev.papersearch.document.DocumentSet;
import dev.papersearch.document.PageMetadata;
import dev.papersearch.error.DocumentNotFound;
import dev.papersearch.error.IndexConnectionError;
import dev.papersearch.query.Page;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps raw backend responses back into {@link Document} and {@link DocumentSet} values.
 *
 * <p>Hits keep the backend's rank order. Each document is annotated with its {@code _score} and,
 * when the backend reports one, its {@code _type}. Hits that carry no {@code _source} are skipped.
 */
@Component
public class ResultTransformer {

  private static final Logger log = LoggerFactory.getLogger(ResultTransformer.class);

  private final ObjectMapper objectMapper;

  public ResultTransformer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Builds the result set for one page of a search response.
   *
   * @param page the requested page
   * @param maxPages deepest page allowed at this page size
   * @param response raw search response
   */
  public DocumentSet toDocumentSet(Page page, int maxPages, JsonNode response) {
    JsonNode hits = response.path("hits");
    long count = totalHits(hits.path("total"));

    List<Document> results = new ArrayList<>();
    for (JsonNode hit : hits.path("hits")) {
      // Hits without a source (e.g. _source disabled for the index) carry nothing to map.
      if (!hit.path("_source").isObject()) {
        log.warn("Skipping hit {} without _source", hit.path("_id").asText("?"));
        continue;
      }
      results.add(toHitDocument(hit));
    }

    int totalPages = (int) Math.min((count + page.size() - 1) / page.size(), maxPages);
    PageMetadata metadata =
        new PageMetadata(
            page.start(), page.start() + results.size(), page.size(), page.number(), totalPages,
            maxPages);
    return new DocumentSet(count, results, metadata);
  }

  /**
   * Reads the document from a single-document lookup response.
   *
   * @throws DocumentNotFound if the response reports no document
   */
  public Document toDocument(JsonNode response) {
    if (!response.path("found").asBoolean(true) || !response.path("_source").isObject()) {
      throw new DocumentNotFound("No such document");
    }
    return readSource(response.path("_source"));
  }

  private Document toHitDocument(JsonNode hit) {
    JsonNode score = hit.path("_score");
    JsonNode type = hit.path("_type");
    return readSource(hit.path("_source"))
        .withHit(
            score.isNumber() ? score.asDouble() : null, type.isTextual() ? type.asText() : null);
  }

  private Document readSource(JsonNode source) {
    try {
      return objectMapper.treeToValue(source, Document.class);
    } catch (JsonProcessingException e) {
      throw new IndexConnectionError(
          "Malformed document in ES response: " + e.getOriginalMessage(), e);
    }
  }

  /** Accepts both {@code "total": 12} and {@code "total": {"value": 12, "relation": "eq"}}. */
  static long totalHits(JsonNode total) {
    if (total.isObject()) {
      return total.path("value").asLong(0);
    }
    return total.asLong(0);
  }
}
