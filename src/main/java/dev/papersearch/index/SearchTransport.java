package dev.papersearch.index;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Request/response access to the search backend.
 *
 * <p>Implementations report failures as {@link TransportResult.Failure} values instead of throwing,
 * must be safe for concurrent use, and perform no retries: retry policy belongs to whoever owns the
 * connection.
 */
public interface SearchTransport {

  /** Executes a search body against {@code index}; the value is the raw response. */
  TransportResult<JsonNode> search(String index, JsonNode body);

  /** Fetches one document; the value is the raw response including {@code _source}. */
  TransportResult<JsonNode> get(String index, String id);

  /** Indexes (creates or overwrites) one document under {@code id}. */
  TransportResult<JsonNode> index(String index, String id, Object document);

  /** Indexes several documents in one bulk request, keyed by id. */
  TransportResult<JsonNode> bulk(String index, Map<String, ?> documents);

  /** Reports cluster health, waiting briefly for at least yellow status. */
  TransportResult<JsonNode> clusterHealth();
}
