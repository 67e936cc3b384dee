package dev.papersearch.index;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link SearchTransport} over the Elasticsearch REST API.
 *
 * <p>Every exception raised by the HTTP exchange is caught here and turned into a
 * {@link TransportFault}; nothing is retried.
 */
@Component
public class RestClientSearchTransport implements SearchTransport {

    private static final Logger log = LoggerFactory.getLogger(RestClientSearchTransport.class);

    static final MediaType NDJSON = new MediaType("application", "x-ndjson");

    static final String CLUSTER_HEALTH_URI = "/_cluster/health?wait_for_status=yellow&timeout=1s";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public RestClientSearchTransport(@Qualifier("elasticsearchRestClient") RestClient restClient,
                                     ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public TransportResult<JsonNode> search(String index, JsonNode body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return TransportResult.failure(TransportFault.serialization(e.getOriginalMessage()));
        }
        return exchange("search " + index, () -> restClient.post()
                .uri("/{index}/_search", index)
                .body(json)
                .retrieve()
                .body(String.class));
    }

    @Override
    public TransportResult<JsonNode> get(String index, String id) {
        TransportResult<JsonNode> result = exchange("get " + index + "/" + id, () -> restClient
                .get()
                .uri("/{index}/_doc/{id}", index, id)
                .retrieve()
                .body(String.class));
        if (result instanceof TransportResult.Success<JsonNode> success
                && !success.value().path("found").asBoolean(true)) {
            return TransportResult.failure(TransportFault.notFound("No such document: " + id));
        }
        return result;
    }

    @Override
    public TransportResult<JsonNode> index(String index, String id, Object document) {
        String json;
        try {
            json = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            return TransportResult.failure(TransportFault.serialization(e.getOriginalMessage()));
        }
        return exchange("index " + index + "/" + id, () -> restClient.put()
                .uri("/{index}/_doc/{id}", index, id)
                .body(json)
                .retrieve()
                .body(String.class));
    }

    @Override
    public TransportResult<JsonNode> bulk(String index, Map<String, ?> documents) {
        StringBuilder ndjson = new StringBuilder();
        try {
            for (Map.Entry<String, ?> entry : documents.entrySet()) {
                ObjectNode action = objectMapper.createObjectNode();
                action.putObject("index").put("_index", index).put("_id", entry.getKey());
                ndjson.append(objectMapper.writeValueAsString(action)).append('\n');
                ndjson.append(objectMapper.writeValueAsString(entry.getValue())).append('\n');
            }
        } catch (JsonProcessingException e) {
            return TransportResult.failure(TransportFault.serialization(e.getOriginalMessage()));
        }

        TransportResult<JsonNode> result = exchange("bulk " + index, () -> restClient.post()
                .uri("/{index}/_bulk", index)
                .contentType(NDJSON)
                .body(ndjson.toString())
                .retrieve()
                .body(String.class));
        if (result instanceof TransportResult.Success<JsonNode> success
                && success.value().path("errors").asBoolean(false)) {
            return TransportResult.failure(firstBulkItemError(success.value()));
        }
        return result;
    }

    @Override
    public TransportResult<JsonNode> clusterHealth() {
        return exchange("cluster health", () -> restClient.get()
                .uri(CLUSTER_HEALTH_URI)
                .retrieve()
                .body(String.class));
    }

    private TransportResult<JsonNode> exchange(String description, Call call) {
        String body;
        try {
            body = call.execute();
        } catch (RestClientResponseException e) {
            return TransportResult.failure(toFault(e));
        } catch (RestClientException e) {
            log.debug("Elasticsearch {} failed: {}", description, e.getMessage());
            return TransportResult.failure(
                    TransportFault.unavailable(String.valueOf(e.getMessage())));
        }
        if (body == null || body.isBlank()) {
            return TransportResult.failure(
                    TransportFault.unavailable("Empty response for " + description));
        }
        try {
            return TransportResult.success(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            return TransportResult.failure(TransportFault.unavailable(
                    "Unreadable response for " + description + ": " + e.getOriginalMessage()));
        }
    }

    /**
     * Reads the backend's error document, e.g.
     * {@code {"error": {"type": "parsing_exception", "reason": "..."}, "status": 400}}.
     */
    TransportFault toFault(RestClientResponseException e) {
        int status = e.getStatusCode().value();
        JsonNode error = readError(e.getResponseBodyAsString());
        if (status == 404 && (error == null || !error.isObject())) {
            return TransportFault.notFound("No such document");
        }
        if (error == null) {
            return TransportFault.backendError(null, e.getStatusText(), status);
        }
        if (error.isTextual()) {
            return TransportFault.backendError(error.asText(), error.asText(), status);
        }
        return TransportFault.backendError(
                error.path("type").asText(null),
                error.path("reason").asText(e.getStatusText()),
                status);
    }

    private @Nullable JsonNode readError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode error = objectMapper.readTree(body).get("error");
            return error == null || error.isNull() ? null : error;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static TransportFault firstBulkItemError(JsonNode response) {
        for (JsonNode item : response.path("items")) {
            JsonNode error = item.path("index").path("error");
            if (error.isObject()) {
                String id = item.path("index").path("_id").asText("?");
                return TransportFault.bulkRejected(error.path("type").asText(null),
                        id + ": " + error.path("reason").asText("rejected"));
            }
        }
        return TransportFault.bulkRejected(null, "Bulk request reported errors");
    }

    @FunctionalInterface
    private interface Call {
        @Nullable String execute();
    }
}
