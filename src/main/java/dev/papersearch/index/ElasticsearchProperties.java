package dev.papersearch.index;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the Elasticsearch cluster, bound from
 * {@code papersearch.elasticsearch.*}.
 *
 * <p>{@code user} and {@code password} are optional; when {@code user} is set every request carries
 * HTTP basic credentials.
 */
@ConfigurationProperties(prefix = "papersearch.elasticsearch")
public record ElasticsearchProperties(
        String scheme,
        String host,
        int port,
        String index,
        @Nullable String user,
        @Nullable String password,
        int connectTimeoutMs,
        int readTimeoutMs
) {

    static final int DEFAULT_CONNECT_TIMEOUT_MS = 2000;
    static final int DEFAULT_READ_TIMEOUT_MS = 10000;

    public ElasticsearchProperties {
        if (scheme == null || scheme.isBlank()) {
            scheme = "http";
        }
        if (host == null || host.isBlank()) {
            host = "localhost";
        }
        if (port <= 0) {
            port = 9200;
        }
        if (index == null || index.isBlank()) {
            index = "arxiv";
        }
        // 0 means "no timeout" to the request factory; calls must stay bounded.
        if (connectTimeoutMs <= 0) {
            connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        }
        if (readTimeoutMs <= 0) {
            readTimeoutMs = DEFAULT_READ_TIMEOUT_MS;
        }
    }

    public String baseUrl() {
        return scheme + "://" + host + ":" + port;
    }
}
