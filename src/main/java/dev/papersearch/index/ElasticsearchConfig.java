package dev.papersearch.index;

import java.time.Duration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} shared by all requests to the Elasticsearch cluster.
 *
 * <p>One client is built at startup and injected wherever it is needed; it holds no per-request
 * state, so concurrent searches share it freely. Timeouts bound every call.
 */
@Configuration
@EnableConfigurationProperties({ElasticsearchProperties.class, SearchProperties.class})
public class ElasticsearchConfig {

    /**
     * Creates the REST client targeting the configured cluster.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties cluster address, credentials and timeouts
     * @return a named REST client bean for injection into {@link RestClientSearchTransport}
     */
    @Bean
    public RestClient elasticsearchRestClient(RestClient.Builder builder,
                                              ElasticsearchProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        RestClient.Builder configured = builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);

        if (properties.user() != null && !properties.user().isBlank()) {
            String password = properties.password() == null ? "" : properties.password();
            configured = configured.defaultHeaders(
                    headers -> headers.setBasicAuth(properties.user(), password));
        }
        return configured.build();
    }
}
