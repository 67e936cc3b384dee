package dev.papersearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the paper search service.
 *
 * <p>Serves the REST API on port 8080 and talks to the Elasticsearch cluster configured under
 * {@code papersearch.elasticsearch}.
 */
@SpringBootApplication
public class PaperSearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(PaperSearchApplication.class, args);
    }
}
