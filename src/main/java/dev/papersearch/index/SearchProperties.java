package dev.papersearch.index;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalised limits for searching and indexing.
 *
 * <p>Properties are bound from {@code papersearch.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code max-results} - deepest result offset a page may reach (default 10000, the backend's
 *       default result window; bounded [100, 100000])
 *   <li>{@code bulk-chunk-size} - documents per bulk indexing request (default 500, bounded [1,
 *       10000])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@ConfigurationProperties(prefix = "papersearch.search")
public class SearchProperties {

  /** Default ceiling on {@code page * page_size}. */
  public static final int DEFAULT_MAX_RESULTS = 10_000;

  private int maxResults = DEFAULT_MAX_RESULTS;
  private int bulkChunkSize = 500;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxResults < 100 || maxResults > 100_000) {
      throw new IllegalStateException(
          "papersearch.search.max-results must be in [100, 100000], got: " + maxResults);
    }
    if (bulkChunkSize < 1 || bulkChunkSize > 10_000) {
      throw new IllegalStateException(
          "papersearch.search.bulk-chunk-size must be in [1, 10000], got: " + bulkChunkSize);
    }
  }

  public int getMaxResults() {
    return maxResults;
  }

  public void setMaxResults(int maxResults) {
    this.maxResults = maxResults;
  }

  public int getBulkChunkSize() {
    return bulkChunkSize;
  }

  public void setBulkChunkSize(int bulkChunkSize) {
    this.bulkChunkSize = bulkChunkSize;
  }
}
