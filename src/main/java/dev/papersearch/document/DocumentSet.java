package dev.papersearch.document;

import java.util.List;

/**
 * One page of search results.
 *
 * @param count total number of matching documents, not just those on this page
 * @param results documents on this page in backend rank order
 * @param metadata paging information for this page
 */
public record DocumentSet(long count, List<Document> results, PageMetadata metadata) {

  public DocumentSet {
    results = results == null ? List.of() : List.copyOf(results);
  }
}
