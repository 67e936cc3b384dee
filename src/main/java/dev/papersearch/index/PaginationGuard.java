package dev.papersearch.index;

import dev.papersearch.error.OutsideAllowedRange;
import dev.papersearch.query.Page;
import org.springframework.stereotype.Component;

/**
 * Rejects pages that would reach past the configured maximum result offset.
 *
 * <p>The check runs before a query is compiled or sent, so a deep page never costs a backend call.
 */
@Component
public class PaginationGuard {

  private final int maxResults;

  public PaginationGuard(SearchProperties properties) {
    this.maxResults = properties.getMaxResults();
  }

  /** Deepest page reachable at {@code pageSize}: {@code floor(maxResults / pageSize)}. */
  public int maxPages(int pageSize) {
    return maxResults / pageSize;
  }

  /**
   * @return the maximum page number for the page's size
   * @throws OutsideAllowedRange if {@code page.number()} exceeds it
   */
  public int check(Page page) {
    int maxPages = maxPages(page.size());
    if (page.number() > maxPages) {
      throw new OutsideAllowedRange(
          "Requested page " + page.number() + ", but max is " + maxPages);
    }
    return maxPages;
  }
}
