package dev.papersearch.api;

import dev.papersearch.query.AdvancedQuery;
import dev.papersearch.query.Classification;
import dev.papersearch.query.ClassificationList;
import dev.papersearch.query.DateRange;
import dev.papersearch.query.FieldedSearchList;
import dev.papersearch.query.FieldedSearchTerm;
import dev.papersearch.query.Page;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of an advanced search.
 *
 * <pre>{@code
 * {
 *   "terms": [
 *     {"field": "title", "term": "muon"},
 *     {"operator": "OR", "field": "title", "term": "gluon"}
 *   ],
 *   "dateRange": {"startDate": "2006-02-05T00:00:00Z", "endDate": "2007-03-25T00:00:00Z"},
 *   "primaryClassification": [{"group": "cs"}],
 *   "page": 1,
 *   "size": 25,
 *   "order": "-submitted_date"
 * }
 * }</pre>
 *
 * @param terms fielded clauses, leading clause first; the leading operator is ignored
 * @param dateRange optional date window
 * @param primaryClassification optional primary classification alternatives
 * @param secondaryClassification optional cross-list classification alternatives
 * @param page page number, defaults to 1
 * @param size results per page: 25, 50 or 100 (default 25)
 * @param order empty for relevance, or {@code submitted_date} / {@code -submitted_date}
 */
public record AdvancedSearchRequest(
    @Nullable List<FieldedSearchTerm> terms,
    @Nullable DateRange dateRange,
    @Nullable List<Classification> primaryClassification,
    @Nullable List<Classification> secondaryClassification,
    @Nullable @Min(1) Integer page,
    @Nullable Integer size,
    @Nullable @Pattern(regexp = AdvancedSearchRequest.ORDER_PATTERN) String order) {

  /** Sort orders offered to users: relevance, or submission date either way. */
  static final String ORDER_PATTERN = "|-?submitted_date";

  /** Page sizes offered to users. */
  static final List<Integer> ALLOWED_PAGE_SIZES = List.of(25, 50, 100);

  AdvancedQuery toQuery() {
    return AdvancedQuery.builder()
        .terms(new FieldedSearchList(terms))
        .dateRange(dateRange == null ? DateRange.unbounded() : dateRange)
        .primaryClassification(new ClassificationList(primaryClassification))
        .secondaryClassification(new ClassificationList(secondaryClassification))
        .page(toPage(page, size))
        .order(order)
        .build();
  }

  /** Rejects sort orders outside {@link #ORDER_PATTERN}, for callers without bean validation. */
  static @Nullable String checkOrder(@Nullable String order) {
    if (order != null && !order.matches(ORDER_PATTERN)) {
      throw new IllegalArgumentException(
          "order must be empty, submitted_date or -submitted_date, got: " + order);
    }
    return order;
  }

  static Page toPage(@Nullable Integer page, @Nullable Integer size) {
    int pageSize = size == null ? Page.DEFAULT_SIZE : size;
    if (!ALLOWED_PAGE_SIZES.contains(pageSize)) {
      throw new IllegalArgumentException("size must be one of " + ALLOWED_PAGE_SIZES);
    }
    return new Page(page == null ? 1 : page, pageSize);
  }
}
