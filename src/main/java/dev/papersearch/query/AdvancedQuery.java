package dev.papersearch.query;

import org.jspecify.annotations.Nullable;

/**
 * Fielded query with operator-joined clauses and facet filters.
 *
 * <p>Every component may be empty: an empty term list contributes no text condition, an unbounded
 * date range and empty classification lists contribute no filter.
 *
 * @param terms ordered fielded clauses
 * @param dateRange date window on {@link DateRange#dateType()}
 * @param primaryClassification classifications the primary classification must match one of
 * @param secondaryClassification classifications a cross-list classification must match one of
 * @param page requested page
 * @param order optional sort key
 */
public record AdvancedQuery(
    FieldedSearchList terms,
    DateRange dateRange,
    ClassificationList primaryClassification,
    ClassificationList secondaryClassification,
    Page page,
    @Nullable String order)
    implements SearchQuery {

  public AdvancedQuery {
    if (terms == null) {
      terms = FieldedSearchList.empty();
    }
    if (dateRange == null) {
      dateRange = DateRange.unbounded();
    }
    if (primaryClassification == null) {
      primaryClassification = ClassificationList.empty();
    }
    if (secondaryClassification == null) {
      secondaryClassification = ClassificationList.empty();
    }
    if (page == null) {
      page = Page.first();
    }
    if (order != null && order.isBlank()) {
      order = null;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitAdvanced(this);
  }

  /** Fluent builder; unset components default to empty. */
  public static final class Builder {

    private FieldedSearchList terms = FieldedSearchList.empty();
    private DateRange dateRange = DateRange.unbounded();
    private ClassificationList primaryClassification = ClassificationList.empty();
    private ClassificationList secondaryClassification = ClassificationList.empty();
    private Page page = Page.first();
    private @Nullable String order;

    private Builder() {}

    public Builder terms(FieldedSearchList terms) {
      this.terms = terms;
      return this;
    }

    public Builder terms(FieldedSearchTerm... terms) {
      this.terms = FieldedSearchList.of(terms);
      return this;
    }

    public Builder dateRange(DateRange dateRange) {
      this.dateRange = dateRange;
      return this;
    }

    public Builder primaryClassification(ClassificationList primaryClassification) {
      this.primaryClassification = primaryClassification;
      return this;
    }

    public Builder secondaryClassification(ClassificationList secondaryClassification) {
      this.secondaryClassification = secondaryClassification;
      return this;
    }

    public Builder page(Page page) {
      this.page = page;
      return this;
    }

    public Builder order(@Nullable String order) {
      this.order = order;
      return this;
    }

    public AdvancedQuery build() {
      return new AdvancedQuery(
          terms, dateRange, primaryClassification, secondaryClassification, page, order);
    }
  }
}
