package dev.papersearch.query;

import java.time.OffsetDateTime;
import org.jspecify.annotations.Nullable;

/**
 * Submission-date window. Either bound may be absent, which leaves that side open-ended.
 *
 * @param startDate inclusive lower bound
 * @param endDate exclusive upper bound
 * @param dateType the date property to filter on (defaults to {@link DateType#SUBMITTED_DATE})
 */
public record DateRange(
    @Nullable OffsetDateTime startDate, @Nullable OffsetDateTime endDate, DateType dateType) {

  public DateRange {
    if (dateType == null) {
      dateType = DateType.SUBMITTED_DATE;
    }
    if (startDate != null && endDate != null && !startDate.isBefore(endDate)) {
      throw new IllegalArgumentException("End date must be later than start date");
    }
  }

  public DateRange(@Nullable OffsetDateTime startDate, @Nullable OffsetDateTime endDate) {
    this(startDate, endDate, DateType.SUBMITTED_DATE);
  }

  /** A range with no bounds, which filters nothing. */
  public static DateRange unbounded() {
    return new DateRange(null, null, DateType.SUBMITTED_DATE);
  }

  public boolean hasBounds() {
    return startDate != null || endDate != null;
  }
}
