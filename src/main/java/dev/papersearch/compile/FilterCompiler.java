package dev.papersearch.compile;

import dev.papersearch.query.Classification;
import dev.papersearch.query.ClassificationList;
import dev.papersearch.query.DateRange;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Compiles the facet filters of an advanced query.
 *
 * <p>Filters that constrain nothing compile to {@link Optional#empty()} and are left out of the
 * combined query entirely.
 */
public final class FilterCompiler {

  /** Nested path of the primary classification record. */
  public static final String PRIMARY_CLASSIFICATION = "primary_classification";

  /** Nested path of the cross-list classification records. */
  public static final String SECONDARY_CLASSIFICATION = "secondary_classification";

  /** Canonical fixed-offset timestamp form, e.g. {@code 2006-02-05T00:00:00+0000}. */
  static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

  private FilterCompiler() {}

  /** Range over the date range's date field, with {@code gte} and {@code lt} for present bounds. */
  public static Optional<CompiledQuery> compileDateRange(DateRange dateRange) {
    if (dateRange == null || !dateRange.hasBounds()) {
      return Optional.empty();
    }
    return Optional.of(
        new CompiledQuery.Range(
            dateRange.dateType().field(),
            format(dateRange.startDate()),
            format(dateRange.endDate())));
  }

  /**
   * Nested match over the classification record at {@code path}.
   *
   * <p>Each classification requires every present level to match. A group-only classification is a
   * bare match, one with more levels a conjunction. Several classifications are combined as a
   * disjunction inside a single nested scope.
   */
  public static Optional<CompiledQuery> compileClassifications(
      String path, ClassificationList classifications) {
    if (classifications == null || classifications.isEmpty()) {
      return Optional.empty();
    }
    List<CompiledQuery> alternatives = new ArrayList<>(classifications.size());
    for (Classification classification : classifications.classifications()) {
      alternatives.add(compileClassification(path, classification));
    }
    CompiledQuery scoped =
        alternatives.size() == 1 ? alternatives.get(0) : CompiledQuery.Bool.should(alternatives);
    return Optional.of(new CompiledQuery.Nested(path, scoped));
  }

  private static CompiledQuery compileClassification(String path, Classification classification) {
    List<CompiledQuery> levels = new ArrayList<>(3);
    levels.add(levelMatch(path, "group", classification.group()));
    if (classification.archive() != null) {
      levels.add(levelMatch(path, "archive", classification.archive()));
    }
    if (classification.category() != null) {
      levels.add(levelMatch(path, "category", classification.category()));
    }
    return levels.size() == 1 ? levels.get(0) : CompiledQuery.Bool.must(levels);
  }

  private static CompiledQuery levelMatch(String path, String level, String id) {
    return new CompiledQuery.Match(path + "." + level + ".id", id);
  }

  static @Nullable String format(@Nullable OffsetDateTime timestamp) {
    return timestamp == null ? null : TIMESTAMP_FORMAT.format(timestamp);
  }
}
