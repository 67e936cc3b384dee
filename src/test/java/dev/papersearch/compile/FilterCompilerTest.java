package dev.papersearch.compile;

import static org.assertj.core.api.Assertions.assertThat;

import dev.papersearch.compile.CompiledQuery.Bool;
import dev.papersearch.compile.CompiledQuery.Match;
import dev.papersearch.compile.CompiledQuery.Nested;
import dev.papersearch.compile.CompiledQuery.Range;
import dev.papersearch.query.Classification;
import dev.papersearch.query.ClassificationList;
import dev.papersearch.query.DateRange;
import dev.papersearch.query.DateType;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class FilterCompilerTest {

  private static final OffsetDateTime START =
      OffsetDateTime.of(2006, 2, 5, 0, 0, 0, 0, ZoneOffset.UTC);
  private static final OffsetDateTime END =
      OffsetDateTime.of(2007, 3, 25, 0, 0, 0, 0, ZoneOffset.UTC);

  @Test
  void bothBoundsProduceClosedOpenRange() {
    assertThat(FilterCompiler.compileDateRange(new DateRange(START, END)))
        .contains(
            new Range("submitted_date", "2006-02-05T00:00:00+0000", "2007-03-25T00:00:00+0000"));
  }

  @Test
  void onlyStartBoundIsOpenEnded() {
    assertThat(FilterCompiler.compileDateRange(new DateRange(START, null)))
        .contains(new Range("submitted_date", "2006-02-05T00:00:00+0000", null));
  }

  @Test
  void onlyEndBoundIsOpenStarted() {
    assertThat(FilterCompiler.compileDateRange(new DateRange(null, END)))
        .contains(new Range("submitted_date", null, "2007-03-25T00:00:00+0000"));
  }

  @Test
  void unboundedRangeIsOmitted() {
    assertThat(FilterCompiler.compileDateRange(DateRange.unbounded())).isEmpty();
  }

  @Test
  void dateTypeSelectsTheFilteredField() {
    DateRange range = new DateRange(START, null, DateType.ANNOUNCED_DATE_FIRST);

    assertThat(FilterCompiler.compileDateRange(range))
        .get()
        .extracting(query -> ((Range) query).field())
        .isEqualTo("announced_date_first");
  }

  @Test
  void timestampsKeepTheirOffset() {
    OffsetDateTime local =
        OffsetDateTime.of(1996, 2, 5, 0, 0, 0, 0, ZoneOffset.ofHoursMinutes(-4, -56));

    assertThat(FilterCompiler.format(local)).isEqualTo("1996-02-05T00:00:00-0456");
  }

  @Test
  void groupOnlyClassificationIsNestedBareMatch() {
    assertThat(
            FilterCompiler.compileClassifications(
                FilterCompiler.PRIMARY_CLASSIFICATION,
                ClassificationList.of(new Classification("cs"))))
        .contains(
            new Nested(
                "primary_classification", new Match("primary_classification.group.id", "cs")));
  }

  @Test
  void fullClassificationRequiresEveryLevel() {
    Classification classification = new Classification("grp_physics", "physics", "physics.data-an");

    assertThat(
            FilterCompiler.compileClassifications(
                FilterCompiler.SECONDARY_CLASSIFICATION, ClassificationList.of(classification)))
        .contains(
            new Nested(
                "secondary_classification",
                Bool.must(
                    List.of(
                        new Match("secondary_classification.group.id", "grp_physics"),
                        new Match("secondary_classification.archive.id", "physics"),
                        new Match("secondary_classification.category.id", "physics.data-an")))));
  }

  @Test
  void blankLevelsCompileLikeAGroupOnlyClassification() {
    assertThat(
            FilterCompiler.compileClassifications(
                FilterCompiler.PRIMARY_CLASSIFICATION,
                ClassificationList.of(new Classification("cs", "", "  "))))
        .contains(
            new Nested(
                "primary_classification", new Match("primary_classification.group.id", "cs")));
  }

  @Test
  void severalClassificationsAreAlternativesInOneNestedScope() {
    ClassificationList classifications =
        ClassificationList.of(new Classification("cs"), new Classification("math"));

    CompiledQuery compiled =
        FilterCompiler.compileClassifications(
                FilterCompiler.PRIMARY_CLASSIFICATION, classifications)
            .orElseThrow();

    assertThat(compiled)
        .isEqualTo(
            new Nested(
                "primary_classification",
                new Bool(
                    List.of(),
                    List.of(
                        new Match("primary_classification.group.id", "cs"),
                        new Match("primary_classification.group.id", "math")),
                    List.of(),
                    1)));
  }

  @Test
  void emptyClassificationListIsOmitted() {
    assertThat(
            FilterCompiler.compileClassifications(
                FilterCompiler.PRIMARY_CLASSIFICATION, ClassificationList.empty()))
        .isEmpty();
  }
}
