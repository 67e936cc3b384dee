package dev.papersearch.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Date property a {@link DateRange} is applied to. */
public enum DateType {
  SUBMITTED_DATE("submitted_date"),
  SUBMITTED_DATE_FIRST("submitted_date_first"),
  ANNOUNCED_DATE_FIRST("announced_date_first");

  private final String field;

  DateType(String field) {
    this.field = field;
  }

  /** Name of the indexed date field. */
  @JsonValue
  public String field() {
    return field;
  }

  @JsonCreator
  public static DateType fromValue(String value) {
    for (DateType type : values()) {
      if (type.field.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Invalid date type: " + value);
  }
}
