package dev.papersearch.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/**
 * Logical operator joining a fielded clause to the clauses before it.
 *
 * <p>Binding strength is NOT, then AND, then OR. The leading clause of a query has no operator.
 */
public enum Operator {
  AND,
  OR,
  NOT;

  @JsonCreator
  public static Operator fromValue(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid operator: " + value, e);
    }
  }
}
