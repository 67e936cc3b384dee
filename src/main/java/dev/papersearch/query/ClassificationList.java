package dev.papersearch.query;

import java.util.List;

/**
 * Classifications a result must match at least one of.
 *
 * @param classifications the alternatives, order preserved for rendering
 */
public record ClassificationList(List<Classification> classifications) {

  public ClassificationList {
    classifications = classifications == null ? List.of() : List.copyOf(classifications);
  }

  public static ClassificationList of(Classification... classifications) {
    return new ClassificationList(List.of(classifications));
  }

  public static ClassificationList empty() {
    return new ClassificationList(List.of());
  }

  public boolean isEmpty() {
    return classifications.isEmpty();
  }

  public int size() {
    return classifications.size();
  }
}
