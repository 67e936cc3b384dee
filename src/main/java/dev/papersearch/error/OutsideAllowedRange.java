package dev.papersearch.error;

/** A requested page lies beyond the deepest offset the backend is allowed to serve. */
public class OutsideAllowedRange extends SearchException {

  public OutsideAllowedRange(String message) {
    super(message);
  }
}
