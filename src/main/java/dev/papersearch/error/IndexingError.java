package dev.papersearch.error;

/** A document could not be serialized or the backend refused part of a bulk request. */
public class IndexingError extends SearchException {

  public IndexingError(String message) {
    super(message);
  }

  public IndexingError(String message, Throwable cause) {
    super(message, cause);
  }
}
