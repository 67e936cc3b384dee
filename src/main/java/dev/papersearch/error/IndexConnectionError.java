package dev.papersearch.error;

/** The search backend could not be reached or answered with an unrecognized fault. */
public class IndexConnectionError extends SearchException {

  public IndexConnectionError(String message) {
    super(message);
  }

  public IndexConnectionError(String message, Throwable cause) {
    super(message, cause);
  }
}
