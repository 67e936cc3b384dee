package dev.papersearch.error;

/** Malformed or empty query input, or a query the backend rejected as unparseable. */
public class QueryError extends SearchException {

  public QueryError(String message) {
    super(message);
  }

  public QueryError(String message, Throwable cause) {
    super(message, cause);
  }
}
