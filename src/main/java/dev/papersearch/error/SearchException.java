package dev.papersearch.error;

/**
 * Root of the search error taxonomy.
 *
 * <p>Subclasses split into user-correctable errors ({@link QueryError}, {@link
 * OutsideAllowedRange}), transient backend errors ({@link IndexConnectionError}), operator-visible
 * errors ({@link IndexingError}, {@link MappingError}) and expected lookup misses ({@link
 * DocumentNotFound}).
 */
public abstract class SearchException extends RuntimeException {

  protected SearchException(String message) {
    super(message);
  }

  protected SearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
