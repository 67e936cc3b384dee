package dev.papersearch.error;

/** The index mapping does not accept the documents being written; the index must be recreated. */
public class MappingError extends SearchException {

  public MappingError(String message) {
    super(message);
  }
}
