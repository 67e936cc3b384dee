package dev.papersearch.error;

public class DocumentNotFound extends SearchException {

  public DocumentNotFound(String message) {
    super(message);
  }
}
