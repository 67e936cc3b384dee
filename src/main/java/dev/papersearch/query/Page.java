package dev.papersearch.query;

/**
 * A 1-indexed page of results.
 *
 * @param number the page number, starting at 1
 * @param size the number of results per page
 */
public record Page(int number, int size) {

  /** Default number of results per page. */
  public static final int DEFAULT_SIZE = 25;

  public Page {
    if (number < 1) {
      throw new IllegalArgumentException("page must be at least 1");
    }
    if (size < 1) {
      throw new IllegalArgumentException("page size must be at least 1");
    }
  }

  public static Page first() {
    return new Page(1, DEFAULT_SIZE);
  }

  /** Offset of the first result on this page. */
  public int start() {
    return (number - 1) * size;
  }

  /** Offset one past the last result on this page. */
  public int end() {
    return start() + size;
  }
}
