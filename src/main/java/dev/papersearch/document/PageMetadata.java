package dev.papersearch.document;

/**
 * Paging block reported with every result set.
 *
 * @param start offset of the first result on the page
 * @param end offset one past the last result on the page
 * @param size requested page size
 * @param currentPage requested page number, starting at 1
 * @param totalPages pages available for the total match count, capped at {@code maxPages}
 * @param maxPages deepest page the bounds guard allows for this page size
 */
public record PageMetadata(
    int start, int end, int size, int currentPage, int totalPages, int maxPages) {}
