package dev.papersearch.index;

import dev.papersearch.error.DocumentNotFound;
import dev.papersearch.error.IndexConnectionError;
import dev.papersearch.error.IndexingError;
import dev.papersearch.error.MappingError;
import dev.papersearch.error.QueryError;
import dev.papersearch.error.SearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps transport faults onto the search error taxonomy.
 *
 * <p>Backend error types without a specific mapping are logged and raised as {@link
 * IndexConnectionError}; no fault is ever turned into an empty result.
 */
public final class FaultTranslator {

  private static final Logger log = LoggerFactory.getLogger(FaultTranslator.class);

  static final String PARSING_EXCEPTION = "parsing_exception";
  static final String MAPPER_PARSING_EXCEPTION = "mapper_parsing_exception";

  private FaultTranslator() {}

  public static SearchException translate(TransportFault fault) {
    return switch (fault.kind()) {
      case NOT_FOUND -> new DocumentNotFound("No such document");
      case SERIALIZATION -> {
        log.error("Serialization failure: {}", fault.reason());
        yield new IndexingError("Problem serializing document: " + fault.reason());
      }
      case BULK_REJECTED -> {
        log.error("Bulk indexing failure: {}", fault.reason());
        yield new IndexingError("Problem with bulk indexing: " + fault.reason());
      }
      case UNAVAILABLE -> {
        log.error("Problem communicating with ES: {}", fault.reason());
        yield new IndexConnectionError("Problem communicating with ES: " + fault.reason());
      }
      case BACKEND_ERROR -> translateBackendError(fault);
    };
  }

  private static SearchException translateBackendError(TransportFault fault) {
    if (PARSING_EXCEPTION.equals(fault.errorType())) {
      return new QueryError(fault.reason());
    }
    if (MAPPER_PARSING_EXCEPTION.equals(fault.errorType())) {
      log.error("Invalid document mapping: {}", fault.reason());
      return new MappingError("Invalid mapping: " + fault.reason());
    }
    log.error(
        "Unhandled ES error (status {}, type {}): {}",
        fault.status(),
        fault.errorType(),
        fault.reason());
    return new IndexConnectionError(
        "Problem communicating with ES: "
            + (fault.errorType() != null ? fault.errorType() : fault.reason()));
  }
}
