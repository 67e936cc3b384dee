package dev.papersearch.config;

import dev.papersearch.error.DocumentNotFound;
import dev.papersearch.error.IndexConnectionError;
import dev.papersearch.error.IndexingError;
import dev.papersearch.error.MappingError;
import dev.papersearch.error.OutsideAllowedRange;
import dev.papersearch.error.QueryError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>400: {@link QueryError}, {@link OutsideAllowedRange}, {@link IllegalArgumentException}
 *   <li>404: {@link DocumentNotFound}
 *   <li>503: {@link IndexConnectionError}
 *   <li>500: {@link IndexingError}, {@link MappingError}
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler({QueryError.class, OutsideAllowedRange.class, IllegalArgumentException.class})
  ProblemDetail handleBadRequest(RuntimeException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(DocumentNotFound.class)
  ProblemDetail handleNotFound(DocumentNotFound ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(IndexConnectionError.class)
  ProblemDetail handleConnection(IndexConnectionError ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
  }

  @ExceptionHandler({IndexingError.class, MappingError.class})
  ProblemDetail handleIndexFailure(RuntimeException ex) {
    log.error("Index failure: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
  }
}
