package dev.papersearch.config;

import static org.assertj.core.api.Assertions.assertThat;

import dev.papersearch.error.DocumentNotFound;
import dev.papersearch.error.IndexConnectionError;
import dev.papersearch.error.IndexingError;
import dev.papersearch.error.MappingError;
import dev.papersearch.error.OutsideAllowedRange;
import dev.papersearch.error.QueryError;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

class GlobalExceptionHandlerTest {

  private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

  @Test
  void queryErrorIsBadRequest() {
    ProblemDetail problem = handler.handleBadRequest(new QueryError("Malformed query"));

    assertThat(problem.getStatus()).isEqualTo(400);
    assertThat(problem.getDetail()).isEqualTo("Malformed query");
  }

  @Test
  void pageOutOfRangeIsBadRequest() {
    ProblemDetail problem =
        handler.handleBadRequest(new OutsideAllowedRange("Requested page 401, but max is 400"));

    assertThat(problem.getStatus()).isEqualTo(400);
  }

  @Test
  void missingDocumentIsNotFound() {
    assertThat(handler.handleNotFound(new DocumentNotFound("No such document")).getStatus())
        .isEqualTo(404);
  }

  @Test
  void unreachableIndexIsServiceUnavailable() {
    ProblemDetail problem =
        handler.handleConnection(new IndexConnectionError("Problem communicating with ES"));

    assertThat(problem.getStatus()).isEqualTo(503);
  }

  @Test
  void indexingFailuresAreServerErrors() {
    assertThat(handler.handleIndexFailure(new IndexingError("rejected")).getStatus())
        .isEqualTo(500);
    assertThat(handler.handleIndexFailure(new MappingError("Invalid mapping")).getStatus())
        .isEqualTo(500);
  }
}
