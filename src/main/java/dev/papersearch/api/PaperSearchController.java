package dev.papersearch.api;

import dev.papersearch.document.Document;
import dev.papersearch.document.DocumentSet;
import dev.papersearch.index.SearchSession;
import dev.papersearch.query.SearchField;
import dev.papersearch.query.SimpleQuery;
import jakarta.validation.Valid;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter over {@link SearchSession}.
 *
 * <p>Errors propagate to {@link dev.papersearch.config.GlobalExceptionHandler}, which renders them
 * as Problem Detail responses.
 */
@RestController
@RequestMapping("/papers")
public class PaperSearchController {

  private static final Logger log = LoggerFactory.getLogger(PaperSearchController.class);

  private final SearchSession searchSession;

  public PaperSearchController(SearchSession searchSession) {
    this.searchSession = searchSession;
  }

  /** Free-text search over one field, or over every field when {@code field} is omitted. */
  @GetMapping
  public DocumentSet search(
      @RequestParam("q") String query,
      @RequestParam(name = "field", required = false) @Nullable String field,
      @RequestParam(name = "page", required = false) @Nullable Integer page,
      @RequestParam(name = "size", required = false) @Nullable Integer size,
      @RequestParam(name = "order", required = false) @Nullable String order) {
    @Nullable SearchField searchField =
        field == null || field.isBlank() || "all".equalsIgnoreCase(field)
            ? null
            : SearchField.fromValue(field);
    SimpleQuery simple =
        new SimpleQuery(
            query,
            searchField,
            AdvancedSearchRequest.toPage(page, size),
            AdvancedSearchRequest.checkOrder(order));
    log.debug("Simple search: {}", simple);
    return searchSession.search(simple);
  }

  @PostMapping("/search")
  public DocumentSet advancedSearch(@Valid @RequestBody AdvancedSearchRequest request) {
    return searchSession.search(request.toQuery());
  }

  @GetMapping("/health")
  public HealthStatus health() {
    return new HealthStatus(searchSession.clusterAvailable());
  }

  @GetMapping("/{id}")
  public Document document(@PathVariable("id") String id) {
    return searchSession.getDocument(id);
  }

  /** Body of the health endpoint. */
  public record HealthStatus(boolean clusterAvailable) {}
}
