package dev.papersearch.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.papersearch.config.GlobalExceptionHandler;
import dev.papersearch.document.DocumentSet;
import dev.papersearch.document.PageMetadata;
import dev.papersearch.error.DocumentNotFound;
import dev.papersearch.error.IndexConnectionError;
import dev.papersearch.error.OutsideAllowedRange;
import dev.papersearch.fixture.DocumentBuilder;
import dev.papersearch.index.SearchSession;
import dev.papersearch.query.AdvancedQuery;
import dev.papersearch.query.DateType;
import dev.papersearch.query.Operator;
import dev.papersearch.query.Page;
import dev.papersearch.query.SearchField;
import dev.papersearch.query.SearchQuery;
import dev.papersearch.query.SimpleQuery;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

@ExtendWith(MockitoExtension.class)
class PaperSearchControllerTest {

  private static final DocumentSet ONE_HIT =
      new DocumentSet(
          1,
          List.of(new DocumentBuilder().paperId("1811.00536").hit(2.0, null).build()),
          new PageMetadata(0, 1, 25, 1, 1, 400));

  @Mock private SearchSession searchSession;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    LocalValidatorFactoryBean validator = new LocalValidatorFactoryBean();
    validator.afterPropertiesSet();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new PaperSearchController(searchSession))
            .setControllerAdvice(new GlobalExceptionHandler())
            .setValidator(validator)
            .build();
  }

  @Test
  void simpleSearchOnFieldReturnsDocumentSet() throws Exception {
    when(searchSession.search(any())).thenReturn(ONE_HIT);

    mockMvc
        .perform(get("/papers").param("q", "muon").param("field", "title").param("size", "50"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.results[0].paper_id").value("1811.00536"))
        .andExpect(jsonPath("$.metadata.maxPages").value(400));

    ArgumentCaptor<SearchQuery> query = ArgumentCaptor.forClass(SearchQuery.class);
    verify(searchSession).search(query.capture());
    assertThat(query.getValue())
        .isEqualTo(new SimpleQuery("muon", SearchField.TITLE, new Page(1, 50), null));
  }

  @Test
  void allFieldSearchesEveryField() throws Exception {
    when(searchSession.search(any())).thenReturn(ONE_HIT);

    mockMvc.perform(get("/papers").param("q", "muon").param("field", "all"))
        .andExpect(status().isOk());

    ArgumentCaptor<SearchQuery> query = ArgumentCaptor.forClass(SearchQuery.class);
    verify(searchSession).search(query.capture());
    assertThat(((SimpleQuery) query.getValue()).field()).isNull();
  }

  @Test
  void unsupportedPageSizeIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/papers").param("q", "muon").param("size", "30"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("size must be one of [25, 50, 100]"));

    verifyNoInteractions(searchSession);
  }

  @Test
  void orderWithoutFieldIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/papers").param("q", "muon").param("order", "-"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(searchSession);
  }

  @Test
  void descendingSubmissionOrderIsPassedThrough() throws Exception {
    when(searchSession.search(any())).thenReturn(ONE_HIT);

    mockMvc
        .perform(get("/papers").param("q", "muon").param("order", "-submitted_date"))
        .andExpect(status().isOk());

    ArgumentCaptor<SearchQuery> query = ArgumentCaptor.forClass(SearchQuery.class);
    verify(searchSession).search(query.capture());
    assertThat(query.getValue().order()).isEqualTo("-submitted_date");
  }

  @Test
  void unknownFieldIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/papers").param("q", "muon").param("field", "venue"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void pageOutOfRangeIsBadRequestWithMessage() throws Exception {
    when(searchSession.search(any()))
        .thenThrow(new OutsideAllowedRange("Requested page 401, but max is 400"));

    mockMvc
        .perform(get("/papers").param("q", "muon").param("page", "401"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Requested page 401, but max is 400"));
  }

  @Test
  void advancedSearchBindsClausesAndFilters() throws Exception {
    when(searchSession.search(any())).thenReturn(ONE_HIT);

    mockMvc
        .perform(
            post("/papers/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "terms": [
                        {"field": "title", "term": "muon"},
                        {"operator": "OR", "field": "abstract", "term": "gluon"}
                      ],
                      "dateRange": {
                        "startDate": "2006-02-05T00:00:00Z",
                        "dateType": "announced_date_first"
                      },
                      "primaryClassification": [{"group": "physics", "archive": "hep-th"}],
                      "size": 100,
                      "order": "-submitted_date"
                    }
                    """))
        .andExpect(status().isOk());

    ArgumentCaptor<SearchQuery> captured = ArgumentCaptor.forClass(SearchQuery.class);
    verify(searchSession).search(captured.capture());
    AdvancedQuery query = (AdvancedQuery) captured.getValue();
    assertThat(query.terms().size()).isEqualTo(2);
    assertThat(query.terms().get(1).operator()).isEqualTo(Operator.OR);
    assertThat(query.terms().get(1).field()).isEqualTo(SearchField.ABSTRACT);
    assertThat(query.dateRange().dateType()).isEqualTo(DateType.ANNOUNCED_DATE_FIRST);
    assertThat(query.primaryClassification().classifications().get(0).archive())
        .isEqualTo("hep-th");
    assertThat(query.page()).isEqualTo(new Page(1, 100));
    assertThat(query.order()).isEqualTo("-submitted_date");
  }

  @Test
  void advancedSearchRejectsUnknownOrder() throws Exception {
    mockMvc
        .perform(
            post("/papers/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"terms\": [], \"order\": \"title\"}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(searchSession);
  }

  @Test
  void getDocumentReturnsDocument() throws Exception {
    when(searchSession.getDocument("1811.00536"))
        .thenReturn(new DocumentBuilder().paperId("1811.00536").build());

    mockMvc
        .perform(get("/papers/1811.00536"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.paper_id").value("1811.00536"));
  }

  @Test
  void missingDocumentIsNotFound() throws Exception {
    when(searchSession.getDocument("0000.00000"))
        .thenThrow(new DocumentNotFound("No such document"));

    mockMvc.perform(get("/papers/0000.00000")).andExpect(status().isNotFound());
  }

  @Test
  void unreachableIndexIsServiceUnavailable() throws Exception {
    when(searchSession.search(any()))
        .thenThrow(new IndexConnectionError("Problem communicating with ES: Connection refused"));

    mockMvc
        .perform(get("/papers").param("q", "muon"))
        .andExpect(status().isServiceUnavailable());
  }

  @Test
  void healthReportsClusterAvailability() throws Exception {
    when(searchSession.clusterAvailable()).thenReturn(true);

    mockMvc
        .perform(get("/papers/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.clusterAvailable").value(true));
  }
}
