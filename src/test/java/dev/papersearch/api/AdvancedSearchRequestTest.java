package dev.papersearch.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.papersearch.query.AdvancedQuery;
import dev.papersearch.query.FieldedSearchTerm;
import dev.papersearch.query.Page;
import dev.papersearch.query.SearchField;
import java.util.List;
import org.junit.jupiter.api.Test;

class AdvancedSearchRequestTest {

  @Test
  void emptyRequestMapsToUnconstrainedFirstPage() {
    AdvancedQuery query =
        new AdvancedSearchRequest(null, null, null, null, null, null, null).toQuery();

    assertThat(query.terms().isEmpty()).isTrue();
    assertThat(query.dateRange().hasBounds()).isFalse();
    assertThat(query.primaryClassification().isEmpty()).isTrue();
    assertThat(query.page()).isEqualTo(Page.first());
  }

  @Test
  void termsKeepTheirOrder() {
    List<FieldedSearchTerm> terms =
        List.of(
            FieldedSearchTerm.leading(SearchField.TITLE, "muon"),
            FieldedSearchTerm.leading(SearchField.AUTHOR, "Wang"));

    AdvancedQuery query =
        new AdvancedSearchRequest(terms, null, null, null, 2, 50, "").toQuery();

    assertThat(query.terms().terms()).containsExactlyElementsOf(terms);
    assertThat(query.page()).isEqualTo(new Page(2, 50));
    assertThat(query.order()).isNull();
  }

  @Test
  void offeredOrdersPassTheCheck() {
    assertThat(AdvancedSearchRequest.checkOrder(null)).isNull();
    assertThat(AdvancedSearchRequest.checkOrder("")).isEmpty();
    assertThat(AdvancedSearchRequest.checkOrder("-submitted_date")).isEqualTo("-submitted_date");
  }

  @Test
  void orderWithoutFieldFailsTheCheck() {
    assertThatThrownBy(() -> AdvancedSearchRequest.checkOrder("-"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("got: -");
  }

  @Test
  void pageSizeOutsideOfferedChoicesThrows() {
    assertThatThrownBy(() -> AdvancedSearchRequest.toPage(1, 10))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("size must be one of [25, 50, 100]");
  }
}
