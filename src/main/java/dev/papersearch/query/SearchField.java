package dev.papersearch.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;

/**
 * Searchable paper-metadata fields, each bound to the index sub-fields it is matched against.
 *
 * <p>Fields indexed under more than one analyzer (for example {@code title.tex} and {@code
 * title.english}) list every representation; a clause on such a field matches if any of them
 * matches. The sub-field names must exist in {@code mappings/DocumentMapping.json}.
 */
public enum SearchField {
  AUTHOR("author", "authors_freeform", "authors.full_name"),
  TITLE("title", "title.tex", "title.english"),
  ABSTRACT("abstract", "abstract.tex", "abstract.english"),
  COMMENTS("comments", "comments"),
  JOURNAL_REF("journal_ref", "journal_ref"),
  ACM_CLASS("acm_class", "acm_class"),
  MSC_CLASS("msc_class", "msc_class"),
  REPORT_NUM("report_num", "report_num"),
  PAPER_ID("paper_id", "paper_id", "paper_id_v"),
  DOI("doi", "doi"),
  ORCID("orcid", "authors.orcid"),
  AUTHOR_ID("author_id", "authors.author_id");

  /** Every field a query may name, in the order the free-text search expands them. */
  public static final List<SearchField> ALL_SEARCH_FIELDS = List.of(values());

  private final String value;
  private final List<String> indexFields;

  SearchField(String value, String... indexFields) {
    this.value = value;
    this.indexFields = List.of(indexFields);
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Index sub-fields this field is matched against, never empty. */
  public List<String> indexFields() {
    return indexFields;
  }

  public boolean hasMultipleRepresentations() {
    return indexFields.size() > 1;
  }

  @JsonCreator
  public static SearchField fromValue(String value) {
    return Arrays.stream(values())
        .filter(field -> field.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Invalid search field: " + value));
  }
}
