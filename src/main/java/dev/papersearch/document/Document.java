package dev.papersearch.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Paper metadata as stored in the search index.
 *
 * <p>{@code score} and {@code type} are never indexed: they are attached to documents read back
 * from a search hit (relevance score and backend type tag) and omitted when null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Document(
    @Nullable String id,
    @JsonProperty("paper_id") String paperId,
    @JsonProperty("paper_id_v") @Nullable String paperIdV,
    @Nullable Integer version,
    @Nullable String title,
    @JsonProperty("abstract") @Nullable String abstractText,
    List<Person> authors,
    @JsonProperty("authors_freeform") @Nullable String authorsFreeform,
    @Nullable String comments,
    @JsonProperty("journal_ref") @Nullable String journalRef,
    @JsonProperty("report_num") @Nullable String reportNum,
    List<String> doi,
    @JsonProperty("msc_class") List<String> mscClass,
    @JsonProperty("acm_class") List<String> acmClass,
    @JsonProperty("primary_classification") @Nullable ClassificationRecord primaryClassification,
    @JsonProperty("secondary_classification") List<ClassificationRecord> secondaryClassification,
    @JsonProperty("submitted_date") @Nullable String submittedDate,
    @JsonProperty("announced_date_first") @Nullable String announcedDateFirst,
    @JsonProperty("is_current") @Nullable Boolean isCurrent,
    @JsonProperty("is_withdrawn") @Nullable Boolean isWithdrawn,
    @Nullable Double score,
    @Nullable String type) {

  public Document {
    authors = authors == null ? List.of() : List.copyOf(authors);
    doi = doi == null ? List.of() : List.copyOf(doi);
    mscClass = mscClass == null ? List.of() : List.copyOf(mscClass);
    acmClass = acmClass == null ? List.of() : List.copyOf(acmClass);
    secondaryClassification =
        secondaryClassification == null ? List.of() : List.copyOf(secondaryClassification);
  }

  /** Identifier the document is indexed under: {@code id} when set, otherwise {@code paper_id}. */
  public String indexId() {
    if (id != null && !id.isBlank()) {
      return id;
    }
    if (paperId == null || paperId.isBlank()) {
      throw new IllegalStateException("Document has neither id nor paper_id");
    }
    return paperId;
  }

  /** Copy of this document annotated with a search hit's score and type tag. */
  public Document withHit(@Nullable Double score, @Nullable String type) {
    return new Document(
        id,
        paperId,
        paperIdV,
        version,
        title,
        abstractText,
        authors,
        authorsFreeform,
        comments,
        journalRef,
        reportNum,
        doi,
        mscClass,
        acmClass,
        primaryClassification,
        secondaryClassification,
        submittedDate,
        announcedDateFirst,
        isCurrent,
        isWithdrawn,
        score,
        type);
  }
}
