package dev.papersearch.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** An author or owner of a paper. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Person(
    @JsonProperty("full_name") String fullName,
    @JsonProperty("first_name") @Nullable String firstName,
    @JsonProperty("last_name") @Nullable String lastName,
    @Nullable String suffix,
    List<String> affiliation,
    @Nullable String orcid,
    @JsonProperty("author_id") @Nullable String authorId) {

  public Person {
    affiliation = affiliation == null ? List.of() : List.copyOf(affiliation);
  }

  public Person(String fullName) {
    this(fullName, null, null, null, List.of(), null, null);
  }
}
