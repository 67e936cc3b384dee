package dev.papersearch.query;

import org.jspecify.annotations.Nullable;

/**
 * Hierarchical classification facet. Absent (or blank) levels widen the match.
 *
 * @param group subject group id, e.g. {@code cs} or {@code physics}
 * @param archive optional archive id within the group, e.g. {@code astro-ph}
 * @param category optional category id within the archive, e.g. {@code astro-ph.HE}
 */
public record Classification(String group, @Nullable String archive, @Nullable String category) {

  public Classification {
    if (group == null || group.isBlank()) {
      throw new IllegalArgumentException("Classification group must not be blank");
    }
    archive = blankToNull(archive);
    category = blankToNull(category);
  }

  public Classification(String group) {
    this(group, null, null);
  }

  private static @Nullable String blankToNull(@Nullable String level) {
    return level == null || level.isBlank() ? null : level;
  }
}
