package dev.papersearch.query;

import java.util.Iterator;
import java.util.List;

/**
 * Ordered clauses of an advanced query. Order is significant: operators apply left to right.
 *
 * @param terms the clauses, leading clause first
 */
public record FieldedSearchList(List<FieldedSearchTerm> terms)
    implements Iterable<FieldedSearchTerm> {

  public FieldedSearchList {
    terms = terms == null ? List.of() : List.copyOf(terms);
  }

  public static FieldedSearchList of(FieldedSearchTerm... terms) {
    return new FieldedSearchList(List.of(terms));
  }

  public static FieldedSearchList empty() {
    return new FieldedSearchList(List.of());
  }

  public boolean isEmpty() {
    return terms.isEmpty();
  }

  public int size() {
    return terms.size();
  }

  public FieldedSearchTerm get(int index) {
    return terms.get(index);
  }

  @Override
  public Iterator<FieldedSearchTerm> iterator() {
    return terms.iterator();
  }
}
