package dev.papersearch.compile;

import dev.papersearch.query.FieldedSearchList;
import dev.papersearch.query.FieldedSearchTerm;
import dev.papersearch.query.Operator;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Resolves an ordered, operator-joined clause list into a precedence-correct binary tree.
 *
 * <p>Precedence is NOT over AND over OR. The list is folded in three left-to-right passes, one per
 * operator in precedence order; each pass merges every element joined by that operator into its
 * left neighbour, so chains are left-associative: {@code a OR b OR c} groups as {@code (a OR b) OR
 * c}.
 *
 * <p>For example {@code [A, OR B, NOT C, AND D]} groups as {@code (A OR ((B NOT C) AND D))}.
 *
 * <p>Stateless and thread-safe.
 */
public final class PrecedenceGrouper {

  private static final List<Operator> PRECEDENCE = List.of(Operator.NOT, Operator.AND, Operator.OR);

  private PrecedenceGrouper() {}

  /**
   * Groups the clauses of a query.
   *
   * @param terms the clauses; every clause after the first must carry an operator
   * @return {@link GroupedExpression.MatchAll} for an empty list, a bare leaf for a single clause,
   *     otherwise a single group covering every clause
   * @throws IllegalArgumentException if a non-leading clause has no operator
   */
  public static GroupedExpression group(FieldedSearchList terms) {
    if (terms.isEmpty()) {
      return new GroupedExpression.MatchAll();
    }

    List<Joined> elements = new ArrayList<>(terms.size());
    for (int i = 0; i < terms.size(); i++) {
      FieldedSearchTerm term = terms.get(i);
      // The leading clause's operator has no left operand and is ignored.
      @Nullable Operator operator = i == 0 ? null : term.operator();
      if (i > 0 && operator == null) {
        throw new IllegalArgumentException("Clause " + i + " (" + term + ") has no operator");
      }
      elements.add(new Joined(operator, new GroupedExpression.Leaf(term)));
    }

    for (Operator operator : PRECEDENCE) {
      elements = fold(elements, operator);
    }

    if (elements.size() != 1) {
      throw new IllegalStateException("Grouping left " + elements.size() + " roots: " + elements);
    }
    return elements.get(0).expression();
  }

  /** Collapses every element joined by {@code operator} into its left neighbour. */
  private static List<Joined> fold(List<Joined> elements, Operator operator) {
    List<Joined> folded = new ArrayList<>(elements.size());
    for (Joined element : elements) {
      if (element.operator() == operator && !folded.isEmpty()) {
        Joined left = folded.remove(folded.size() - 1);
        folded.add(
            new Joined(
                left.operator(),
                new GroupedExpression.Group(left.expression(), operator, element.expression())));
      } else {
        folded.add(element);
      }
    }
    return folded;
  }

  /** An expression together with the operator joining it to its left neighbour. */
  private record Joined(@Nullable Operator operator, GroupedExpression expression) {}
}
