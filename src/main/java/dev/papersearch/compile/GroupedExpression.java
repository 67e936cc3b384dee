package dev.papersearch.compile;

import dev.papersearch.query.FieldedSearchTerm;
import dev.papersearch.query.Operator;

/**
 * Precedence-resolved form of a clause list: a binary tree whose leaves are the original clauses.
 *
 * <p>Built per compilation by {@link PrecedenceGrouper} and consumed by {@link
 * ExpressionTreeCompiler}; never stored.
 */
public sealed interface GroupedExpression
    permits GroupedExpression.Leaf, GroupedExpression.Group, GroupedExpression.MatchAll {

  /** A single clause. */
  record Leaf(FieldedSearchTerm term) implements GroupedExpression {

    @Override
    public String toString() {
      return term.field().value() + ":" + term.term();
    }
  }

  /** {@code left operator right}. A NOT group means "left and not right". */
  record Group(GroupedExpression left, Operator operator, GroupedExpression right)
      implements GroupedExpression {

    @Override
    public String toString() {
      return "(" + left + " " + operator + " " + right + ")";
    }
  }

  /** Stands in for an empty clause list. */
  record MatchAll() implements GroupedExpression {

    @Override
    public String toString() {
      return "*";
    }
  }
}
