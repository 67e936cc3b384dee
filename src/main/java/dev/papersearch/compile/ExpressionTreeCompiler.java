package dev.papersearch.compile;

import dev.papersearch.error.QueryError;
import java.util.List;
import java.util.Optional;

/**
 * Lowers a {@link GroupedExpression} to boolean combinators, mirroring its shape exactly.
 *
 * <ul>
 *   <li>{@code l AND r}: must over both sides
 *   <li>{@code l OR r}: should over both sides, at least one has to match
 *   <li>{@code l NOT r}: must over {@code l}, must-not over {@code r}
 * </ul>
 *
 * <p>NOT is always binary: it modifies its right operand and is joined to the left one. No
 * flattening or re-association happens here.
 */
public final class ExpressionTreeCompiler {

  private ExpressionTreeCompiler() {}

  /**
   * @return the compiled tree, or empty for {@link GroupedExpression.MatchAll}
   * @throws QueryError if the tree is malformed or a leaf has blank text
   */
  public static Optional<CompiledQuery> compile(GroupedExpression expression) {
    if (expression instanceof GroupedExpression.MatchAll) {
      return Optional.empty();
    }
    return Optional.of(lower(expression));
  }

  private static CompiledQuery lower(GroupedExpression expression) {
    if (expression instanceof GroupedExpression.Leaf leaf) {
      if (leaf.term() == null) {
        throw new QueryError("Malformed query: empty clause");
      }
      return ClauseCompiler.compile(leaf.term());
    }
    if (expression instanceof GroupedExpression.Group group) {
      return lowerGroup(group);
    }
    // MatchAll is only meaningful at the root.
    throw new QueryError("Malformed query: unexpected " + expression + " inside a group");
  }

  private static CompiledQuery lowerGroup(GroupedExpression.Group group) {
    if (group.operator() == null) {
      throw new QueryError("Malformed query: group without operator");
    }
    if (group.left() == null) {
      throw new QueryError("Malformed query: " + group.operator() + " without left operand");
    }
    if (group.right() == null) {
      throw new QueryError("Malformed query: " + group.operator() + " without right operand");
    }
    CompiledQuery left = lower(group.left());
    CompiledQuery right = lower(group.right());
    return switch (group.operator()) {
      case AND -> CompiledQuery.Bool.must(List.of(left, right));
      case OR -> CompiledQuery.Bool.should(List.of(left, right));
      case NOT -> CompiledQuery.Bool.mustNot(left, right);
    };
  }
}
