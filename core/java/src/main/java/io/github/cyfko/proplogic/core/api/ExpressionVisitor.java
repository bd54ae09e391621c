package io.github.cyfko.proplogic.core.api;

/**
 * Visitor over the {@link Expression} node types.
 *
 * @param <R> the result type of the walk
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionVisitor<R> {

    R visitVar(Expression.Var node);

    R visitNot(Expression.Not node);

    R visitAnd(Expression.And node);

    R visitOr(Expression.Or node);

    R visitImplies(Expression.Implies node);

    R visitIff(Expression.Iff node);
}
