package io.github.cyfko.proplogic.core.evaluation;

import io.github.cyfko.proplogic.core.api.Expression;
import io.github.cyfko.proplogic.core.api.ExpressionVisitor;
import io.github.cyfko.proplogic.core.api.LogicalOperator;
import io.github.cyfko.proplogic.core.exception.UndefinedVariableException;

import java.util.Map;
import java.util.Objects;

/**
 * Evaluates an {@link Expression} under an assignment of truth values.
 * <p>
 * Both operands of a binary connective are always evaluated, left first, so a reference to an
 * unassigned variable is reported whatever the values of the other variables. A missing key and a
 * {@code null} value are treated alike.
 * </p>
 *
 * <pre>{@code
 * boolean r = ExpressionEvaluator.evaluate(parser.parse("P IMPLIES Q"), Map.of("P", true, "Q", false)); // false
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionEvaluator implements ExpressionVisitor<Boolean> {

    private final Map<String, Boolean> assignment;

    private ExpressionEvaluator(Map<String, Boolean> assignment) {
        this.assignment = assignment;
    }

    /**
     * @param expression the tree to evaluate
     * @param assignment truth values by variable name
     * @return the truth value of {@code expression}
     * @throws UndefinedVariableException if the expression references a variable missing from {@code assignment}
     */
    public static boolean evaluate(Expression expression, Map<String, Boolean> assignment) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(assignment, "assignment");
        return expression.accept(new ExpressionEvaluator(assignment));
    }

    @Override
    public Boolean visitVar(Expression.Var node) {
        Boolean value = assignment.get(node.name());
        if (value == null) {
            throw new UndefinedVariableException(node.name());
        }
        return value;
    }

    @Override
    public Boolean visitNot(Expression.Not node) {
        return LogicalOperator.NOT.apply(node.operand().accept(this));
    }

    @Override
    public Boolean visitAnd(Expression.And node) {
        return binary(node);
    }

    @Override
    public Boolean visitOr(Expression.Or node) {
        return binary(node);
    }

    @Override
    public Boolean visitImplies(Expression.Implies node) {
        return binary(node);
    }

    @Override
    public Boolean visitIff(Expression.Iff node) {
        return binary(node);
    }

    private boolean binary(Expression.BinaryExpression node) {
        boolean left = node.left().accept(this);
        boolean right = node.right().accept(this);
        return node.operator().apply(left, right);
    }
}
