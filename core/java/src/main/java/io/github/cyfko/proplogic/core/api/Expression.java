package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.config.PatternConfig;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract syntax tree of a propositional expression.
 * <p>
 * Nodes are immutable records built bottom-up by an {@link ExpressionParser}, so a tree can never
 * contain a cycle and can be shared freely between threads.
 * </p>
 *
 * <h2>Node Types</h2>
 * <ul>
 *   <li>{@link Var} - a named propositional variable</li>
 *   <li>{@link Not} - negation of a sub-expression</li>
 *   <li>{@link And}, {@link Or}, {@link Implies}, {@link Iff} - binary connectives</li>
 * </ul>
 *
 * <p>{@link #toString()} renders a fully parenthesised canonical form using keyword operators, e.g.
 * {@code "P AND Q OR NOT R"} renders as {@code "((P AND Q) OR NOT R)"}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Expression permits Expression.Var, Expression.Not, Expression.BinaryExpression {

    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Returns the names of the variables referenced by this expression, in order of first occurrence.
     *
     * @return an immutable list of distinct variable names
     */
    default List<String> variables() {
        Set<String> names = new LinkedHashSet<>();
        collectVariables(this, names);
        return List.copyOf(names);
    }

    private static void collectVariables(Expression node, Set<String> names) {
        if (node instanceof Var variable) {
            names.add(variable.name());
        } else if (node instanceof Not not) {
            collectVariables(not.operand(), names);
        } else if (node instanceof BinaryExpression binary) {
            collectVariables(binary.left(), names);
            collectVariables(binary.right(), names);
        }
    }

    /**
     * Common shape of the four binary connectives.
     */
    sealed interface BinaryExpression extends Expression permits And, Or, Implies, Iff {
        Expression left();

        Expression right();

        LogicalOperator operator();
    }

    record Var(String name) implements Expression {
        public Var {
            if (name == null || !PatternConfig.IDENTIFIER_PATTERN.matcher(name).matches()) {
                throw new IllegalArgumentException("Variable name must be a non-empty identifier, got: " + name);
            }
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitVar(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Not(Expression operand) implements Expression {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public String toString() {
            return "NOT " + operand;
        }
    }

    record And(Expression left, Expression right) implements BinaryExpression {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public LogicalOperator operator() {
            return LogicalOperator.AND;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitAnd(this);
        }

        @Override
        public String toString() {
            return render(this);
        }
    }

    record Or(Expression left, Expression right) implements BinaryExpression {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public LogicalOperator operator() {
            return LogicalOperator.OR;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitOr(this);
        }

        @Override
        public String toString() {
            return render(this);
        }
    }

    record Implies(Expression left, Expression right) implements BinaryExpression {
        public Implies {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public LogicalOperator operator() {
            return LogicalOperator.IMPLIES;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitImplies(this);
        }

        @Override
        public String toString() {
            return render(this);
        }
    }

    record Iff(Expression left, Expression right) implements BinaryExpression {
        public Iff {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public LogicalOperator operator() {
            return LogicalOperator.BICONDITIONAL;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitIff(this);
        }

        @Override
        public String toString() {
            return render(this);
        }
    }

    private static String render(BinaryExpression node) {
        return "(" + node.left() + " " + node.operator().keyword() + " " + node.right() + ")";
    }
}
