package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.api.LogicalOperator;

/**
 * Lexical categories produced by the {@link Tokenizer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    VARIABLE(null),
    AND(LogicalOperator.AND),
    OR(LogicalOperator.OR),
    NOT(LogicalOperator.NOT),
    IMPLIES(LogicalOperator.IMPLIES),
    BICONDITIONAL(LogicalOperator.BICONDITIONAL),
    LPAREN(null),
    RPAREN(null),
    END(null);

    private final LogicalOperator operator;

    TokenType(LogicalOperator operator) {
        this.operator = operator;
    }

    /**
     * @return the connective this token spells, or {@code null} for non-operator tokens
     */
    public LogicalOperator operator() {
        return operator;
    }

    static TokenType of(LogicalOperator operator) {
        return switch (operator) {
            case AND -> AND;
            case OR -> OR;
            case NOT -> NOT;
            case IMPLIES -> IMPLIES;
            case BICONDITIONAL -> BICONDITIONAL;
        };
    }
}
