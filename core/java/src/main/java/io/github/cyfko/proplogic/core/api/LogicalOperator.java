package io.github.cyfko.proplogic.core.api;

import java.util.Arrays;
import java.util.Optional;

/**
 * The connectives of propositional logic understood by the engine.
 * <p>
 * Each operator knows its keyword, its single-character symbolic alias, its arity and its truth
 * function. The keyword and alias are interchangeable in expressions; both are matched at token
 * level only.
 * </p>
 *
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Keyword</th><th>Alias</th><th>Precedence</th><th>Associativity</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Negation</td><td>NOT</td><td>¬</td><td>5 (highest)</td><td>Right (prefix)</td></tr>
 * <tr><td>Conjunction</td><td>AND</td><td>∧</td><td>4</td><td>Left</td></tr>
 * <tr><td>Disjunction</td><td>OR</td><td>∨</td><td>3</td><td>Left</td></tr>
 * <tr><td>Implication</td><td>IMPLIES</td><td>→</td><td>2</td><td>Right</td></tr>
 * <tr><td>Biconditional</td><td>BICONDITIONAL</td><td>↔</td><td>1 (lowest)</td><td>Right</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum LogicalOperator {
    AND("AND", '∧', 2),
    OR("OR", '∨', 2),
    NOT("NOT", '¬', 1),
    IMPLIES("IMPLIES", '→', 2),
    BICONDITIONAL("BICONDITIONAL", '↔', 2);

    private final String keyword;
    private final char symbol;
    private final int arity;

    LogicalOperator(String keyword, char symbol, int arity) {
        this.keyword = keyword;
        this.symbol = symbol;
        this.arity = arity;
    }

    public String keyword() {
        return keyword;
    }

    public char symbol() {
        return symbol;
    }

    public int arity() {
        return arity;
    }

    /**
     * Applies the truth function of this operator.
     *
     * @param operands exactly {@link #arity()} truth values
     * @return the result of the connective
     * @throws IllegalArgumentException if the number of operands does not match the arity
     */
    public boolean apply(boolean... operands) {
        if (operands == null || operands.length != arity) {
            throw new IllegalArgumentException(String.format(
                    "Operator %s expects %d operand(s), got %d",
                    keyword, arity, operands == null ? 0 : operands.length));
        }
        return switch (this) {
            case NOT -> !operands[0];
            case AND -> operands[0] && operands[1];
            case OR -> operands[0] || operands[1];
            case IMPLIES -> !operands[0] || operands[1];
            case BICONDITIONAL -> operands[0] == operands[1];
        };
    }

    /**
     * Case-sensitive lookup by keyword.
     *
     * @param word a whole word from an expression
     * @return the operator spelled by {@code word}, if any
     */
    public static Optional<LogicalOperator> fromKeyword(String word) {
        return Arrays.stream(values()).filter(op -> op.keyword.equals(word)).findFirst();
    }

    public static Optional<LogicalOperator> fromSymbol(char c) {
        return Arrays.stream(values()).filter(op -> op.symbol == c).findFirst();
    }
}
