package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.exception.LogicSyntaxException;

/**
 * Parser transforming propositional expression text into an {@link Expression} tree.
 *
 * <h2>Grammar (EBNF)</h2>
 * <p>Precedence from lowest to highest:</p>
 * <pre>
 * expr          = biconditional ;
 * biconditional = implication { ("BICONDITIONAL"|"↔") implication } ;
 * implication   = disjunction { ("IMPLIES"|"→") disjunction } ;
 * disjunction   = conjunction { ("OR"|"∨") conjunction } ;
 * conjunction   = negation { ("AND"|"∧") negation } ;
 * negation      = ("NOT"|"¬") negation | atom ;
 * atom          = IDENT | "(" expr ")" ;
 * IDENT         = [A-Za-z_][A-Za-z0-9_]*
 * </pre>
 * <p>
 * AND and OR associate to the left; IMPLIES and BICONDITIONAL associate to the right, so
 * {@code "P IMPLIES Q IMPLIES R"} reads as {@code P IMPLIES (Q IMPLIES R)}. Keywords are
 * case-sensitive whole words; {@code "ANDROID"} is a variable.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * Expression e1 = parser.parse("P AND Q");
 * Expression e2 = parser.parse("¬P ∨ Q");              // symbolic aliases
 * Expression e3 = parser.parse("(P → Q) ↔ (¬Q → ¬P)"); // contraposition
 * }</pre>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Must produce identical trees for identical input (parsing is pure)</li>
 *   <li>Must return immutable trees safe to share between threads</li>
 *   <li>Must report failures as {@link LogicSyntaxException} with a precise kind</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionParser {

    /**
     * Parses an expression.
     *
     * @param expression the expression text
     * @return the root of the parsed tree
     * @throws LogicSyntaxException if the expression is {@code null}, blank, malformed or too complex
     */
    Expression parse(String expression) throws LogicSyntaxException;
}
