package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.api.LogicalOperator;
import io.github.cyfko.proplogic.core.config.PatternConfig;
import io.github.cyfko.proplogic.core.exception.LogicSyntaxException;
import io.github.cyfko.proplogic.core.exception.SyntaxErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single-pass lexer for propositional expressions.
 * <p>
 * Recognised input:
 * </p>
 * <ul>
 *   <li>Identifiers {@code [A-Za-z_][A-Za-z0-9_]*}; the whole words {@code AND}, {@code OR}, {@code NOT},
 *       {@code IMPLIES} and {@code BICONDITIONAL} become operator tokens (case-sensitive)</li>
 *   <li>The symbolic aliases {@code ∧ ∨ ¬ → ↔}, mapped to the same operator tokens</li>
 *   <li>Parentheses</li>
 *   <li>Whitespace, which only separates tokens</li>
 * </ul>
 * <p>
 * Aliases are resolved per token, never by rewriting the raw text, so a variable such as
 * {@code ORDER} or {@code NOTE} is never mistaken for an operator.
 * </p>
 *
 * <pre>{@code
 * Tokenizer.tokenize("NOT (P ∧ Q)");
 * // [NOT 'NOT'@0, LPAREN '('@4, VARIABLE 'P'@5, AND '∧'@7, VARIABLE 'Q'@9, RPAREN ')'@10, END ''@11]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Tokenizer {

    private Tokenizer() {}

    /**
     * @param expression the raw expression text
     * @return the tokens in source order, always terminated by an {@link TokenType#END} token
     * @throws LogicSyntaxException with kind {@link SyntaxErrorKind#UNEXPECTED_TOKEN} on any
     *                              unrecognised character sequence
     */
    public static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        int length = expression.length();
        int i = 0;

        while (i < length) {
            char c = expression.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "(", i++));
                continue;
            }
            if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")", i++));
                continue;
            }

            Optional<LogicalOperator> alias = LogicalOperator.fromSymbol(c);
            if (alias.isPresent()) {
                tokens.add(new Token(TokenType.of(alias.get()), String.valueOf(c), i++));
                continue;
            }

            if (PatternConfig.isIdentifierStart(c)) {
                int start = i;
                while (i < length && PatternConfig.isIdentifierPart(expression.charAt(i))) {
                    i++;
                }
                String word = expression.substring(start, i);
                TokenType type = LogicalOperator.fromKeyword(word).map(TokenType::of).orElse(TokenType.VARIABLE);
                tokens.add(new Token(type, word, start));
                continue;
            }

            int start = i++;
            while (i < length && !isBoundary(expression.charAt(i))) {
                i++;
            }
            String offending = expression.substring(start, i);
            throw new LogicSyntaxException(SyntaxErrorKind.UNEXPECTED_TOKEN,
                    String.format("Unexpected token '%s' at column %d", offending, start), offending, start);
        }

        tokens.add(new Token(TokenType.END, "", length));
        return tokens;
    }

    private static boolean isBoundary(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')'
                || PatternConfig.isIdentifierStart(c)
                || LogicalOperator.fromSymbol(c).isPresent();
    }
}
