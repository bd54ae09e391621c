package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.api.ExpressionParser;
import io.github.cyfko.proplogic.core.parsing.Tokenizer;

import java.util.Objects;

/**
 * Exception thrown when a propositional expression cannot be tokenized or parsed.
 * <p>
 * Every instance carries a {@link SyntaxErrorKind} so that callers (CLI, HTTP handlers, ...) can map
 * failures to their own presentation without parsing messages. When the failure can be pinned to a
 * location, {@link #getColumn()} holds the 0-based column and {@link #getOffendingText()} the source
 * text found there.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("");          // EMPTY_EXPRESSION   "Expression cannot be null or empty"
 * parser.parse("P & Q");     // UNEXPECTED_TOKEN   "Unexpected token '&' at column 2"
 * parser.parse("(P AND Q");  // UNBALANCED_PARENS  "Unbalanced parentheses: '(' at column 0 is never closed"
 * parser.parse("P AND Q)");  // UNBALANCED_PARENS  "Unbalanced parentheses: unmatched ')' at column 7"
 * parser.parse("P Q");       // TRAILING_INPUT     "Unexpected trailing input 'Q' at column 2"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ExpressionParser
 * @see Tokenizer
 */
public class LogicSyntaxException extends RuntimeException {

    private final SyntaxErrorKind kind;
    private final String offendingText;
    private final int column;

    /**
     * Creates an exception that is not tied to a source location.
     *
     * @param kind    the failure category
     * @param message the description of the failure
     */
    public LogicSyntaxException(SyntaxErrorKind kind, String message) {
        this(kind, message, null, -1);
    }

    /**
     * Creates an exception pointing at the offending source text.
     *
     * @param kind          the failure category
     * @param message       the description of the failure, should include the column
     * @param offendingText the source text found at the failure location, may be {@code null}
     * @param column        the 0-based column of the failure, or {@code -1} if unknown
     */
    public LogicSyntaxException(SyntaxErrorKind kind, String message, String offendingText, int column) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.offendingText = offendingText;
        this.column = column;
    }

    public SyntaxErrorKind getKind() {
        return kind;
    }

    public String getOffendingText() {
        return offendingText;
    }

    /**
     * @return the 0-based column of the failure, or {@code -1} when the failure has no location
     */
    public int getColumn() {
        return column;
    }
}
