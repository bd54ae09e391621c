package io.github.cyfko.proplogic.core.exception;

/**
 * Categories of failures reported by {@link LogicSyntaxException}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum SyntaxErrorKind {
    /** A character sequence or token that cannot appear at its position. */
    UNEXPECTED_TOKEN,
    /** An opening parenthesis without its closing counterpart, or the reverse. */
    UNBALANCED_PARENS,
    /** Tokens left over after a complete expression was parsed. */
    TRAILING_INPUT,
    /** A {@code null}, empty or blank expression. */
    EMPTY_EXPRESSION,
    /** Expression length or nesting depth beyond the configured parser policy. */
    EXPRESSION_TOO_COMPLEX
}
