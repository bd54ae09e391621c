package io.github.cyfko.proplogic.core.parsing;

import java.util.Objects;

/**
 * A lexical token with its source text and 0-based column.
 *
 * @param type   the lexical category
 * @param text   the source text, empty for {@link TokenType#END}
 * @param column the 0-based column of the first character
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String text, int column) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * @return the source text, or a readable placeholder for the end of input
     */
    public String describe() {
        return type == TokenType.END ? "end of expression" : "'" + text + "'";
    }
}
