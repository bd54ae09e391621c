package io.github.cyfko.proplogic.core.config;

import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for propositional variable names.
 * <p>
 * A variable name starts with an ASCII letter or underscore, followed by ASCII letters, digits or
 * underscores. Names are case-sensitive.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    public static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
