package io.github.cyfko.proplogic.core.exception;

/**
 * Categories of failures reported by {@link LogicValidationException}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ValidationErrorKind {
    /** Two truth tables built over different variable lists or row counts. */
    VARIABLE_MISMATCH,
    DUPLICATE_VARIABLE,
    EMPTY_VARIABLE_LIST,
    /** A variable name that is not an identifier, or that collides with an operator keyword. */
    INVALID_VARIABLE_NAME,
    /** More variables than the table policy allows enumerating. */
    TOO_MANY_VARIABLES
}
