package io.github.cyfko.proplogic.core.exception;

import java.util.Objects;

/**
 * Exception thrown when the inputs of an analysis are well-formed expressions but cannot be used
 * together.
 * <p>
 * Typical causes are variable lists with duplicates or invalid names, an empty variable list, more
 * variables than the table policy permits, or two truth tables that do not share the same variables.
 * </p>
 *
 * <pre>{@code
 * VariableList.of(List.of("P", "P"));
 * // → DUPLICATE_VARIABLE "Duplicate variable name 'P' at index 1"
 *
 * PropertyAnalyzer.checkEquivalence(tableOverPQ, tableOverQP);
 * // → VARIABLE_MISMATCH "Truth tables do not share the same variables: [P, Q] vs [Q, P]"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LogicValidationException extends RuntimeException {

    private final ValidationErrorKind kind;

    /**
     * @param kind    the failure category
     * @param message the description of the cause of the exception
     */
    public LogicValidationException(ValidationErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ValidationErrorKind getKind() {
        return kind;
    }
}
