package io.github.cyfko.proplogic.core.exception;

/**
 * Exception thrown when an expression references a variable that the assignment does not cover.
 * <p>
 * During truth-table generation this exception is caught per row and stored in the row instead of
 * aborting the table. Everywhere else it propagates to the caller.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UndefinedVariableException extends RuntimeException {

    private final String variableName;

    /**
     * @param variableName the referenced but unassigned variable
     */
    public UndefinedVariableException(String variableName) {
        super("Variable '" + variableName + "' is referenced by the expression but has no assigned value");
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
