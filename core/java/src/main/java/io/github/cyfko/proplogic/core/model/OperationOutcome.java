package io.github.cyfko.proplogic.core.model;

import java.util.Objects;

/**
 * Result summary of a recorded operation.
 *
 * @param success whether the operation completed normally
 * @param summary a short human-readable description of the result or of the failure
 */
public record OperationOutcome(boolean success, String summary) {

    public OperationOutcome {
        Objects.requireNonNull(summary, "summary");
    }

    public static OperationOutcome success(String summary) {
        return new OperationOutcome(true, summary);
    }

    /**
     * @param error the failure that ended the operation
     * @return a failed outcome summarising the exception type and message
     */
    public static OperationOutcome failure(Throwable error) {
        return new OperationOutcome(false, error.getClass().getSimpleName() + ": " + error.getMessage());
    }
}
