package io.github.cyfko.proplogic.core.utils;

import io.github.cyfko.proplogic.core.exception.LogicValidationException;
import io.github.cyfko.proplogic.core.exception.ValidationErrorKind;

import java.util.Objects;

/**
 * Result of a validation that does not throw by itself.
 * <p>
 * Either a success, or a failure carrying a {@link ValidationErrorKind} and a message. Instances are
 * immutable and created via {@link #success()} and {@link #failure(ValidationErrorKind, String)}.
 * </p>
 *
 * <pre>{@code
 * ValidationResult result = VariableValidationUtils.validate(names);
 * if (!result.isValid()) {
 *     System.out.println("Validation error: " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(null, null);

    private final ValidationErrorKind errorKind;
    private final String errorMessage;

    private ValidationResult(ValidationErrorKind errorKind, String errorMessage) {
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(ValidationErrorKind errorKind, String errorMessage) {
        return new ValidationResult(Objects.requireNonNull(errorKind, "errorKind"), errorMessage);
    }

    public boolean isValid() {
        return errorKind == null;
    }

    /**
     * @return the failure category, or {@code null} if valid
     */
    public ValidationErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * @return the failure message, or {@code null} if valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Converts a failure into its exception.
     *
     * @throws LogicValidationException if this result is a failure
     */
    public void throwIfInvalid() {
        if (!isValid()) {
            throw new LogicValidationException(errorKind, errorMessage);
        }
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, kind=" + errorKind + ", error=" + errorMessage + "]";
    }
}
