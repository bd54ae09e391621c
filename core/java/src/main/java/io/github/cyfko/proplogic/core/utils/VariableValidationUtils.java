package io.github.cyfko.proplogic.core.utils;

import io.github.cyfko.proplogic.core.api.LogicalOperator;
import io.github.cyfko.proplogic.core.config.PatternConfig;
import io.github.cyfko.proplogic.core.config.TablePolicy;
import io.github.cyfko.proplogic.core.exception.ValidationErrorKind;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validation of variable lists before they are used to enumerate assignments.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class VariableValidationUtils {

    private VariableValidationUtils() {}

    /**
     * Checks that {@code names} is a non-empty list of distinct identifiers none of which is an
     * operator keyword.
     *
     * @param names the candidate variable names, in column order
     * @return success, or the first failure found scanning left to right
     */
    public static ValidationResult validate(List<String> names) {
        Objects.requireNonNull(names, "names");
        if (names.isEmpty()) {
            return ValidationResult.failure(ValidationErrorKind.EMPTY_VARIABLE_LIST, "Variable list cannot be empty");
        }

        Set<String> seen = new HashSet<>(names.size() * 2);
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            ValidationResult nameResult = validateName(name, i);
            if (!nameResult.isValid()) {
                return nameResult;
            }
            if (!seen.add(name)) {
                return ValidationResult.failure(ValidationErrorKind.DUPLICATE_VARIABLE,
                        String.format("Duplicate variable name '%s' at index %d", name, i));
            }
        }
        return ValidationResult.success();
    }

    /**
     * Checks the size of a list against the table policy.
     *
     * @param variableCount number of variables to enumerate
     * @param policy        the table policy in force
     * @return success, or a {@link ValidationErrorKind#TOO_MANY_VARIABLES} failure
     */
    public static ValidationResult validateTableSize(int variableCount, TablePolicy policy) {
        if (variableCount > policy.maxVariables()) {
            return ValidationResult.failure(ValidationErrorKind.TOO_MANY_VARIABLES, String.format(
                    "Too many variables for a truth table (%d, max: %d)", variableCount, policy.maxVariables()));
        }
        return ValidationResult.success();
    }

    private static ValidationResult validateName(String name, int index) {
        if (name == null || !PatternConfig.IDENTIFIER_PATTERN.matcher(name).matches()) {
            return ValidationResult.failure(ValidationErrorKind.INVALID_VARIABLE_NAME,
                    String.format("Invalid variable name '%s' at index %d. Names must start with a letter or "
                            + "underscore, followed by letters, digits or underscores", name, index));
        }
        if (LogicalOperator.fromKeyword(name).isPresent()) {
            return ValidationResult.failure(ValidationErrorKind.INVALID_VARIABLE_NAME,
                    String.format("Variable name '%s' at index %d is a reserved operator keyword", name, index));
        }
        return ValidationResult.success();
    }
}
