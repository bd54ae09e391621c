package io.github.cyfko.proplogic.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Logical properties of one expression derived from its truth table.
 * <p>
 * Error rows are excluded from every determination: an expression is a tautology when all of its
 * evaluated rows are {@code true} and at least one row was evaluated, symmetrically for a
 * contradiction. A table made only of error rows is neither.
 * </p>
 *
 * @param expression            the source expression text
 * @param variables             the variables the table was built over
 * @param isTautology           every evaluated row is {@code true}
 * @param isContradiction       every evaluated row is {@code false}
 * @param isSatisfiable         at least one evaluated row is {@code true}
 * @param rowsEvaluated         number of rows that produced a result
 * @param errorRows             number of rows that produced an error
 * @param satisfyingAssignment  the first {@code true} row's assignment, {@code null} if unsatisfiable
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PropertyResult(
        String expression,
        VariableList variables,
        boolean isTautology,
        boolean isContradiction,
        boolean isSatisfiable,
        int rowsEvaluated,
        int errorRows,
        Map<String, Boolean> satisfyingAssignment
) {

    public PropertyResult {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(variables, "variables");
        satisfyingAssignment = satisfyingAssignment == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(satisfyingAssignment));
    }

    public Optional<Map<String, Boolean>> witness() {
        return Optional.ofNullable(satisfyingAssignment);
    }
}
