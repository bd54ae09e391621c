package io.github.cyfko.proplogic.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One row of a {@link TruthTable}: the assigned values, aligned with the table's variables, and
 * either the result of the expression or the error raised while evaluating it.
 *
 * @param index  the 0-based row index in canonical order
 * @param values the assigned truth values, one per variable
 * @param result the expression result, {@code null} if and only if {@code error} is set
 * @param error  the evaluation error message, {@code null} if and only if {@code result} is set
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTableRow(int index, List<Boolean> values, Boolean result, String error) {

    public TruthTableRow {
        values = List.copyOf(Objects.requireNonNull(values, "values"));
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("A row holds either a result or an error, not both or neither");
        }
    }

    public static TruthTableRow ofResult(int index, List<Boolean> values, boolean result) {
        return new TruthTableRow(index, values, result, null);
    }

    public static TruthTableRow ofError(int index, List<Boolean> values, String error) {
        return new TruthTableRow(index, values, null, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
