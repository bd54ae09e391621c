package io.github.cyfko.proplogic.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable truth table of an expression over a {@link VariableList}.
 * <p>
 * Always holds exactly {@code 2^n} rows for {@code n} variables, in canonical order: the first
 * variable toggles slowest and {@code true} precedes {@code false}, so row 0 assigns {@code true}
 * to every variable and the last row assigns {@code false} to every variable.
 * </p>
 *
 * @param variables  the columns of the table
 * @param expression the source expression text
 * @param rows       the rows in canonical order
 * @param createdAt  creation timestamp
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTable(VariableList variables, String expression, List<TruthTableRow> rows, Instant createdAt) {

    public TruthTable {
        Objects.requireNonNull(variables, "variables");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(createdAt, "createdAt");
        rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
        long expected = 1L << variables.size();
        if (rows.size() != expected) {
            throw new IllegalArgumentException(String.format(
                    "A table over %d variables needs %d rows, got %d", variables.size(), expected, rows.size()));
        }
    }

    public int rowCount() {
        return rows.size();
    }

    public TruthTableRow row(int index) {
        return rows.get(index);
    }

    /**
     * @param index a row index
     * @return the assignment of the row as an ordered, unmodifiable variable-to-value map
     */
    public Map<String, Boolean> assignment(int index) {
        List<Boolean> values = rows.get(index).values();
        Map<String, Boolean> assignment = new LinkedHashMap<>(values.size() * 2);
        for (int i = 0; i < values.size(); i++) {
            assignment.put(variables.get(i), values.get(i));
        }
        return Collections.unmodifiableMap(assignment);
    }

    /**
     * @return the result column; error rows contribute {@code null}
     */
    public List<Boolean> results() {
        List<Boolean> results = new ArrayList<>(rows.size());
        for (TruthTableRow row : rows) {
            results.add(row.result());
        }
        return Collections.unmodifiableList(results);
    }

    public int errorRowCount() {
        return (int) rows.stream().filter(TruthTableRow::hasError).count();
    }
}
