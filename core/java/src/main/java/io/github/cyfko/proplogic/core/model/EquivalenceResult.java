package io.github.cyfko.proplogic.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of comparing the truth tables of two expressions row by row.
 * <p>
 * A row where either side errored counts as non-matching, so {@code areEquivalent} is only
 * {@code true} when both expressions evaluated cleanly and agreed on every row.
 * {@code confidence} is the percentage of matching rows and is reported even when the
 * expressions are not equivalent.
 * </p>
 *
 * @param firstExpression  the first source expression
 * @param secondExpression the second source expression
 * @param variables        the shared variables
 * @param areEquivalent    no row differs
 * @param differingRows    indices of the non-matching rows, ascending
 * @param confidence       matching rows / total rows × 100
 * @param comparisons      one comparison per row, in row order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EquivalenceResult(
        String firstExpression,
        String secondExpression,
        VariableList variables,
        boolean areEquivalent,
        List<Integer> differingRows,
        double confidence,
        List<RowComparison> comparisons
) {

    public EquivalenceResult {
        Objects.requireNonNull(firstExpression, "firstExpression");
        Objects.requireNonNull(secondExpression, "secondExpression");
        Objects.requireNonNull(variables, "variables");
        differingRows = List.copyOf(differingRows);
        comparisons = List.copyOf(comparisons);
    }

    public int totalRows() {
        return comparisons.size();
    }
}
