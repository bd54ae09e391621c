package io.github.cyfko.proplogic.core.analysis;

import io.github.cyfko.proplogic.core.exception.LogicValidationException;
import io.github.cyfko.proplogic.core.exception.ValidationErrorKind;
import io.github.cyfko.proplogic.core.model.EquivalenceResult;
import io.github.cyfko.proplogic.core.model.PropertyResult;
import io.github.cyfko.proplogic.core.model.RowComparison;
import io.github.cyfko.proplogic.core.model.TruthTable;
import io.github.cyfko.proplogic.core.model.TruthTableRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives logical properties from truth tables.
 * <p>
 * Rows that failed to evaluate never count as {@code true} or {@code false}. For single-table
 * properties they are skipped; for equivalence they count as differing rows.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PropertyAnalyzer {

    private PropertyAnalyzer() {}

    /**
     * @return {@code true} iff at least one row evaluated and every evaluated row is {@code true}
     */
    public static boolean isTautology(TruthTable table) {
        return analyze(table).isTautology();
    }

    /**
     * @return {@code true} iff at least one row evaluated and every evaluated row is {@code false}
     */
    public static boolean isContradiction(TruthTable table) {
        return analyze(table).isContradiction();
    }

    public static PropertyResult analyze(TruthTable table) {
        Objects.requireNonNull(table, "table");
        int evaluated = 0;
        int trueRows = 0;
        Map<String, Boolean> witness = null;

        for (TruthTableRow row : table.rows()) {
            if (row.hasError()) {
                continue;
            }
            evaluated++;
            if (row.result()) {
                trueRows++;
                if (witness == null) {
                    witness = table.assignment(row.index());
                }
            }
        }

        return new PropertyResult(
                table.expression(),
                table.variables(),
                evaluated > 0 && trueRows == evaluated,
                evaluated > 0 && trueRows == 0,
                trueRows > 0,
                evaluated,
                table.rowCount() - evaluated,
                witness);
    }

    /**
     * Compares two tables row by row.
     *
     * @param first  table of the first expression
     * @param second table of the second expression
     * @return the comparison, with a confidence percentage even when not equivalent
     * @throws LogicValidationException with kind {@link ValidationErrorKind#VARIABLE_MISMATCH} if the
     *                                  tables do not share the same variables in the same order
     */
    public static EquivalenceResult checkEquivalence(TruthTable first, TruthTable second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (!first.variables().equals(second.variables()) || first.rowCount() != second.rowCount()) {
            throw new LogicValidationException(ValidationErrorKind.VARIABLE_MISMATCH, String.format(
                    "Truth tables do not share the same variables: %s vs %s", first.variables(), second.variables()));
        }

        int total = first.rowCount();
        List<Integer> differing = new ArrayList<>();
        List<RowComparison> comparisons = new ArrayList<>(total);

        for (int i = 0; i < total; i++) {
            Boolean left = first.row(i).result();
            Boolean right = second.row(i).result();
            boolean matching = left != null && left.equals(right);
            if (!matching) {
                differing.add(i);
            }
            comparisons.add(new RowComparison(i, first.assignment(i), left, right, matching));
        }

        double confidence = (total - differing.size()) * 100.0 / total;
        return new EquivalenceResult(
                first.expression(),
                second.expression(),
                first.variables(),
                differing.isEmpty(),
                differing,
                confidence,
                comparisons);
    }
}
