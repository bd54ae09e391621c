package io.github.cyfko.proplogic.core.table;

import io.github.cyfko.proplogic.core.api.Expression;
import io.github.cyfko.proplogic.core.api.ExpressionParser;
import io.github.cyfko.proplogic.core.config.TablePolicy;
import io.github.cyfko.proplogic.core.evaluation.ExpressionEvaluator;
import io.github.cyfko.proplogic.core.exception.LogicSyntaxException;
import io.github.cyfko.proplogic.core.exception.LogicValidationException;
import io.github.cyfko.proplogic.core.exception.UndefinedVariableException;
import io.github.cyfko.proplogic.core.model.TruthTable;
import io.github.cyfko.proplogic.core.model.TruthTableRow;
import io.github.cyfko.proplogic.core.model.VariableList;
import io.github.cyfko.proplogic.core.utils.VariableValidationUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Enumerates every assignment of a {@link VariableList} and evaluates an expression under each.
 *
 * <h2>Row Order</h2>
 * <p>
 * Rows follow nested iteration with the first variable toggling slowest and {@code true} before
 * {@code false} at every position. For row {@code i} of a table over {@code n} variables, variable
 * {@code j} is {@code true} exactly when bit {@code n-1-j} of {@code i} is clear:
 * </p>
 * <pre>
 * row | P Q
 *  0  | T T
 *  1  | T F
 *  2  | F T
 *  3  | F F
 * </pre>
 * <p>
 * Equivalence checks compare tables index by index, so this order is part of the contract.
 * </p>
 *
 * <h2>Error Rows</h2>
 * <p>
 * The expression is parsed once. A row whose evaluation raises {@link UndefinedVariableException}
 * stores the error instead of a result; the table still has all {@code 2^n} rows.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TruthTableGenerator {

    private static final Logger log = Logger.getLogger(TruthTableGenerator.class.getName());

    private final ExpressionParser parser;
    private final TablePolicy tablePolicy;
    private final Clock clock;

    public TruthTableGenerator(ExpressionParser parser, TablePolicy tablePolicy, Clock clock) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.tablePolicy = Objects.requireNonNull(tablePolicy, "tablePolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param variables  the columns, in enumeration order
     * @param expression the expression text
     * @return the complete table
     * @throws LogicSyntaxException     if the expression is empty or malformed
     * @throws LogicValidationException if there are more variables than the table policy allows
     */
    public TruthTable generate(VariableList variables, String expression) {
        Objects.requireNonNull(variables, "variables");
        VariableValidationUtils.validateTableSize(variables.size(), tablePolicy).throwIfInvalid();
        Expression ast = parser.parse(expression);
        return generate(variables, expression, ast);
    }

    /**
     * Builds a table from an already parsed tree.
     *
     * @param variables  the columns, in enumeration order
     * @param expression the source text of {@code ast}, kept in the table
     * @param ast        the parsed expression
     * @return the complete table
     * @throws LogicValidationException if there are more variables than the table policy allows
     */
    public TruthTable generate(VariableList variables, String expression, Expression ast) {
        Objects.requireNonNull(variables, "variables");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(ast, "ast");
        VariableValidationUtils.validateTableSize(variables.size(), tablePolicy).throwIfInvalid();
        int n = variables.size();
        int rowCount = 1 << n;
        log.fine(() -> String.format("Generating %d rows for '%s' over %s", rowCount, expression, variables));

        List<TruthTableRow> rows = new ArrayList<>(rowCount);
        Map<String, Boolean> assignment = new HashMap<>(n * 2);
        Boolean[] values = new Boolean[n];

        for (int index = 0; index < rowCount; index++) {
            for (int j = 0; j < n; j++) {
                boolean value = ((index >> (n - 1 - j)) & 1) == 0;
                values[j] = value;
                assignment.put(variables.get(j), value);
            }
            List<Boolean> rowValues = Arrays.asList(values.clone());
            try {
                rows.add(TruthTableRow.ofResult(index, rowValues, ExpressionEvaluator.evaluate(ast, assignment)));
            } catch (UndefinedVariableException e) {
                final int failedRow = index;
                log.finer(() -> String.format("Row %d of '%s' failed: %s", failedRow, expression, e.getMessage()));
                rows.add(TruthTableRow.ofError(index, rowValues, e.getMessage()));
            }
        }

        return new TruthTable(variables, expression, rows, clock.instant());
    }
}
