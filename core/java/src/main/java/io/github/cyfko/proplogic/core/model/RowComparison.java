package io.github.cyfko.proplogic.core.model;

import java.util.Map;

/**
 * Pairwise comparison of one row of two truth tables.
 *
 * @param index        the row index shared by both tables
 * @param assignment   the assignment of the row
 * @param firstResult  result of the first expression, {@code null} on error
 * @param secondResult result of the second expression, {@code null} on error
 * @param matching     both results are present and equal
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RowComparison(
        int index,
        Map<String, Boolean> assignment,
        Boolean firstResult,
        Boolean secondResult,
        boolean matching
) {
}
