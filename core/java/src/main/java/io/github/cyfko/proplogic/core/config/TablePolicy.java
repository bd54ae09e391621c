package io.github.cyfko.proplogic.core.config;

/**
 * Limits applied to truth-table enumeration.
 * <p>
 * A table over {@code n} variables has {@code 2^n} rows, so the variable count is the only knob
 * needed to bound both time and memory of a single request.
 * </p>
 *
 * @param maxVariables maximum number of variables accepted by the generator, between 1 and 30
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TablePolicy(int maxVariables) {

    static final int HARD_LIMIT = 30;

    public TablePolicy {
        if (maxVariables <= 0 || maxVariables > HARD_LIMIT) {
            throw new IllegalArgumentException(
                    "maxVariables must be between 1 and " + HARD_LIMIT + ", got: " + maxVariables);
        }
    }

    /**
     * @return 20 variables, i.e. at most 1 048 576 rows
     */
    public static TablePolicy defaults() {
        return new TablePolicy(20);
    }

    public static TablePolicy strict() {
        return new TablePolicy(12);
    }

    public static TablePolicy relaxed() {
        return new TablePolicy(24);
    }
}
