package io.github.cyfko.proplogic.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One entry of the analysis log.
 *
 * @param kind        the operation performed
 * @param expressions the expression texts given to the operation, possibly empty
 * @param variables   the variable names given to the operation, possibly empty
 * @param outcome     how the operation ended
 * @param duration    wall-clock duration of the operation
 * @param timestamp   when the record was appended
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AnalysisRecord(
        OperationKind kind,
        List<String> expressions,
        List<String> variables,
        OperationOutcome outcome,
        Duration duration,
        Instant timestamp
) {

    public AnalysisRecord {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(timestamp, "timestamp");
        expressions = List.copyOf(expressions);
        variables = List.copyOf(variables);
    }

    public boolean isSuccess() {
        return outcome.success();
    }
}
