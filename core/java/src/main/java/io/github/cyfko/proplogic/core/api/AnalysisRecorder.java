package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.model.AnalysisMetrics;
import io.github.cyfko.proplogic.core.model.AnalysisRecord;
import io.github.cyfko.proplogic.core.model.OperationKind;
import io.github.cyfko.proplogic.core.model.OperationOutcome;

import java.time.Duration;
import java.util.List;

/**
 * Shared bookkeeping of engine operations: a bounded history plus running performance statistics.
 * <p>
 * This is the only mutable state of the engine. Implementations must be safe for concurrent
 * callers: an append and the statistics update it causes are one atomic step, and snapshots never
 * observe a partially applied append.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface AnalysisRecorder {

    /**
     * Appends a record and updates the statistics.
     *
     * @param kind        the operation performed
     * @param expressions expression texts given to the operation
     * @param variables   variable names given to the operation
     * @param outcome     how the operation ended
     * @param duration    wall-clock duration of the operation
     * @return the appended record
     */
    AnalysisRecord record(OperationKind kind,
                          List<String> expressions,
                          List<String> variables,
                          OperationOutcome outcome,
                          Duration duration);

    AnalysisMetrics getMetrics();

    /**
     * @param kind  the operation kind to keep
     * @param limit maximum number of records returned
     * @return the most recent records of {@code kind}, oldest first
     */
    List<AnalysisRecord> history(OperationKind kind, int limit);

    /**
     * @param limit maximum number of records returned
     * @return the most recent records of every kind, oldest first
     */
    List<AnalysisRecord> history(int limit);

    /**
     * Atomically empties the log and resets every statistic.
     */
    void clear();
}
