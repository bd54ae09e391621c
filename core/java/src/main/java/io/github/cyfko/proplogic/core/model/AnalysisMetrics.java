package io.github.cyfko.proplogic.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Consistent snapshot of the analysis recorder, taken under its lock.
 *
 * @param count                  operations recorded since construction or the last clear
 * @param errorCount             how many of them failed
 * @param averageDurationSeconds running average duration in seconds
 * @param totalDuration          cumulative duration
 * @param recentRecords          the most recent records, oldest first
 * @param operationStats         statistics per operation kind, only kinds seen so far
 * @param uptime                 time since construction or the last clear
 * @param capturedAt             when the snapshot was taken
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AnalysisMetrics(
        long count,
        long errorCount,
        double averageDurationSeconds,
        Duration totalDuration,
        List<AnalysisRecord> recentRecords,
        Map<OperationKind, OperationStats> operationStats,
        Duration uptime,
        Instant capturedAt
) {

    public AnalysisMetrics {
        recentRecords = List.copyOf(recentRecords);
        operationStats = Map.copyOf(operationStats);
    }

    public OperationStats statsFor(OperationKind kind) {
        return operationStats.getOrDefault(kind, OperationStats.EMPTY);
    }
}
