package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.AnalysisRecorder;
import io.github.cyfko.proplogic.core.config.RecorderPolicy;
import io.github.cyfko.proplogic.core.model.AnalysisMetrics;
import io.github.cyfko.proplogic.core.model.AnalysisRecord;
import io.github.cyfko.proplogic.core.model.OperationKind;
import io.github.cyfko.proplogic.core.model.OperationOutcome;
import io.github.cyfko.proplogic.core.model.OperationStats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * {@link AnalysisRecorder} backed by a FIFO log of fixed capacity.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * A single {@link ReentrantLock} guards the log and every statistic. Appending a record, evicting the
 * oldest one and updating the running average happen in one critical section, so concurrent callers
 * never lose an update and snapshots never see half of an append.
 * </p>
 *
 * <h2>Statistics</h2>
 * <p>
 * Count, error count, durations and per-kind statistics are cumulative: they keep covering records
 * evicted from the log, until {@link #clear()} resets them. The average is maintained incrementally as
 * {@code avg(n) = (avg(n-1) * (n-1) + d) / n}.
 * </p>
 *
 * <pre>{@code
 * AnalysisRecorder recorder = new BoundedAnalysisRecorder(RecorderPolicy.custom(100), Clock.systemUTC());
 * recorder.record(OperationKind.EVALUATE, List.of("P AND Q"), List.of("P", "Q"),
 *         OperationOutcome.success("true"), Duration.ofMillis(2));
 * double avg = recorder.getMetrics().averageDurationSeconds();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedAnalysisRecorder implements AnalysisRecorder {

    private static final Logger log = Logger.getLogger(BoundedAnalysisRecorder.class.getName());

    private final RecorderPolicy policy;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final ArrayDeque<AnalysisRecord> records;
    private final Map<OperationKind, OperationStats> statsByKind = new EnumMap<>(OperationKind.class);
    private long count;
    private long errorCount;
    private double averageDurationSeconds;
    private Duration totalDuration = Duration.ZERO;
    private Instant startInstant;

    public BoundedAnalysisRecorder() {
        this(RecorderPolicy.defaults(), Clock.systemUTC());
    }

    public BoundedAnalysisRecorder(RecorderPolicy policy, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.records = new ArrayDeque<>(Math.min(policy.capacity(), 1024));
        this.startInstant = clock.instant();
    }

    @Override
    public AnalysisRecord record(OperationKind kind,
                                 List<String> expressions,
                                 List<String> variables,
                                 OperationOutcome outcome,
                                 Duration duration) {
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative, got: " + duration);
        }

        lock.lock();
        try {
            AnalysisRecord record = new AnalysisRecord(kind, expressions, variables, outcome, duration, clock.instant());
            if (records.size() == policy.capacity()) {
                records.pollFirst();
            }
            records.addLast(record);

            count++;
            if (!outcome.success()) {
                errorCount++;
            }
            totalDuration = totalDuration.plus(duration);
            double seconds = duration.toNanos() / 1_000_000_000.0;
            averageDurationSeconds = ((averageDurationSeconds * (count - 1)) + seconds) / count;
            statsByKind.merge(kind, OperationStats.EMPTY.plus(duration), (old, ignored) -> old.plus(duration));
            return record;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AnalysisMetrics getMetrics() {
        lock.lock();
        try {
            Instant now = clock.instant();
            return new AnalysisMetrics(
                    count,
                    errorCount,
                    averageDurationSeconds,
                    totalDuration,
                    lastRecords(null, policy.recentRecordsLimit()),
                    statsByKind,
                    Duration.between(startInstant, now),
                    now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<AnalysisRecord> history(OperationKind kind, int limit) {
        Objects.requireNonNull(kind, "kind");
        return snapshot(kind, limit);
    }

    @Override
    public List<AnalysisRecord> history(int limit) {
        return snapshot(null, limit);
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            int dropped = records.size();
            records.clear();
            statsByKind.clear();
            count = 0;
            errorCount = 0;
            averageDurationSeconds = 0.0;
            totalDuration = Duration.ZERO;
            startInstant = clock.instant();
            log.info(() -> String.format("Analysis history cleared (%d records dropped)", dropped));
        } finally {
            lock.unlock();
        }
    }

    private List<AnalysisRecord> snapshot(OperationKind kind, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got: " + limit);
        }
        lock.lock();
        try {
            return lastRecords(kind, limit);
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private List<AnalysisRecord> lastRecords(OperationKind kind, int limit) {
        List<AnalysisRecord> result = new ArrayList<>(Math.min(limit, records.size()));
        Iterator<AnalysisRecord> newestFirst = records.descendingIterator();
        while (newestFirst.hasNext() && result.size() < limit) {
            AnalysisRecord record = newestFirst.next();
            if (kind == null || record.kind() == kind) {
                result.add(record);
            }
        }
        Collections.reverse(result);
        return List.copyOf(result);
    }
}
