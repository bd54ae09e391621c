package io.github.cyfko.proplogic.core.config;

/**
 * Sizing of the analysis recorder.
 *
 * @param capacity           maximum number of records kept; the oldest record is evicted first
 * @param recentRecordsLimit number of most recent records included in a metrics snapshot
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RecorderPolicy(int capacity, int recentRecordsLimit) {

    public RecorderPolicy {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        if (recentRecordsLimit < 0) {
            throw new IllegalArgumentException("recentRecordsLimit must not be negative, got: " + recentRecordsLimit);
        }
    }

    public static RecorderPolicy defaults() {
        return new RecorderPolicy(1000, 10);
    }

    public static RecorderPolicy custom(int capacity) {
        return new RecorderPolicy(capacity, Math.min(10, capacity));
    }
}
