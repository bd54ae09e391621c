package io.github.cyfko.proplogic.core.model;

import java.time.Duration;

/**
 * Running statistics of one operation kind.
 * <p>
 * Values are accumulated at record time, so they keep covering records that were later evicted
 * from the bounded log.
 * </p>
 *
 * @param count         number of recorded operations
 * @param totalDuration sum of the durations
 * @param minDuration   shortest duration, {@link Duration#ZERO} when empty
 * @param maxDuration   longest duration, {@link Duration#ZERO} when empty
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record OperationStats(long count, Duration totalDuration, Duration minDuration, Duration maxDuration) {

    public static final OperationStats EMPTY = new OperationStats(0, Duration.ZERO, Duration.ZERO, Duration.ZERO);

    /**
     * @param duration the duration of one more operation
     * @return new statistics including {@code duration}
     */
    public OperationStats plus(Duration duration) {
        if (count == 0) {
            return new OperationStats(1, duration, duration, duration);
        }
        return new OperationStats(
                count + 1,
                totalDuration.plus(duration),
                duration.compareTo(minDuration) < 0 ? duration : minDuration,
                duration.compareTo(maxDuration) > 0 ? duration : maxDuration);
    }

    public double averageDurationSeconds() {
        return count == 0 ? 0.0 : toSeconds(totalDuration) / count;
    }

    static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
