package com.phillippitts.mcphub.util;

/**
 * Utility methods for time conversions and elapsed time calculations based on
 * {@link System#nanoTime()}.
 *
 * <p>Wall-clock {@link java.time.Clock} time is used for task timestamps; these helpers are
 * for measuring durations, where only a monotonic source is correct.
 *
 * @since 0.1
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * <p>Typical usage:
     * <pre>
     * long start = System.nanoTime();
     * // ... invoke backend ...
     * LOG.debug("took {} ms", TimeUtils.elapsedMillis(start));
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }
}
