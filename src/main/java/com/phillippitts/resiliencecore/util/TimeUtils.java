package com.phillippitts.resiliencecore.util;

import java.time.Duration;

/**
 * Time conversions used for latency reporting and rate-limit headers.
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
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Whole seconds covering the duration, rounded up; zero or negative durations give 0.
     * A 200ms wait reports as 1 second so clients never retry early.
     */
    public static long ceilSeconds(Duration duration) {
        if (duration.isNegative() || duration.isZero()) {
            return 0;
        }
        long seconds = duration.getSeconds();
        return duration.getNano() > 0 ? seconds + 1 : seconds;
    }
}
