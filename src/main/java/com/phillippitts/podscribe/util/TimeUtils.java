package com.phillippitts.podscribe.util;

import java.util.Locale;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Provides conversions between nanoseconds and milliseconds for timing with
 * {@link System#nanoTime()}, and the {@code HH:MM:SS.mmm} rendering used in transcript lines.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private static final long MILLIS_PER_SECOND = 1_000L;
    private static final long SECONDS_PER_MINUTE = 60L;
    private static final long SECONDS_PER_HOUR = 3_600L;

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
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Formats an offset in seconds as {@code HH:MM:SS.mmm} with ASCII digits whatever the default locale,
     * rounding to the nearest millisecond.
     *
     * <p>Hours are not wrapped at 24, so a 30 hour offset renders as {@code 30:00:00.000}.
     *
     * @param seconds non-negative offset in seconds
     * @return formatted timestamp
     * @throws IllegalArgumentException if seconds is negative or not finite
     */
    public static String formatTimestamp(double seconds) {
        if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            throw new IllegalArgumentException("non-negative timestamp expected, got: " + seconds);
        }
        long totalMillis = Math.round(seconds * MILLIS_PER_SECOND);
        long totalSeconds = totalMillis / MILLIS_PER_SECOND;
        long millis = totalMillis % MILLIS_PER_SECOND;
        long hours = totalSeconds / SECONDS_PER_HOUR;
        long minutes = (totalSeconds % SECONDS_PER_HOUR) / SECONDS_PER_MINUTE;
        long secs = totalSeconds % SECONDS_PER_MINUTE;
        return String.format(Locale.ROOT, "%02d:%02d:%02d.%03d", hours, minutes, secs, millis);
    }
}
