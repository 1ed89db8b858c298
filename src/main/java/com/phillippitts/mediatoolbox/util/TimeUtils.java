package com.phillippitts.mediatoolbox.util;

/**
 * Utility methods for time conversions and clock-style formatting.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private static final long SECONDS_PER_HOUR = 3600L;
    private static final long SECONDS_PER_MINUTE = 60L;

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
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * Formats whole seconds as {@code HH:MM:SS}. Hours are not wrapped at 24;
     * negative input is treated as zero.
     *
     * <pre>
     * formatHms(0)     = "00:00:00"
     * formatHms(3725)  = "01:02:05"
     * formatHms(90000) = "25:00:00"
     * </pre>
     *
     * @param totalSeconds seconds to format
     * @return clock-style string
     */
    public static String formatHms(long totalSeconds) {
        long s = Math.max(0L, totalSeconds);
        long hours = s / SECONDS_PER_HOUR;
        long minutes = (s % SECONDS_PER_HOUR) / SECONDS_PER_MINUTE;
        long seconds = s % SECONDS_PER_MINUTE;
        return String.format("%02d:%02d:%02d", hours, minutes, seconds);
    }

    /**
     * Converts clock components to seconds, ignoring the fractional hundredths.
     */
    public static long toSeconds(int hours, int minutes, int seconds) {
        return hours * SECONDS_PER_HOUR + minutes * SECONDS_PER_MINUTE + seconds;
    }
}
