package com.phillippitts.mathscrap.util;

/**
 * Elapsed-time helpers around {@link System#nanoTime()}.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(elapsedNanos(startNanos));
    }

    public static long elapsedNanos(long startNanos) {
        return System.nanoTime() - startNanos;
    }
}
