package com.phillippitts.dialogaugment.util;

import java.time.Duration;

/**
 * Time helpers for {@link System#nanoTime()} based timing and backoff arithmetic.
 *
 * @since 1.0
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

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
     * Multiplies a duration by {@code 2^exponent}, saturating at {@code cap}.
     *
     * @param base     base delay (non-negative)
     * @param exponent doubling count (non-negative)
     * @param cap      upper bound
     * @return {@code min(cap, base * 2^exponent)}
     */
    public static Duration doubledAndCapped(Duration base, int exponent, Duration cap) {
        if (exponent < 0) {
            throw new IllegalArgumentException("exponent must be >= 0");
        }
        if (base.isZero() || exponent == 0) {
            return base.compareTo(cap) > 0 ? cap : base;
        }
        // 2^62 ms already exceeds any sane cap; avoid overflow in the shift
        if (exponent >= 62) {
            return cap;
        }
        long factor = 1L << exponent;
        long baseMillis = base.toMillis();
        if (baseMillis > cap.toMillis() / factor) {
            return cap;
        }
        Duration scaled = Duration.ofMillis(baseMillis * factor);
        return scaled.compareTo(cap) > 0 ? cap : scaled;
    }
}
