package com.polynomeer.tkv.util;

import java.time.Instant;

/**
 * Time helpers shared by the index (score encoding) and the script limits.
 */
public final class Clocks {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    /**
     * Earliest and latest instants whose epoch nanoseconds fit in a long.
     */
    public static final Instant MIN_NANOS_INSTANT = fromEpochNanos(Long.MIN_VALUE);
    public static final Instant MAX_NANOS_INSTANT = fromEpochNanos(Long.MAX_VALUE);

    private Clocks() {
    }

    /**
     * Monotonic milliseconds derived from nanoTime; use for elapsed-time checks.
     */
    public static long monoMillis() {
        return System.nanoTime() / 1_000_000L;
    }

    /**
     * Nanoseconds since the epoch. Throws ArithmeticException outside ~1677..2262.
     */
    public static long epochNanos(Instant t) {
        return Math.addExact(Math.multiplyExact(t.getEpochSecond(), NANOS_PER_SECOND), t.getNano());
    }

    public static boolean fitsEpochNanos(Instant t) {
        return !t.isBefore(MIN_NANOS_INSTANT) && !t.isAfter(MAX_NANOS_INSTANT);
    }

    public static Instant fromEpochNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }
}
