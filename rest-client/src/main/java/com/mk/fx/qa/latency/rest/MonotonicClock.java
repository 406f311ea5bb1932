package com.mk.fx.qa.latency.rest;

/**
 * Monotonic, high-resolution time source used for every latency measurement. Values are only
 * meaningful relative to each other and are never affected by wall-clock adjustments.
 */
@FunctionalInterface
public interface MonotonicClock {

    /** Clock backed by {@link System#nanoTime()}. */
    MonotonicClock SYSTEM = System::nanoTime;

    /**
     * Returns the current reading in nanoseconds.
     *
     * @return monotonic nanoseconds
     */
    long nanoTime();

    /**
     * Returns the nanoseconds elapsed since an earlier reading of this clock.
     *
     * @param startNanos an earlier value returned by {@link #nanoTime()}
     * @return elapsed nanoseconds, never negative
     */
    default long elapsedSince(long startNanos) {
        return Math.max(0L, nanoTime() - startNanos);
    }
}
