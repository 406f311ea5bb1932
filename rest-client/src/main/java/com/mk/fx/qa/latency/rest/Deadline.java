package com.mk.fx.qa.latency.rest;

import java.net.SocketTimeoutException;
import java.time.Duration;

/** Fixed point in time by which a multi-step network operation must finish. */
final class Deadline {

    private final long deadlineNanos;
    private final Duration budget;
    private final String operation;

    private Deadline(long deadlineNanos, Duration budget, String operation) {
        this.deadlineNanos = deadlineNanos;
        this.budget = budget;
        this.operation = operation;
    }

    static Deadline after(Duration budget, String operation) {
        return new Deadline(System.nanoTime() + budget.toNanos(), budget, operation);
    }

    /**
     * Milliseconds left, at least one, for use as a socket timeout.
     *
     * @throws SocketTimeoutException when the deadline has passed
     */
    int remainingMillis() throws SocketTimeoutException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0L) {
            throw new SocketTimeoutException(operation + " timed out after " + budget.toMillis() + " ms");
        }
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, (remaining + 999_999L) / 1_000_000L));
    }
}
