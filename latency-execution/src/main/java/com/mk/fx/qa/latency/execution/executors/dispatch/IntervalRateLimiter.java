package com.mk.fx.qa.latency.execution.executors.dispatch;

import com.mk.fx.qa.latency.rest.MonotonicClock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Enforces a minimum interval between successive grants. The first grant is immediate; every later
 * grant happens no earlier than {@code interval} after the previous one. Several limiters can be
 * satisfied together through {@link #acquireAll}, which stamps all of them at the same instant.
 */
public final class IntervalRateLimiter {

  private static final IntervalRateLimiter DISABLED =
      new IntervalRateLimiter(0L, MonotonicClock.SYSTEM);

  private final long intervalNanos;
  private final MonotonicClock clock;
  private boolean granted;
  private long lastGrantNanos;

  IntervalRateLimiter(long intervalNanos, MonotonicClock clock) {
    this.intervalNanos = Math.max(0L, intervalNanos);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static IntervalRateLimiter disabled() {
    return DISABLED;
  }

  /**
   * Limiter allowing at most {@code ratePerSec} grants per second; a null or non-positive rate
   * disables limiting.
   */
  public static IntervalRateLimiter perSecond(Double ratePerSec) {
    if (ratePerSec == null || ratePerSec <= 0.0) {
      return DISABLED;
    }
    return new IntervalRateLimiter((long) Math.ceil(1_000_000_000L / ratePerSec), MonotonicClock.SYSTEM);
  }

  /** Limiter spacing grants by {@code interval}; null or zero disables limiting. */
  public static IntervalRateLimiter ofInterval(Duration interval) {
    if (interval == null || interval.isZero() || interval.isNegative()) {
      return DISABLED;
    }
    return new IntervalRateLimiter(interval.toNanos(), MonotonicClock.SYSTEM);
  }

  public boolean isEnabled() {
    return intervalNanos > 0L;
  }

  public Duration interval() {
    return Duration.ofNanos(intervalNanos);
  }

  /** Blocks until the next grant is due, then records it. */
  public void acquire() throws InterruptedException {
    acquireAll(this);
  }

  /**
   * Blocks until every given limiter is due, then records one grant on each of them. The grant is
   * stamped after the wait, so it marks the instant the caller proceeds. Meant for a single
   * dispatching thread.
   */
  public static void acquireAll(IntervalRateLimiter... limiters) throws InterruptedException {
    long waitNanos = nanosUntilDue(limiters);
    while (waitNanos > 0L) {
      TimeUnit.NANOSECONDS.sleep(waitNanos);
      waitNanos = nanosUntilDue(limiters);
    }
    for (IntervalRateLimiter limiter : limiters) {
      limiter.recordGrant();
    }
  }

  /** Nanoseconds until the next grant is allowed; zero when one is due now. */
  public synchronized long nanosUntilDue() {
    if (intervalNanos == 0L || !granted) {
      return 0L;
    }
    return Math.max(0L, lastGrantNanos + intervalNanos - clock.nanoTime());
  }

  private synchronized void recordGrant() {
    if (intervalNanos == 0L) {
      return;
    }
    lastGrantNanos = clock.nanoTime();
    granted = true;
  }

  private static long nanosUntilDue(IntervalRateLimiter... limiters) {
    long longest = 0L;
    for (IntervalRateLimiter limiter : limiters) {
      longest = Math.max(longest, limiter.nanosUntilDue());
    }
    return longest;
  }
}
