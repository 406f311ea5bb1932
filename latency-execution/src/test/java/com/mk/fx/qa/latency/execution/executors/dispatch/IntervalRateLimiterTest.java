package com.mk.fx.qa.latency.execution.executors.dispatch;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class IntervalRateLimiterTest {

  @Test
  void perSecond_derivesInterval() {
    IntervalRateLimiter limiter = IntervalRateLimiter.perSecond(10.0);
    assertTrue(limiter.isEnabled());
    assertEquals(Duration.ofMillis(100), limiter.interval());
    assertEquals(Duration.ofNanos(333_333_334L), IntervalRateLimiter.perSecond(3.0).interval());
  }

  @Test
  void missingOrNonPositiveRate_disablesLimiting() {
    assertFalse(IntervalRateLimiter.perSecond(null).isEnabled());
    assertFalse(IntervalRateLimiter.perSecond(0.0).isEnabled());
    assertFalse(IntervalRateLimiter.ofInterval(null).isEnabled());
    assertFalse(IntervalRateLimiter.ofInterval(Duration.ZERO).isEnabled());
    assertFalse(IntervalRateLimiter.disabled().isEnabled());
  }

  @Test
  void firstGrantIsImmediate_laterGrantsDueAfterInterval() throws Exception {
    AtomicLong now = new AtomicLong(1_000L);
    var limiter = new IntervalRateLimiter(500L, now::get);

    limiter.acquire();
    now.addAndGet(500L);
    long before = System.nanoTime();
    limiter.acquire();
    long waitedNanos = System.nanoTime() - before;

    assertTrue(waitedNanos < Duration.ofMillis(50).toNanos(), "Grant already due should not block");
  }

  @Test
  void grantIsStampedAfterTheWait() throws Exception {
    AtomicLong now = new AtomicLong(0L);
    var limiter = new IntervalRateLimiter(500L, now::get);

    limiter.acquire();
    assertEquals(500L, limiter.nanosUntilDue());
    now.set(2_000L);
    limiter.acquire();

    assertEquals(500L, limiter.nanosUntilDue());
    now.set(2_300L);
    assertEquals(200L, limiter.nanosUntilDue());
  }

  @Test
  void acquireAll_waitsForTheSlowestLimiter() throws Exception {
    IntervalRateLimiter global = IntervalRateLimiter.ofInterval(Duration.ofMillis(20));
    IntervalRateLimiter target = IntervalRateLimiter.ofInterval(Duration.ofMillis(120));

    IntervalRateLimiter.acquireAll(global, target);
    long start = System.nanoTime();
    IntervalRateLimiter.acquireAll(global, target);
    long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

    assertTrue(elapsedMs >= 110, "Expected the 120 ms limiter to govern but took " + elapsedMs);
    assertTrue(global.nanosUntilDue() > Duration.ofMillis(10).toNanos());
  }

  @Test
  void successiveGrants_spacedByInterval() throws Exception {
    IntervalRateLimiter limiter = IntervalRateLimiter.ofInterval(Duration.ofMillis(40));
    long start = System.nanoTime();
    for (int i = 0; i < 5; i++) {
      limiter.acquire();
    }
    long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
    assertTrue(elapsedMs >= 160, "Expected at least 4 intervals but took " + elapsedMs + " ms");
  }

  @Test
  void disabled_neverBlocks() throws Exception {
    IntervalRateLimiter limiter = IntervalRateLimiter.disabled();
    long start = System.nanoTime();
    for (int i = 0; i < 1000; i++) {
      limiter.acquire();
    }
    assertTrue(System.nanoTime() - start < Duration.ofSeconds(1).toNanos());
  }
}
