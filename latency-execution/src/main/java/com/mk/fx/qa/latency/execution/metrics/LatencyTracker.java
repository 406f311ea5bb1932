package com.mk.fx.qa.latency.execution.metrics;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live latency statistics fed from worker threads. Values are recorded in nanoseconds and reported
 * in milliseconds.
 */
final class LatencyTracker {

  private final AtomicLong count = new AtomicLong();
  private final AtomicLong min = new AtomicLong(Long.MAX_VALUE);
  private final AtomicLong max = new AtomicLong(Long.MIN_VALUE);
  private final AtomicLong sum = new AtomicLong();
  private final Reservoir reservoir;

  LatencyTracker(int reservoirCapacity) {
    this.reservoir = new Reservoir(reservoirCapacity);
  }

  void record(long elapsedNanos) {
    long v = Math.max(0, elapsedNanos);
    sum.addAndGet(v);
    max.accumulateAndGet(v, Math::max);
    min.accumulateAndGet(v, Math::min);
    reservoir.add(v);
    count.incrementAndGet();
  }

  Optional<Double> minMs() {
    long v = min.get();
    return v == Long.MAX_VALUE ? Optional.empty() : Optional.of(toMillis(v));
  }

  Optional<Double> maxMs() {
    long v = max.get();
    return v == Long.MIN_VALUE ? Optional.empty() : Optional.of(toMillis(v));
  }

  Optional<Double> avgMs() {
    long c = count.get();
    return c == 0 ? Optional.empty() : Optional.of(toMillis(sum.get()) / c);
  }

  Optional<Double> p95Ms() {
    return reservoir.percentile(95).map(LatencyTracker::toMillis);
  }

  Optional<Double> p99Ms() {
    return reservoir.percentile(99).map(LatencyTracker::toMillis);
  }

  static double toMillis(long nanos) {
    return nanos / 1_000_000.0;
  }
}
