package com.mk.fx.qa.latency.execution.executors.dispatch;

import java.time.Duration;
import java.util.Map;

/**
 * Dispatch settings.
 *
 * @param concurrency maximum number of work items in flight
 * @param minInterval global minimum spacing between dispatches, null for none
 * @param targetMinIntervals additional per-target spacing keyed by target id
 */
public record DispatchParameters(
    int concurrency, Duration minInterval, Map<String, Duration> targetMinIntervals) {

  public DispatchParameters {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1");
    }
    targetMinIntervals = targetMinIntervals != null ? Map.copyOf(targetMinIntervals) : Map.of();
  }

  public static DispatchParameters of(int concurrency, Double ratePerSec) {
    Duration interval =
        ratePerSec != null && ratePerSec > 0.0
            ? Duration.ofNanos((long) Math.ceil(1_000_000_000L / ratePerSec))
            : null;
    return new DispatchParameters(concurrency, interval, Map.of());
  }
}
