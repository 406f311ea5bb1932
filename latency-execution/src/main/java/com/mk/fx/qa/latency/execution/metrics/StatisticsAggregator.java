package com.mk.fx.qa.latency.execution.metrics;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Derives {@link SummaryRow}s from frozen aggregates. Never mutates its input, so repeated calls on
 * the same aggregate give equal rows.
 *
 * <p>Zero divisors: success rate is 0 when there were no requests; seconds per request, mean
 * latency, mean size and the latency distribution are null when their divisor is 0.
 */
public final class StatisticsAggregator {

  private StatisticsAggregator() {
    throw new UnsupportedOperationException("StatisticsAggregator cannot be instantiated");
  }

  public static SummaryRow summarise(TargetAggregate aggregate) {
    if (!aggregate.isFrozen()) {
      throw new IllegalStateException(
          "Aggregate for target " + aggregate.getTargetId() + " is still accepting outcomes");
    }

    long total = aggregate.getTotalRequests();
    long successes = aggregate.getSuccessCount();
    long spanNanos = aggregate.getSpanNanos();

    Double secondsPerRequest = total == 0 ? null : (spanNanos / 1_000_000_000.0) / total;
    double successRate = total == 0 ? 0.0 : (double) successes / total * 100.0;
    Double meanLatencyMs =
        successes == 0 ? null : toMillis(aggregate.getSuccessElapsedNanos()) / successes;
    Double meanBytes = successes == 0 ? null : (double) aggregate.getSuccessBytes() / successes;

    return new SummaryRow(
        aggregate.getTargetId(),
        total,
        successes,
        aggregate.getFailureCount(),
        aggregate.getFailuresByReason(),
        secondsPerRequest,
        successRate,
        meanLatencyMs,
        toMillis(spanNanos),
        meanBytes,
        millis(aggregate.getMinSuccessNanos()),
        millis(aggregate.getMaxSuccessNanos()),
        millis(aggregate.successPercentileNanos(95)),
        millis(aggregate.successPercentileNanos(99)),
        aggregate.getCleanupFailures());
  }

  public static List<SummaryRow> summarise(Collection<TargetAggregate> aggregates) {
    return aggregates.stream().map(StatisticsAggregator::summarise).toList();
  }

  private static Double millis(Optional<Long> nanos) {
    return nanos.map(StatisticsAggregator::toMillis).orElse(null);
  }

  private static double toMillis(long nanos) {
    return nanos / 1_000_000.0;
  }
}
