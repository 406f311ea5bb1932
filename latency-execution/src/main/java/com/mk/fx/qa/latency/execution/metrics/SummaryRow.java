package com.mk.fx.qa.latency.execution.metrics;

import java.util.Map;

/**
 * Final statistics for one target. Nullable values are absent because their divisor was zero.
 *
 * @param targetId target identifier
 * @param totalRequests outcomes recorded
 * @param successCount successful outcomes
 * @param failureCount failed outcomes
 * @param failuresByReason failure counts keyed by reason code
 * @param secondsPerRequest span divided by total requests; null without requests
 * @param successRatePercent successes over total requests times 100; 0 without requests
 * @param meanLatencyMs mean successful latency; null without successes
 * @param spanMs earliest start to latest completion
 * @param meanResponseBytes mean successful body size; null without successes
 * @param minLatencyMs fastest success; null without successes
 * @param maxLatencyMs slowest success; null without successes
 * @param p95LatencyMs 95th percentile of successes; null without successes
 * @param p99LatencyMs 99th percentile of successes; null without successes
 * @param cleanupFailures outcomes whose connection could not be released cleanly
 */
public record SummaryRow(
    String targetId,
    long totalRequests,
    long successCount,
    long failureCount,
    Map<String, Long> failuresByReason,
    Double secondsPerRequest,
    double successRatePercent,
    Double meanLatencyMs,
    double spanMs,
    Double meanResponseBytes,
    Double minLatencyMs,
    Double maxLatencyMs,
    Double p95LatencyMs,
    Double p99LatencyMs,
    long cleanupFailures) {

  public SummaryRow {
    failuresByReason = failuresByReason != null ? Map.copyOf(failuresByReason) : Map.of();
  }
}
