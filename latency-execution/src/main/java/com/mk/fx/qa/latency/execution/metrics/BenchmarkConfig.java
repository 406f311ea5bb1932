package com.mk.fx.qa.latency.execution.metrics;

import java.time.Duration;
import java.util.List;

/**
 * Immutable description of a run used for progress logging and reports, derived from the resolved
 * benchmark plan.
 */
public record BenchmarkConfig(
    String taskId,
    String taskType,
    List<String> targets,
    int concurrency,
    Double ratePerSec,
    int requestsPerTarget,
    Duration connectTimeout,
    Duration readTimeout,
    long expectedTotalRequests,
    Duration progressInterval) {

  public BenchmarkConfig {
    targets = targets != null ? List.copyOf(targets) : List.of();
  }
}
