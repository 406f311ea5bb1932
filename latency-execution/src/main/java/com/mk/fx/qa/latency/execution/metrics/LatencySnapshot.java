package com.mk.fx.qa.latency.execution.metrics;

import java.util.Map;

/** Immutable snapshot of live run progress used for polling. */
public record LatencySnapshot(
    BenchmarkConfig config,
    long dispatched,
    long completed,
    long inFlight,
    long successes,
    long failures,
    Double achievedRps,
    Double latencyMinMs,
    Double latencyAvgMs,
    Double latencyMaxMs,
    Double latencyP95Ms,
    Map<String, Long> completedByTarget,
    Map<String, Long> failuresByReason) {}
