package com.mk.fx.qa.latency.execution.dto.controllerresponse;

/**
 * Totals over every benchmark that finished since startup, including those already evicted from
 * the history. The run success rate ignores cancelled runs; the request success rate counts every
 * completed request, cancelled runs included.
 */
public record TaskMetricsResponse(
    long completedRuns,
    long failedRuns,
    long cancelledRuns,
    double averageRunTimeMillis,
    double runSuccessRate,
    long requestsCompleted,
    long requestsSucceeded,
    double requestSuccessRate) {}
