package com.mk.fx.qa.latency.execution.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mk.fx.qa.latency.execution.metrics.SummaryRow;

/** One line of {@code summary_statistics.csv}. Absent statistics are written as empty cells. */
@JsonPropertyOrder({
  "target",
  "total_requests",
  "success_count",
  "failure_count",
  "success_rate_percent",
  "seconds_per_request",
  "mean_latency_ms",
  "min_latency_ms",
  "max_latency_ms",
  "p95_latency_ms",
  "p99_latency_ms",
  "span_ms",
  "mean_response_bytes",
  "failures_by_reason",
  "cleanup_failures"
})
public record SummaryCsvRow(
    @JsonProperty("target") String target,
    @JsonProperty("total_requests") long totalRequests,
    @JsonProperty("success_count") long successCount,
    @JsonProperty("failure_count") long failureCount,
    @JsonProperty("success_rate_percent") double successRatePercent,
    @JsonProperty("seconds_per_request") Double secondsPerRequest,
    @JsonProperty("mean_latency_ms") Double meanLatencyMs,
    @JsonProperty("min_latency_ms") Double minLatencyMs,
    @JsonProperty("max_latency_ms") Double maxLatencyMs,
    @JsonProperty("p95_latency_ms") Double p95LatencyMs,
    @JsonProperty("p99_latency_ms") Double p99LatencyMs,
    @JsonProperty("span_ms") double spanMs,
    @JsonProperty("mean_response_bytes") Double meanResponseBytes,
    @JsonProperty("failures_by_reason") String failuresByReason,
    @JsonProperty("cleanup_failures") long cleanupFailures) {

  public static SummaryCsvRow from(SummaryRow row) {
    return new SummaryCsvRow(
        row.targetId(),
        row.totalRequests(),
        row.successCount(),
        row.failureCount(),
        CsvFormat.round(row.successRatePercent(), 2),
        CsvFormat.round(row.secondsPerRequest(), 4),
        CsvFormat.round(row.meanLatencyMs(), 2),
        CsvFormat.round(row.minLatencyMs(), 2),
        CsvFormat.round(row.maxLatencyMs(), 2),
        CsvFormat.round(row.p95LatencyMs(), 2),
        CsvFormat.round(row.p99LatencyMs(), 2),
        CsvFormat.round(row.spanMs(), 2),
        CsvFormat.round(row.meanResponseBytes(), 2),
        CsvFormat.reasons(row.failuresByReason()),
        row.cleanupFailures());
  }
}
