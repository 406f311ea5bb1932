package com.mk.fx.qa.latency.execution.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mk.fx.qa.latency.execution.model.RequestOutcome;

/** One line of {@code detailed_results.csv}. */
@JsonPropertyOrder({
  "timestamp",
  "request_index",
  "target",
  "sequence",
  "status_code",
  "response_time_ms",
  "response_bytes",
  "success",
  "failure_reason",
  "error_message",
  "resources_released",
  "region",
  "requested_country",
  "exit_ip",
  "exit_country"
})
public record DetailCsvRow(
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("request_index") long requestIndex,
    @JsonProperty("target") String target,
    @JsonProperty("sequence") int sequence,
    @JsonProperty("status_code") Integer statusCode,
    @JsonProperty("response_time_ms") double responseTimeMs,
    @JsonProperty("response_bytes") Integer responseBytes,
    @JsonProperty("success") boolean success,
    @JsonProperty("failure_reason") String failureReason,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("resources_released") boolean resourcesReleased,
    @JsonProperty("region") String region,
    @JsonProperty("requested_country") String requestedCountry,
    @JsonProperty("exit_ip") String exitIp,
    @JsonProperty("exit_country") String exitCountry) {

  public static DetailCsvRow from(RequestOutcome outcome) {
    return new DetailCsvRow(
        outcome.startedAt() != null ? outcome.startedAt().toString() : null,
        outcome.globalIndex(),
        outcome.targetId(),
        outcome.sequence(),
        outcome.httpStatus(),
        CsvFormat.round(outcome.elapsedMillis(), 3),
        outcome.responseBytes(),
        outcome.success(),
        outcome.success() ? null : outcome.classification().reason(),
        outcome.errorDetail(),
        outcome.resourcesReleased() && outcome.cleanupError() == null,
        outcome.route().region(),
        outcome.route().requestedCountry(),
        outcome.route().exitIp(),
        outcome.route().exitCountry());
  }
}
