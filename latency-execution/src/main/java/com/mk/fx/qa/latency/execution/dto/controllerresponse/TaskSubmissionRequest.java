package com.mk.fx.qa.latency.execution.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.Map;
import lombok.Data;

/**
 * A benchmark submission. {@code data} carries the task-type specific definition, for LATENCY
 * tasks a {@link com.mk.fx.qa.latency.execution.dto.latency.LatencyTaskDefinition}. The id and
 * creation time are assigned by the service.
 */
@Data
public class TaskSubmissionRequest {

  @JsonProperty(value = "taskId", access = JsonProperty.Access.READ_ONLY)
  private String taskId;

  @NotBlank
  @JsonProperty("taskType")
  private String taskType;

  @JsonProperty(value = "createdAt", access = JsonProperty.Access.READ_ONLY)
  private Instant createdAt;

  @NotNull
  @JsonProperty("data")
  private Map<String, Object> data;
}
