package com.mk.fx.qa.latency.execution.dto.controllerresponse;

import com.mk.fx.qa.latency.execution.model.TaskStatus;
import java.time.Instant;
import java.util.UUID;

/** Lifecycle state of a benchmark; live progress is served separately. */
public record TaskStatusResponse(
    UUID taskId,
    String taskType,
    TaskStatus status,
    long plannedRequests,
    Instant submittedAt,
    Instant startedAt,
    Instant completedAt,
    Long runTimeMillis,
    String errorMessage) {}
