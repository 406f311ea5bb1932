package com.mk.fx.qa.latency.execution.dto.controllerresponse;

import com.mk.fx.qa.latency.execution.model.TaskStatus;
import java.time.Instant;
import java.util.UUID;

public record TaskSummaryResponse(
    UUID taskId, TaskStatus status, long plannedRequests, Instant submittedAt) {}
