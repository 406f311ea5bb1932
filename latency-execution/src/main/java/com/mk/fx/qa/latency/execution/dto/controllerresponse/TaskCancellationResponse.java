package com.mk.fx.qa.latency.execution.dto.controllerresponse;

import com.mk.fx.qa.latency.execution.model.TaskStatus;
import java.util.UUID;

/** Result of a cancellation request with the task status observed afterwards. */
public record TaskCancellationResponse(UUID taskId, TaskStatus status, String message) {}
