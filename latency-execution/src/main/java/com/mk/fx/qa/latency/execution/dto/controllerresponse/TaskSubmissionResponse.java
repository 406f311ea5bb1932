package com.mk.fx.qa.latency.execution.dto.controllerresponse;

import com.mk.fx.qa.latency.execution.model.TaskStatus;
import java.util.UUID;

public record TaskSubmissionResponse(UUID taskId, TaskStatus status, String message) {}
