package com.mk.fx.qa.latency.execution.dto.controllerresponse;

import com.mk.fx.qa.latency.execution.model.TaskStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * A finished benchmark as kept in the bounded history.
 *
 * @param name benchmark name from its definition, null when the run never produced a report
 * @param plannedRequests requests the plan called for
 * @param completedRequests requests that produced an outcome
 * @param successfulRequests outcomes that passed validation
 * @param successRatePercent successful over completed, null when nothing completed
 * @param completionReason ALL_DISPATCHED, CANCELLED or FAILED as written in the report
 * @param exportDirectory directory holding the CSV exports, null when export was disabled
 */
public record TaskHistoryEntry(
    UUID taskId,
    String name,
    TaskStatus status,
    Instant startedAt,
    Instant completedAt,
    long runTimeMillis,
    long plannedRequests,
    long completedRequests,
    long successfulRequests,
    Double successRatePercent,
    String completionReason,
    String exportDirectory,
    String errorMessage) {}
