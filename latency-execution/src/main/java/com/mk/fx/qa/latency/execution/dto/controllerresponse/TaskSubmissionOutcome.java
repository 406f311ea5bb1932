package com.mk.fx.qa.latency.execution.dto.controllerresponse;

import com.mk.fx.qa.latency.execution.model.TaskStatus;
import java.util.UUID;

/** What the service did with a submission; mapped to an HTTP status by the controller. */
public record TaskSubmissionOutcome(
    UUID taskId, TaskStatus status, Rejection rejection, String message) {

  /** Why a submission was refused. */
  public enum Rejection {
    NO_PROCESSOR,
    DUPLICATE_ID,
    QUEUE_FULL
  }

  public static TaskSubmissionOutcome accepted(UUID taskId, TaskStatus status) {
    String message = status == TaskStatus.QUEUED ? "Benchmark queued" : "Benchmark " + status;
    return new TaskSubmissionOutcome(taskId, status, null, message);
  }

  public static TaskSubmissionOutcome rejected(UUID taskId, Rejection rejection, String message) {
    return new TaskSubmissionOutcome(taskId, TaskStatus.ERROR, rejection, message);
  }

  public boolean isAccepted() {
    return rejection == null;
  }
}
