package com.mk.fx.qa.latency.execution.processors;

import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskSubmissionRequest;
import com.mk.fx.qa.latency.execution.model.TaskType;
import java.util.UUID;

public interface BenchmarkTaskProcessor {

  TaskType supportedTaskType();

  /**
   * Checks that the request can be run, without running it.
   *
   * @return number of requests the run will issue
   * @throws IllegalArgumentException when the definition is invalid
   */
  long validate(TaskSubmissionRequest request);

  void execute(TaskSubmissionRequest request) throws Exception;

  /**
   * Signals a running task to stop dispatching.
   *
   * @return true when a run of {@code taskId} was in progress and has been signalled
   */
  boolean cancel(UUID taskId);
}
