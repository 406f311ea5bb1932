package com.mk.fx.qa.latency.execution.executors.dispatch;

import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import com.mk.fx.qa.latency.execution.model.WorkItem;

@FunctionalInterface
public interface WorkItemExecutor {

  /** Performs exactly one round trip for the item and returns its outcome. */
  RequestOutcome execute(WorkItem item) throws InterruptedException;
}
