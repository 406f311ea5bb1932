package com.mk.fx.qa.latency.execution.executors.dispatch;

import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import com.mk.fx.qa.latency.execution.model.WorkItem;

/** Progress callbacks; invoked from dispatcher and worker threads. */
public interface DispatchListener {

  DispatchListener NONE = new DispatchListener() {};

  default void onDispatched(WorkItem item) {}

  default void onCompleted(RequestOutcome outcome) {}
}
