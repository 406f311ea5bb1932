package com.mk.fx.qa.latency.execution.processors.latency;

import com.mk.fx.qa.latency.execution.executors.dispatch.DispatchParameters;
import com.mk.fx.qa.latency.execution.executors.request.TargetPlan;
import com.mk.fx.qa.latency.execution.model.RunParameters;
import com.mk.fx.qa.latency.execution.model.TargetDescriptor;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated, fully resolved benchmark: targets with their connection policies and classifiers,
 * the run parameters and the shared request settings.
 */
public record BenchmarkPlan(
    String runId,
    String name,
    List<TargetPlan> targets,
    RunParameters parameters,
    Map<String, String> headers,
    Map<String, String> variables) {

  public BenchmarkPlan {
    targets = List.copyOf(targets);
    headers = headers != null ? Map.copyOf(headers) : Map.of();
    variables = variables != null ? Map.copyOf(variables) : Map.of();
  }

  public List<TargetDescriptor> descriptors() {
    return targets.stream().map(TargetPlan::descriptor).toList();
  }

  public List<String> targetIds() {
    return targets.stream().map(TargetPlan::id).toList();
  }

  public long expectedTotalRequests() {
    long total = 0;
    for (TargetPlan target : targets) {
      Integer override = target.descriptor().requestCount();
      total += override != null ? override : parameters.requestsPerTarget();
    }
    return total;
  }

  public DispatchParameters dispatchParameters() {
    Map<String, Duration> perTarget = new HashMap<>();
    for (TargetPlan target : targets) {
      if (target.descriptor().minInterval() != null) {
        perTarget.put(target.id(), target.descriptor().minInterval());
      }
    }
    Duration global =
        DispatchParameters.of(parameters.concurrency(), parameters.ratePerSec()).minInterval();
    return new DispatchParameters(parameters.concurrency(), global, perTarget);
  }
}
