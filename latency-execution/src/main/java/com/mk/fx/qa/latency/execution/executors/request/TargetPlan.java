package com.mk.fx.qa.latency.execution.executors.request;

import com.mk.fx.qa.latency.execution.model.TargetDescriptor;
import com.mk.fx.qa.latency.execution.validation.ResponseClassifier;
import com.mk.fx.qa.latency.rest.ConnectionPolicy;
import java.util.Objects;

/**
 * A target resolved for execution: its descriptor, the effective connection policy and the
 * classifier built from its validation rules.
 */
public record TargetPlan(
    TargetDescriptor descriptor, ConnectionPolicy policy, ResponseClassifier classifier) {

  public TargetPlan {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(classifier, "classifier");
  }

  public String id() {
    return descriptor.id();
  }
}
