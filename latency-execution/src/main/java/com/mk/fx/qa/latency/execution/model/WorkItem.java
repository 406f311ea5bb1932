package com.mk.fx.qa.latency.execution.model;

import java.util.Map;
import java.util.Objects;

/**
 * One scheduled request against one target.
 *
 * @param targetId target the request is sent to
 * @param sequence zero-based index within the target
 * @param globalIndex zero-based index across the whole run
 * @param parameters request-specific query parameters, e.g. the cache-busting token
 */
public record WorkItem(String targetId, int sequence, long globalIndex, Map<String, String> parameters) {

  public WorkItem {
    Objects.requireNonNull(targetId, "targetId");
    parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
  }
}
