package com.mk.fx.qa.latency.execution.model;

import com.mk.fx.qa.latency.execution.validation.Classification;
import java.time.Instant;
import java.util.Objects;

/**
 * Recorded result of executing one {@link WorkItem}. Elapsed time is derived from the monotonic
 * timestamps only; {@code startedAt} is kept for export.
 *
 * @param targetId target identifier
 * @param sequence index within the target
 * @param globalIndex index across the run
 * @param startedAt wall-clock instant the request started
 * @param startNanos monotonic reading taken immediately before the network call
 * @param endNanos monotonic reading taken once the response was received or the call failed
 * @param httpStatus response status, null when no response was received
 * @param responseBytes body size, null when no response was received
 * @param classification success or failure with its reason
 * @param resourcesReleased whether the connection lease was released
 * @param cleanupError description of a failed release, or null
 * @param route proxy route and reported exit, {@link RouteInfo#NONE} when not proxied
 */
public record RequestOutcome(
    String targetId,
    int sequence,
    long globalIndex,
    Instant startedAt,
    long startNanos,
    long endNanos,
    Integer httpStatus,
    Integer responseBytes,
    Classification classification,
    boolean resourcesReleased,
    String cleanupError,
    RouteInfo route) {

  public RequestOutcome {
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(classification, "classification");
    if (endNanos < startNanos) {
      throw new IllegalArgumentException("endNanos precedes startNanos");
    }
    route = route != null ? route : RouteInfo.NONE;
  }

  public RequestOutcome(
      String targetId,
      int sequence,
      long globalIndex,
      Instant startedAt,
      long startNanos,
      long endNanos,
      Integer httpStatus,
      Integer responseBytes,
      Classification classification,
      boolean resourcesReleased,
      String cleanupError) {
    this(
        targetId,
        sequence,
        globalIndex,
        startedAt,
        startNanos,
        endNanos,
        httpStatus,
        responseBytes,
        classification,
        resourcesReleased,
        cleanupError,
        RouteInfo.NONE);
  }

  /** Builds a failure outcome for a work item that never produced a response. */
  public static RequestOutcome failed(
      WorkItem item, long startNanos, long endNanos, Classification classification) {
    return new RequestOutcome(
        item.targetId(),
        item.sequence(),
        item.globalIndex(),
        Instant.now(),
        startNanos,
        Math.max(startNanos, endNanos),
        null,
        null,
        classification,
        true,
        null);
  }

  public long elapsedNanos() {
    return endNanos - startNanos;
  }

  public double elapsedMillis() {
    return elapsedNanos() / 1_000_000.0;
  }

  public boolean success() {
    return classification.success();
  }

  public boolean cleanupFailed() {
    return !resourcesReleased || cleanupError != null;
  }

  /** Failure detail, null for successful outcomes. */
  public String errorDetail() {
    return classification.success() ? null : classification.describe();
  }
}
