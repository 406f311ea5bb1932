package com.mk.fx.qa.latency.execution.metrics;

import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Running counters for one target. Written only by the {@link ResultSink} consumer thread; once
 * {@link #freeze() frozen} it is read-only and further recording fails.
 */
public final class TargetAggregate {

  static final int RESERVOIR_CAPACITY = 10_000;

  private final String targetId;
  private final Map<String, Long> failuresByReason = new TreeMap<>();
  private final Reservoir successLatencies;

  private long totalRequests;
  private long successCount;
  private long successElapsedNanos;
  private long successBytes;
  private long firstStartNanos = Long.MAX_VALUE;
  private long lastEndNanos = Long.MIN_VALUE;
  private long minSuccessNanos = Long.MAX_VALUE;
  private long maxSuccessNanos = Long.MIN_VALUE;
  private long cleanupFailures;
  private volatile boolean frozen;

  public TargetAggregate(String targetId) {
    this(targetId, new Reservoir(RESERVOIR_CAPACITY));
  }

  TargetAggregate(String targetId, Reservoir successLatencies) {
    this.targetId = Objects.requireNonNull(targetId, "targetId");
    this.successLatencies = successLatencies;
  }

  public void record(RequestOutcome outcome) {
    if (frozen) {
      throw new IllegalStateException("Aggregate for target " + targetId + " is frozen");
    }
    if (!targetId.equals(outcome.targetId())) {
      throw new IllegalArgumentException(
          "Outcome for " + outcome.targetId() + " recorded against " + targetId);
    }

    totalRequests++;
    firstStartNanos = Math.min(firstStartNanos, outcome.startNanos());
    lastEndNanos = Math.max(lastEndNanos, outcome.endNanos());
    if (outcome.cleanupFailed()) {
      cleanupFailures++;
    }

    if (outcome.success()) {
      long elapsed = outcome.elapsedNanos();
      successCount++;
      successElapsedNanos += elapsed;
      successBytes += outcome.responseBytes() != null ? outcome.responseBytes() : 0;
      minSuccessNanos = Math.min(minSuccessNanos, elapsed);
      maxSuccessNanos = Math.max(maxSuccessNanos, elapsed);
      successLatencies.add(elapsed);
    } else {
      failuresByReason.merge(outcome.classification().reason(), 1L, Long::sum);
    }
  }

  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  public String getTargetId() {
    return targetId;
  }

  public long getTotalRequests() {
    return totalRequests;
  }

  public long getSuccessCount() {
    return successCount;
  }

  public long getFailureCount() {
    return totalRequests - successCount;
  }

  public Map<String, Long> getFailuresByReason() {
    return Collections.unmodifiableMap(new TreeMap<>(failuresByReason));
  }

  public long getSuccessElapsedNanos() {
    return successElapsedNanos;
  }

  public long getSuccessBytes() {
    return successBytes;
  }

  public long getCleanupFailures() {
    return cleanupFailures;
  }

  /** Nanoseconds from the earliest start to the latest end, 0 when nothing was recorded. */
  public long getSpanNanos() {
    return totalRequests == 0 ? 0L : Math.max(0L, lastEndNanos - firstStartNanos);
  }

  public Optional<Long> getMinSuccessNanos() {
    return successCount == 0 ? Optional.empty() : Optional.of(minSuccessNanos);
  }

  public Optional<Long> getMaxSuccessNanos() {
    return successCount == 0 ? Optional.empty() : Optional.of(maxSuccessNanos);
  }

  public Optional<Long> successPercentileNanos(int percentile) {
    return successLatencies.percentile(percentile);
  }
}
