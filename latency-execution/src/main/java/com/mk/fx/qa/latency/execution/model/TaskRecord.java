package com.mk.fx.qa.latency.execution.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Mutable lifecycle record of one {@link BenchmarkTask}. State transitions are synchronized; reads
 * see the latest published values.
 */
public class TaskRecord {

  private final BenchmarkTask task;
  private final long plannedRequests;
  private final Instant submittedAt;
  private volatile TaskStatus status = TaskStatus.QUEUED;
  private volatile Instant startedAt;
  private volatile Instant completedAt;
  private volatile String errorMessage;

  public TaskRecord(BenchmarkTask task, long plannedRequests, Instant submittedAt) {
    this.task = task;
    this.plannedRequests = plannedRequests;
    this.submittedAt = submittedAt;
  }

  /** Returns false when the task is no longer queued. */
  public synchronized boolean markProcessing(Instant when) {
    if (status != TaskStatus.QUEUED) {
      return false;
    }
    status = TaskStatus.PROCESSING;
    startedAt = when;
    return true;
  }

  public synchronized boolean markCompleted(Instant when) {
    return finish(TaskStatus.COMPLETED, when, null);
  }

  public synchronized boolean markCancelled(Instant when) {
    return finish(TaskStatus.CANCELLED, when, null);
  }

  public synchronized boolean markErrored(Instant when, String message) {
    return finish(TaskStatus.ERROR, when, message);
  }

  /** Queued tasks only; a task that already started is left alone. */
  public synchronized boolean cancelIfQueued(Instant when) {
    return status == TaskStatus.QUEUED && finish(TaskStatus.CANCELLED, when, null);
  }

  private boolean finish(TaskStatus terminal, Instant when, String message) {
    if (status.isTerminal()) {
      return false;
    }
    status = terminal;
    completedAt = when;
    errorMessage = message;
    return true;
  }

  public UUID getTaskId() {
    return task.getId();
  }

  public BenchmarkTask getTask() {
    return task;
  }

  /** Requests the validated plan will issue. */
  public long getPlannedRequests() {
    return plannedRequests;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public Optional<Instant> getStartedAt() {
    return Optional.ofNullable(startedAt);
  }

  public Optional<Instant> getCompletedAt() {
    return Optional.ofNullable(completedAt);
  }

  public Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  /** Milliseconds spent processing; running tasks report time so far, queued tasks report 0. */
  public long getProcessingDurationMillis() {
    Instant start = startedAt;
    if (start == null) {
      return 0L;
    }
    Instant end = completedAt != null ? completedAt : Instant.now();
    return Math.max(0L, Duration.between(start, end).toMillis());
  }
}
