package com.mk.fx.qa.latency.execution.service;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mk.fx.qa.latency.execution.cfg.BenchmarkQueueCfg;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.QueueStatusResponse;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskHistoryEntry;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskMetricsResponse;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskStatusResponse;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskSubmissionOutcome;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskSubmissionOutcome.Rejection;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskSubmissionRequest;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskSummaryResponse;
import com.mk.fx.qa.latency.execution.metrics.BenchmarkMetricsRegistry;
import com.mk.fx.qa.latency.execution.model.BenchmarkTask;
import com.mk.fx.qa.latency.execution.model.TaskRecord;
import com.mk.fx.qa.latency.execution.model.TaskStatus;
import com.mk.fx.qa.latency.execution.model.TaskType;
import com.mk.fx.qa.latency.execution.processors.BenchmarkTaskProcessor;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Queue of benchmark runs.
 *
 * <p>A submitted benchmark is validated by the processor for its {@link TaskType}, which also
 * reports how many requests the plan issues, and then waits for one of the configured workers. A
 * worker runs one benchmark at a time. Finished runs go to a bounded {@link BenchmarkHistory} that
 * joins their lifecycle with the request counts of their report.
 *
 * <p>Cancellation is immediate for a waiting benchmark. A running one is asked to stop dispatching;
 * it becomes CANCELLED once its in-flight requests have drained and its results are flushed.
 */
@Slf4j
@Service
public class BenchmarkTaskService {

  private final BenchmarkQueueCfg queueCfg;
  private final BenchmarkMetricsRegistry metricsRegistry;
  private final ImmutableMap<TaskType, BenchmarkTaskProcessor> processors;
  private final ThreadPoolExecutor workers;
  private final BenchmarkHistory history;
  private final Map<UUID, TaskRecord> tasks = new ConcurrentHashMap<>();
  private final Map<UUID, Future<?>> futures = new ConcurrentHashMap<>();
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  /**
   * @throws IllegalStateException if two processors declare the same task type
   */
  public BenchmarkTaskService(
      BenchmarkQueueCfg queueCfg,
      BenchmarkMetricsRegistry metricsRegistry,
      List<BenchmarkTaskProcessor> processors) {
    this.queueCfg = queueCfg;
    this.metricsRegistry = metricsRegistry;
    this.processors = indexByType(processors);
    this.history = new BenchmarkHistory(queueCfg.getHistorySize());
    this.workers =
        new ThreadPoolExecutor(
            queueCfg.getWorkers(),
            queueCfg.getWorkers(),
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCfg.getCapacity()),
            new ThreadFactoryBuilder().setNameFormat("benchmark-worker-%d").setDaemon(true).build(),
            new ThreadPoolExecutor.AbortPolicy());
    log.info(
        "Benchmark queue ready: workers={} capacity={} historySize={} processors={}",
        queueCfg.getWorkers(),
        queueCfg.getCapacity(),
        queueCfg.getHistorySize(),
        this.processors.keySet());
  }

  private static ImmutableMap<TaskType, BenchmarkTaskProcessor> indexByType(
      List<BenchmarkTaskProcessor> processors) {
    try {
      return Maps.uniqueIndex(processors, BenchmarkTaskProcessor::supportedTaskType);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Multiple processors registered for one task type", e);
    }
  }

  /**
   * Validates a benchmark and queues it.
   *
   * @return empty once the service has stopped accepting work, otherwise what became of the task
   * @throws IllegalArgumentException when the definition is invalid
   */
  public Optional<TaskSubmissionOutcome> submitTask(BenchmarkTask task) {
    if (!accepting.get()) {
      return Optional.empty();
    }
    UUID taskId = task.getId();
    var processor = processors.get(task.getTaskType());
    if (processor == null) {
      return Optional.of(
          TaskSubmissionOutcome.rejected(
              taskId,
              Rejection.NO_PROCESSOR,
              "No processor available for task type " + task.getTaskType()));
    }

    long planned = processor.validate(toSubmissionRequest(task));
    var record = new TaskRecord(task, planned, Instant.now());
    if (tasks.putIfAbsent(taskId, record) != null) {
      return Optional.of(
          TaskSubmissionOutcome.rejected(
              taskId, Rejection.DUPLICATE_ID, "Task ID already exists"));
    }

    try {
      futures.put(taskId, workers.submit(() -> run(record, processor)));
    } catch (RejectedExecutionException e) {
      tasks.remove(taskId);
      log.warn("Benchmark {} rejected, {} already waiting", taskId, workers.getQueue().size());
      return Optional.of(
          TaskSubmissionOutcome.rejected(taskId, Rejection.QUEUE_FULL, "Benchmark queue is full"));
    }
    if (record.getStatus().isTerminal()) {
      futures.remove(taskId);
    }
    log.info("Benchmark {} queued with {} planned requests", taskId, planned);
    return Optional.of(TaskSubmissionOutcome.accepted(taskId, record.getStatus()));
  }

  private void run(TaskRecord record, BenchmarkTaskProcessor processor) {
    UUID taskId = record.getTaskId();
    try {
      if (Thread.currentThread().isInterrupted()) {
        cancelWaiting(record);
        return;
      }
      if (!record.markProcessing(Instant.now())) {
        log.info("Benchmark {} cancelled before start", taskId);
        return;
      }
      log.info("Benchmark {} started", taskId);
      try {
        processor.execute(toSubmissionRequest(record.getTask()));
        record.markCompleted(Instant.now());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        record.markCancelled(Instant.now());
      } catch (Exception e) {
        record.markErrored(Instant.now(), e.getMessage());
        log.error("Benchmark {} failed: {}", taskId, e.getMessage(), e);
      }
      var entry = history.record(record, metricsRegistry.getReport(taskId));
      log.info(
          "Benchmark {} {} after {} ms, {}/{} requests completed",
          taskId,
          entry.status(),
          entry.runTimeMillis(),
          entry.completedRequests(),
          entry.plannedRequests());
    } finally {
      futures.remove(taskId);
    }
  }

  private TaskSubmissionRequest toSubmissionRequest(BenchmarkTask task) {
    TaskSubmissionRequest request = new TaskSubmissionRequest();
    request.setTaskId(task.getId().toString());
    request.setTaskType(task.getTaskType().name());
    request.setCreatedAt(task.getCreatedAt());
    request.setData(task.getData());
    return request;
  }

  public Optional<TaskStatusResponse> getTaskStatus(UUID taskId) {
    return Optional.ofNullable(tasks.get(taskId)).map(BenchmarkTaskService::toStatusResponse);
  }

  /**
   * Benchmarks known to the service, newest submission first.
   *
   * @param status only benchmarks in this state, or all when null
   */
  public List<TaskSummaryResponse> listTasks(TaskStatus status) {
    return tasks.values().stream()
        .filter(record -> status == null || record.getStatus() == status)
        .sorted(Comparator.comparing(TaskRecord::getSubmittedAt).reversed())
        .map(
            record ->
                new TaskSummaryResponse(
                    record.getTaskId(),
                    record.getStatus(),
                    record.getPlannedRequests(),
                    record.getSubmittedAt()))
        .collect(Collectors.toList());
  }

  /** Most recently finished benchmarks first, bounded by the configured history size. */
  public List<TaskHistoryEntry> getTaskHistory() {
    return history.newestFirst();
  }

  public QueueStatusResponse getQueueStatus() {
    int queued = 0;
    int running = 0;
    long queuedRequests = 0;
    long remainingRequests = 0;
    for (TaskRecord record : tasks.values()) {
      switch (record.getStatus()) {
        case QUEUED -> {
          queued++;
          queuedRequests += record.getPlannedRequests();
        }
        case PROCESSING -> {
          running++;
          remainingRequests += remaining(record);
        }
        default -> {}
      }
    }
    return new QueueStatusResponse(
        queued, running, queueCfg.getWorkers(), accepting.get(), queuedRequests, remainingRequests);
  }

  private long remaining(TaskRecord record) {
    return metricsRegistry
        .getSnapshot(record.getTaskId())
        .map(snapshot -> Math.max(0L, record.getPlannedRequests() - snapshot.completed()))
        .orElse(record.getPlannedRequests());
  }

  public TaskMetricsResponse getMetrics() {
    return history.totals();
  }

  /**
   * Cancels a waiting benchmark, or asks a running one to stop dispatching.
   *
   * <p>A running benchmark answers with {@link CancellationState#CANCELLATION_REQUESTED}; it
   * becomes CANCELLED once in-flight requests have drained and results are flushed.
   */
  public CancellationResult cancelTask(UUID taskId) {
    var record = tasks.get(taskId);
    if (record == null) {
      return new CancellationResult(CancellationState.NOT_FOUND, null);
    }
    if (record.getStatus().isTerminal()) {
      return new CancellationResult(CancellationState.NOT_CANCELLABLE, record.getStatus());
    }
    if (cancelWaiting(record)) {
      return new CancellationResult(CancellationState.CANCELLED, record.getStatus());
    }
    stopRunning(record);
    return new CancellationResult(CancellationState.CANCELLATION_REQUESTED, record.getStatus());
  }

  private boolean cancelWaiting(TaskRecord record) {
    if (!record.cancelIfQueued(Instant.now())) {
      return false;
    }
    if (futures.remove(record.getTaskId()) instanceof Runnable queued) {
      workers.remove(queued);
    }
    history.record(record, Optional.empty());
    log.info("Benchmark {} cancelled while queued", record.getTaskId());
    return true;
  }

  private void stopRunning(TaskRecord record) {
    UUID taskId = record.getTaskId();
    boolean signalled = processors.get(record.getTask().getTaskType()).cancel(taskId);
    Future<?> future = futures.get(taskId);
    if (future != null) {
      future.cancel(true);
    }
    log.info("Benchmark {} cancellation requested (run signalled: {})", taskId, signalled);
  }

  public Set<String> getSupportedTaskTypes() {
    return processors.keySet().stream().map(TaskType::name).collect(Collectors.toUnmodifiableSet());
  }

  /**
   * Stops accepting benchmarks and cancels those still waiting. Running benchmarks get the
   * configured grace period to finish; after that they are cancelled and given the same period
   * again to flush their results.
   */
  @PreDestroy
  public void shutdown() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    workers.shutdown();
    tasks.values().forEach(this::cancelWaiting);

    long graceMillis = queueCfg.getShutdownGrace().toMillis();
    try {
      if (workers.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
        return;
      }
      log.warn("Benchmarks still running after {} ms, cancelling them", graceMillis);
      tasks.values().stream()
          .filter(record -> record.getStatus() == TaskStatus.PROCESSING)
          .forEach(this::stopRunning);
      if (!workers.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
        log.warn("Benchmark workers did not stop, {} still active", workers.getActiveCount());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
  }

  public boolean isHealthy() {
    return accepting.get() && !workers.isShutdown();
  }

  private static TaskStatusResponse toStatusResponse(TaskRecord record) {
    return new TaskStatusResponse(
        record.getTaskId(),
        record.getTask().getTaskType().name(),
        record.getStatus(),
        record.getPlannedRequests(),
        record.getSubmittedAt(),
        record.getStartedAt().orElse(null),
        record.getCompletedAt().orElse(null),
        record.getProcessingDurationMillis(),
        record.getErrorMessage().orElse(null));
  }

  public enum CancellationState {
    CANCELLED,
    CANCELLATION_REQUESTED,
    NOT_FOUND,
    NOT_CANCELLABLE
  }

  /** Outcome of a cancellation attempt; {@code taskStatus} is null when the task is unknown. */
  public record CancellationResult(CancellationState state, TaskStatus taskStatus) {}
}
