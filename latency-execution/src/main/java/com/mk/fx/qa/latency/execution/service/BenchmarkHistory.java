package com.mk.fx.qa.latency.execution.service;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.BenchmarkRunReport;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskHistoryEntry;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskMetricsResponse;
import com.mk.fx.qa.latency.execution.metrics.SummaryRow;
import com.mk.fx.qa.latency.execution.model.TaskRecord;
import com.mk.fx.qa.latency.execution.model.TaskStatus;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Finished benchmarks, newest first, together with totals over every run recorded since startup.
 *
 * <p>Each entry joins the task's lifecycle with the request counts of its {@link
 * BenchmarkRunReport}. Entries beyond the configured size are evicted; the totals keep counting
 * them. All methods are synchronized.
 */
@Slf4j
class BenchmarkHistory {

  private final EvictingQueue<TaskHistoryEntry> entries;

  private long completedRuns;
  private long failedRuns;
  private long cancelledRuns;
  private long completedRunTimeMillis;
  private long requestsCompleted;
  private long requestsSucceeded;

  BenchmarkHistory(int size) {
    this.entries = EvictingQueue.create(size);
  }

  /**
   * Records a run that reached a terminal state.
   *
   * @param record the finished task
   * @param report the run report, empty when the run never started or was rejected before dispatch
   * @return the stored entry
   */
  synchronized TaskHistoryEntry record(TaskRecord record, Optional<BenchmarkRunReport> report) {
    var entry = toEntry(record, report.orElse(null));
    entries.add(entry);

    switch (entry.status()) {
      case COMPLETED -> {
        completedRuns++;
        completedRunTimeMillis += entry.runTimeMillis();
      }
      case ERROR -> failedRuns++;
      case CANCELLED -> cancelledRuns++;
      default -> log.warn("Task {} recorded in state {}", entry.taskId(), entry.status());
    }
    requestsCompleted += entry.completedRequests();
    requestsSucceeded += entry.successfulRequests();
    log.debug(
        "History: task {} {} with {}/{} requests completed",
        entry.taskId(),
        entry.status(),
        entry.completedRequests(),
        entry.plannedRequests());
    return entry;
  }

  synchronized List<TaskHistoryEntry> newestFirst() {
    return ImmutableList.copyOf(entries).reverse();
  }

  synchronized TaskMetricsResponse totals() {
    long finishedRuns = completedRuns + failedRuns;
    return new TaskMetricsResponse(
        completedRuns,
        failedRuns,
        cancelledRuns,
        completedRuns == 0 ? 0.0 : (double) completedRunTimeMillis / completedRuns,
        finishedRuns == 0 ? 0.0 : (double) completedRuns / finishedRuns,
        requestsCompleted,
        requestsSucceeded,
        requestsCompleted == 0 ? 0.0 : (double) requestsSucceeded / requestsCompleted);
  }

  private static TaskHistoryEntry toEntry(TaskRecord record, BenchmarkRunReport report) {
    String name = null;
    long completed = 0;
    long successes = 0;
    String reason = null;
    String exportDirectory = null;
    if (report != null) {
      name = report.name;
      if (report.dispatch != null) {
        completed = report.dispatch.completed;
      }
      if (report.targets != null) {
        successes = report.targets.stream().mapToLong(SummaryRow::successCount).sum();
      }
      if (report.completion != null) {
        reason = report.completion.reason;
      }
      if (report.export != null) {
        exportDirectory = report.export.directory;
      }
    } else if (record.getStatus() == TaskStatus.CANCELLED) {
      reason = "CANCELLED";
    }
    return new TaskHistoryEntry(
        record.getTaskId(),
        name,
        record.getStatus(),
        record.getStartedAt().orElse(null),
        record.getCompletedAt().orElse(null),
        record.getProcessingDurationMillis(),
        record.getPlannedRequests(),
        completed,
        successes,
        completed == 0 ? null : successes * 100.0 / completed,
        reason,
        exportDirectory,
        record.getErrorMessage().orElse(null));
  }
}
