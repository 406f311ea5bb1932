package com.mk.fx.qa.latency.execution.metrics;

import com.mk.fx.qa.latency.execution.dto.controllerresponse.BenchmarkRunReport;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Thread-safe registry of live progress and final reports.
 *
 * <p>Tracks the {@link LatencyMetrics} of running tasks, keeps the last snapshot of finished ones
 * and stores their {@link BenchmarkRunReport}.
 */
@Component
public class BenchmarkMetricsRegistry {

  private final Map<UUID, LatencyMetrics> active = new ConcurrentHashMap<>();
  private final Map<UUID, LatencySnapshot> completed = new ConcurrentHashMap<>();
  private final Map<UUID, BenchmarkRunReport> reports = new ConcurrentHashMap<>();

  public void register(UUID taskId, LatencyMetrics metrics) {
    active.put(taskId, metrics);
  }

  /** Stores the final snapshot and removes the task from the active set. */
  public void complete(UUID taskId, LatencySnapshot finalSnapshot) {
    completed.put(taskId, finalSnapshot);
    active.remove(taskId);
  }

  /** Live snapshot for running tasks, final snapshot for finished ones. */
  public Optional<LatencySnapshot> getSnapshot(UUID taskId) {
    LatencyMetrics m = active.get(taskId);
    if (m != null) {
      return Optional.of(m.snapshotNow());
    }
    return Optional.ofNullable(completed.get(taskId));
  }

  public void saveReport(UUID taskId, BenchmarkRunReport report) {
    reports.put(taskId, report);
  }

  public Optional<BenchmarkRunReport> getReport(UUID taskId) {
    return Optional.ofNullable(reports.get(taskId));
  }
}
