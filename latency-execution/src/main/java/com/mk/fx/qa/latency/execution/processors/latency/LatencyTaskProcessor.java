package com.mk.fx.qa.latency.execution.processors.latency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.BenchmarkRunReport;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskSubmissionRequest;
import com.mk.fx.qa.latency.execution.dto.latency.LatencyTaskDefinition;
import com.mk.fx.qa.latency.execution.export.ExportSinkFactory;
import com.mk.fx.qa.latency.execution.export.ExportSinks;
import com.mk.fx.qa.latency.execution.metrics.BenchmarkConfig;
import com.mk.fx.qa.latency.execution.metrics.BenchmarkMetricsRegistry;
import com.mk.fx.qa.latency.execution.metrics.LatencyMetrics;
import com.mk.fx.qa.latency.execution.model.BenchmarkConfigurationException;
import com.mk.fx.qa.latency.execution.model.TaskType;
import com.mk.fx.qa.latency.execution.processors.BenchmarkTaskProcessor;
import com.mk.fx.qa.latency.rest.JsonUtil;
import com.mk.fx.qa.latency.rest.LatencyHttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LatencyTaskProcessor implements BenchmarkTaskProcessor {

  private final Map<UUID, AtomicBoolean> cancellationTokens = new ConcurrentHashMap<>();
  private final BenchmarkMetricsRegistry metricsRegistry;
  private final BenchmarkPlanFactory planFactory;
  private final ExportSinkFactory exportSinkFactory;

  public LatencyTaskProcessor(
      BenchmarkMetricsRegistry metricsRegistry,
      BenchmarkPlanFactory planFactory,
      ExportSinkFactory exportSinkFactory) {
    this.metricsRegistry = metricsRegistry;
    this.planFactory = planFactory;
    this.exportSinkFactory = exportSinkFactory;
  }

  @Override
  public TaskType supportedTaskType() {
    return TaskType.LATENCY;
  }

  @Override
  public long validate(TaskSubmissionRequest request) {
    return toPlan(request).expectedTotalRequests();
  }

  @Override
  public void execute(TaskSubmissionRequest request) throws Exception {
    BenchmarkPlan plan = toPlan(request);
    UUID taskId = UUID.fromString(request.getTaskId());
    var cancelled = new AtomicBoolean(false);
    if (cancellationTokens.putIfAbsent(taskId, cancelled) != null) {
      throw new IllegalStateException("Task " + taskId + " is already running");
    }

    var metrics = new LatencyMetrics(toConfig(plan));
    Instant startTime = Instant.now();
    BenchmarkRunResult result = null;
    ExportSinks sinks = null;
    try {
      sinks = exportSinkFactory.open(taskId, plan.parameters());
      // the detail file is closed even when the run fails before the result sink owns it
      try (ExportSinks open = sinks) {
        metrics.start();
        metricsRegistry.register(taskId, metrics);
        var runner = new LatencyBenchmarkRunner(new LatencyHttpClient(plan.headers(), plan.variables()));
        result = runner.run(plan, open.detail(), open.summary(), metrics, cancelled::get);
      }
    } finally {
      cancellationTokens.remove(taskId, cancelled);
      metrics.stopAndSummarise();
      metricsRegistry.complete(taskId, metrics.snapshotNow());
      var report = buildReport(plan, result, sinks, startTime, Instant.now());
      metricsRegistry.saveReport(taskId, report);
      try {
        log.info("Task {} run report:\n{}", taskId, JsonUtil.toJson(report));
      } catch (JsonProcessingException e) {
        log.info("Task {} run report (unformatted): {}", taskId, report);
      }
    }

    log.info(
        "Task {} latency run finished: planned={} dispatched={} completed={} skipped={} cancelled={}",
        taskId,
        result.planned(),
        result.dispatch().dispatched(),
        result.dispatch().completed(),
        result.dispatch().skipped(),
        result.cancelled());
    if (result.cancelled()) {
      throw new InterruptedException("Task cancelled");
    }
  }

  /** Tokens exist only while a run is in progress; a cancel that loses the race leaves nothing behind. */
  @Override
  public boolean cancel(UUID taskId) {
    AtomicBoolean token =
        cancellationTokens.computeIfPresent(
            taskId,
            (id, running) -> {
              running.set(true);
              return running;
            });
    if (token == null) {
      log.debug("Task {} is not running, nothing to cancel", taskId);
      return false;
    }
    return true;
  }

  int runsInProgress() {
    return cancellationTokens.size();
  }

  private BenchmarkPlan toPlan(TaskSubmissionRequest request) {
    Objects.requireNonNull(request, "Task request must not be null");
    if (request.getTaskId() == null) {
      throw new BenchmarkConfigurationException("taskId is required");
    }
    UUID taskId;
    try {
      taskId = UUID.fromString(request.getTaskId());
    } catch (IllegalArgumentException e) {
      throw new BenchmarkConfigurationException("Invalid taskId: " + request.getTaskId(), e);
    }
    LatencyTaskDefinition definition;
    try {
      definition = JsonUtil.mapper().convertValue(request.getData(), LatencyTaskDefinition.class);
    } catch (IllegalArgumentException e) {
      throw new BenchmarkConfigurationException(
          "data is not a valid latency task definition: " + e.getMessage(), e);
    }
    return planFactory.create(taskId, definition);
  }

  private BenchmarkConfig toConfig(BenchmarkPlan plan) {
    var parameters = plan.parameters();
    return new BenchmarkConfig(
        plan.runId(),
        supportedTaskType().name(),
        plan.targetIds(),
        parameters.concurrency(),
        parameters.ratePerSec(),
        parameters.requestsPerTarget(),
        parameters.connectTimeout(),
        parameters.readTimeout(),
        plan.expectedTotalRequests(),
        parameters.progressInterval());
  }

  private BenchmarkRunReport buildReport(
      BenchmarkPlan plan,
      BenchmarkRunResult result,
      ExportSinks sinks,
      Instant startTime,
      Instant endTime) {
    var parameters = plan.parameters();
    var report = new BenchmarkRunReport();
    report.taskId = plan.runId();
    report.taskType = supportedTaskType().name();
    report.name = plan.name();
    report.startTime = startTime;
    report.endTime = endTime;
    report.durationSec = Duration.between(startTime, endTime).toMillis() / 1000.0;

    report.config = new BenchmarkRunReport.Config();
    report.config.concurrency = parameters.concurrency();
    report.config.ratePerSec = parameters.ratePerSec();
    report.config.requestsPerTarget = parameters.requestsPerTarget();
    report.config.connectTimeout = parameters.connectTimeout();
    report.config.readTimeout = parameters.readTimeout();
    report.config.interleave = parameters.interleave();
    report.config.expectedTotalRequests = plan.expectedTotalRequests();
    report.config.targetIds = plan.targetIds();

    report.completion = new BenchmarkRunReport.Completion();
    if (result == null) {
      report.completion.reason = "FAILED";
      report.completion.message = "Run did not complete";
      return report;
    }

    var dispatch = result.dispatch();
    report.dispatch = new BenchmarkRunReport.Dispatch();
    report.dispatch.planned = result.planned();
    report.dispatch.dispatched = dispatch.dispatched();
    report.dispatch.completed = dispatch.completed();
    report.dispatch.skipped = dispatch.skipped();
    report.dispatch.dispatchSec = dispatch.elapsedNanos() / 1_000_000_000.0;

    report.connections = new BenchmarkRunReport.Connections();
    report.connections.leasesOpened = result.leasesOpened();
    report.connections.cleanupFailures = result.cleanupFailures();

    report.targets = result.rows();

    report.export = new BenchmarkRunReport.Export();
    report.export.directory =
        sinks != null && sinks.directory() != null ? sinks.directory().toString() : null;
    report.export.detailRowsWritten = result.detailRowsWritten();
    report.export.detailWriteFailures = result.detailWriteFailures();
    report.export.summaryError = result.summaryError();

    report.completion.reason = result.cancelled() ? "CANCELLED" : "ALL_DISPATCHED";
    report.completion.percentComplete =
        result.planned() > 0 ? (int) Math.round(dispatch.completed() * 100.0 / result.planned()) : 100;
    report.completion.message =
        result.cancelled()
            ? "Cancelled after " + dispatch.completed() + " of " + result.planned() + " requests"
            : "Completed " + dispatch.completed() + " requests";
    return report;
  }
}
