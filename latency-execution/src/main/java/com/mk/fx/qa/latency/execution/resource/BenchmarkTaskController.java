package com.mk.fx.qa.latency.execution.resource;

import static com.mk.fx.qa.latency.execution.model.TaskStatus.CANCELLED;
import static com.mk.fx.qa.latency.execution.model.TaskStatus.PROCESSING;

import com.google.common.base.Enums;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.BenchmarkRunReport;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.HealthResponse;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.QueueStatusResponse;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskCancellationResponse;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskHistoryEntry;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskLiveMetricsResponse;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskMetricsResponse;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskStatusResponse;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskSubmissionOutcome;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskSubmissionRequest;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskSubmissionResponse;
import com.mk.fx.qa.latency.execution.metrics.BenchmarkMetricsRegistry;
import com.mk.fx.qa.latency.execution.metrics.LatencySnapshot;
import com.mk.fx.qa.latency.execution.model.BenchmarkTask;
import com.mk.fx.qa.latency.execution.model.TaskStatus;
import com.mk.fx.qa.latency.execution.service.BenchmarkTaskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(
    name = "Benchmarks",
    description = "Endpoints for submitting, monitoring and managing latency benchmark runs")
@RestController
@RequestMapping("/api/benchmarks")
@Validated
@RequiredArgsConstructor
public class BenchmarkTaskController {

  private final BenchmarkTaskService benchmarkTaskService;
  private final BenchmarkMetricsRegistry metricsRegistry;
  private final TaskMapper taskMapper;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Submit a benchmark",
      description = "Validates the benchmark definition and queues it for execution.")
  @PostMapping
  public ResponseEntity<TaskSubmissionResponse> submitTask(
      @Valid @RequestBody TaskSubmissionRequest request) {
    log.info("Received benchmark submission type={}", request.getTaskType());
    BenchmarkTask task = taskMapper.toDomain(request);
    Optional<TaskSubmissionOutcome> outcomeOpt = benchmarkTaskService.submitTask(task);

    if (outcomeOpt.isEmpty()) {
      return responseFactory.unavailable(
          new TaskSubmissionResponse(null, CANCELLED, "Service not accepting new tasks"));
    }

    TaskSubmissionOutcome outcome = outcomeOpt.get();
    log.info("Benchmark {} submission -> {}", outcome.taskId(), outcome.status());
    return ResponseEntity.status(submissionStatus(outcome))
        .body(new TaskSubmissionResponse(outcome.taskId(), outcome.status(), outcome.message()));
  }

  @Operation(
      summary = "Benchmark status",
      description = "Returns the lifecycle state and planned request count of a benchmark.")
  @GetMapping("/{taskId}")
  public ResponseEntity<TaskStatusResponse> getTaskStatus(@PathVariable UUID taskId) {
    return benchmarkTaskService
        .getTaskStatus(taskId)
        .map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Benchmark {} not found", taskId);
              return ResponseEntity.notFound().build();
            });
  }

  @Operation(
      summary = "Cancel benchmark",
      description =
          "Drops a waiting benchmark, or stops a running one from dispatching further requests."
              + " Requests already in flight complete and are exported.")
  @DeleteMapping("/{taskId}")
  public ResponseEntity<?> cancelTask(@PathVariable UUID taskId) {
    var result = benchmarkTaskService.cancelTask(taskId);
    log.info("Cancel {} -> {}", taskId, result.state());
    return switch (result.state()) {
      case NOT_FOUND -> responseFactory.notFound("Benchmark not found: " + taskId);
      case NOT_CANCELLABLE -> responseFactory.error(
          HttpStatus.CONFLICT, "Conflict", "Benchmark already finished as " + result.taskStatus());
      case CANCELLED -> ResponseEntity.ok(
          new TaskCancellationResponse(taskId, CANCELLED, "Benchmark removed from the queue"));
      case CANCELLATION_REQUESTED -> {
        TaskStatus current =
            benchmarkTaskService
                .getTaskStatus(taskId)
                .map(TaskStatusResponse::status)
                .orElse(PROCESSING);
        yield ResponseEntity.ok(
            new TaskCancellationResponse(taskId, current, "Dispatch stopping, results will be flushed"));
      }
    };
  }

  @Operation(
      summary = "List benchmarks",
      description = "Lists benchmarks newest first, optionally only those in one state.")
  @GetMapping
  public ResponseEntity<?> listTasks(@RequestParam(required = false) String status) {
    if (status == null) {
      return ResponseEntity.ok(benchmarkTaskService.listTasks(null));
    }
    var filter = Enums.getIfPresent(TaskStatus.class, status.trim().toUpperCase(Locale.ROOT));
    if (!filter.isPresent()) {
      log.warn("Invalid status filter: {}", status);
      return responseFactory.error(
          HttpStatus.BAD_REQUEST,
          "Invalid Status",
          "Unrecognized status: " + status + ". Allowed: " + Arrays.toString(TaskStatus.values()));
    }
    return ResponseEntity.ok(benchmarkTaskService.listTasks(filter.get()));
  }

  @Operation(
      summary = "Benchmark history",
      description =
          "Returns recently finished benchmarks with their request counts, success rate and export"
              + " directory.")
  @GetMapping("/history")
  public ResponseEntity<List<TaskHistoryEntry>> getTaskHistory() {
    return ResponseEntity.ok(benchmarkTaskService.getTaskHistory());
  }

  @Operation(
      summary = "Queue status",
      description = "Returns waiting and running benchmarks and the requests still ahead of them.")
  @GetMapping("/queue")
  public ResponseEntity<QueueStatusResponse> getQueueStatus() {
    return ResponseEntity.ok(benchmarkTaskService.getQueueStatus());
  }

  @Operation(
      summary = "Service totals",
      description = "Returns run and request totals over every benchmark finished since startup.")
  @GetMapping("/metrics")
  public ResponseEntity<TaskMetricsResponse> getMetrics() {
    return ResponseEntity.ok(benchmarkTaskService.getMetrics());
  }

  @Operation(
      summary = "Live progress",
      description = "Returns the progress snapshot of a running or finished benchmark.")
  @GetMapping("/{taskId}/progress")
  public ResponseEntity<?> getTaskProgress(@PathVariable UUID taskId) {
    return metricsRegistry
        .getSnapshot(taskId)
        .<ResponseEntity<?>>map(snapshot -> ResponseEntity.ok(mapToResponse(snapshot)))
        .orElseGet(
            () -> {
              log.warn("Progress not found for task {}", taskId);
              return responseFactory.notFound("Progress not found for task: " + taskId);
            });
  }

  @Operation(
      summary = "Benchmark report",
      description = "Returns per-target statistics of a finished benchmark.")
  @GetMapping("/{taskId}/report")
  public ResponseEntity<?> getTaskReport(@PathVariable UUID taskId) {
    Optional<BenchmarkRunReport> report = metricsRegistry.getReport(taskId);
    if (report.isEmpty()) {
      log.warn("Report not found for task {}", taskId);
      return responseFactory.notFound("Report not found for task: " + taskId);
    }
    return ResponseEntity.ok(report.get());
  }

  @Operation(summary = "Supported task types", description = "Lists the supported task types.")
  @GetMapping("/types")
  public ResponseEntity<Set<String>> getSupportedTaskTypes() {
    return ResponseEntity.ok(benchmarkTaskService.getSupportedTaskTypes());
  }

  @Operation(summary = "Health check", description = "Verifies service health.")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = benchmarkTaskService.isHealthy();
    log.debug("Health check: {}", healthy ? "UP" : "DOWN");
    return ResponseEntity.ok(new HealthResponse(healthy ? "UP" : "DOWN"));
  }

  private static HttpStatus submissionStatus(TaskSubmissionOutcome outcome) {
    if (outcome.isAccepted()) {
      return HttpStatus.ACCEPTED;
    }
    return switch (outcome.rejection()) {
      case QUEUE_FULL -> HttpStatus.TOO_MANY_REQUESTS;
      case DUPLICATE_ID -> HttpStatus.CONFLICT;
      case NO_PROCESSOR -> HttpStatus.BAD_REQUEST;
    };
  }

  private TaskLiveMetricsResponse mapToResponse(LatencySnapshot snapshot) {
    var cfg = snapshot.config();
    Double percent =
        cfg.expectedTotalRequests() > 0
            ? snapshot.completed() * 100.0 / cfg.expectedTotalRequests()
            : null;
    return TaskLiveMetricsResponse.builder()
        .taskId(cfg.taskId())
        .taskType(cfg.taskType())
        .targets(cfg.targets())
        .concurrency(cfg.concurrency())
        .ratePerSec(cfg.ratePerSec())
        .expectedTotalRequests(cfg.expectedTotalRequests())
        .dispatched(snapshot.dispatched())
        .completed(snapshot.completed())
        .inFlight(snapshot.inFlight())
        .successes(snapshot.successes())
        .failures(snapshot.failures())
        .percentComplete(percent)
        .achievedRps(snapshot.achievedRps())
        .latencyMinMs(snapshot.latencyMinMs())
        .latencyAvgMs(snapshot.latencyAvgMs())
        .latencyMaxMs(snapshot.latencyMaxMs())
        .latencyP95Ms(snapshot.latencyP95Ms())
        .completedByTarget(snapshot.completedByTarget())
        .failuresByReason(snapshot.failuresByReason())
        .build();
  }
}
