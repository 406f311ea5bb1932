package com.mk.fx.qa.latency.execution.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.latency.execution.executors.dispatch.DispatchListener;
import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import com.mk.fx.qa.latency.execution.model.WorkItem;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Live progress of a run. Fed through {@link DispatchListener} callbacks from dispatcher and worker
 * threads and logged periodically. These figures are for monitoring only; final statistics come
 * from the {@link ResultSink}.
 */
@Slf4j
public class LatencyMetrics implements DispatchListener {

  @Getter private final BenchmarkConfig config;

  private final Instant startedAt = Instant.now();
  private final AtomicLong dispatched = new AtomicLong();
  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong successes = new AtomicLong();
  private final LatencyTracker latency = new LatencyTracker(5000);
  private final Map<String, LongAdder> completedByTarget = new ConcurrentHashMap<>();
  private final Map<String, LongAdder> failuresByReason = new ConcurrentHashMap<>();

  private ScheduledExecutorService snapshots;

  public LatencyMetrics(BenchmarkConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public void start() {
    logStart();
    long periodMs = Math.max(100L, config.progressInterval().toMillis());
    snapshots =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("latency-progress-" + config.taskId());
              t.setDaemon(true);
              return t;
            });
    snapshots.scheduleAtFixedRate(this::logProgress, periodMs, periodMs, TimeUnit.MILLISECONDS);
  }

  public void stopAndSummarise() {
    if (snapshots != null) {
      snapshots.shutdownNow();
      try {
        snapshots.awaitTermination(2, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      }
    }
    logFinal();
  }

  @Override
  public void onDispatched(WorkItem item) {
    dispatched.incrementAndGet();
  }

  @Override
  public void onCompleted(RequestOutcome outcome) {
    completed.incrementAndGet();
    completedByTarget.computeIfAbsent(outcome.targetId(), key -> new LongAdder()).increment();
    if (outcome.success()) {
      successes.incrementAndGet();
      latency.record(outcome.elapsedNanos());
    } else {
      failuresByReason
          .computeIfAbsent(outcome.classification().reason(), key -> new LongAdder())
          .increment();
    }
  }

  public long totalCompleted() {
    return completed.get();
  }

  public long totalFailures() {
    return completed.get() - successes.get();
  }

  public LatencySnapshot snapshotNow() {
    long done = completed.get();
    long ok = successes.get();
    return new LatencySnapshot(
        config,
        dispatched.get(),
        done,
        Math.max(0L, dispatched.get() - done),
        ok,
        done - ok,
        achievedRps(),
        latency.minMs().orElse(null),
        latency.avgMs().orElse(null),
        latency.maxMs().orElse(null),
        latency.p95Ms().orElse(null),
        snapshot(completedByTarget),
        snapshot(failuresByReason));
  }

  private static Map<String, Long> snapshot(Map<String, LongAdder> counters) {
    Map<String, Long> copy = new TreeMap<>();
    counters.forEach((key, value) -> copy.put(key, value.sum()));
    return copy;
  }

  private double achievedRps() {
    double elapsedSec =
        Math.max(0.001, Duration.between(startedAt, Instant.now()).toMillis() / 1000.0);
    return completed.get() / elapsedSec;
  }

  private void logStart() {
    var sb = new StringBuilder();
    sb.append("Task ")
        .append(config.taskId())
        .append(" started: targets=")
        .append(config.targets())
        .append(", concurrency=")
        .append(config.concurrency())
        .append(", requestsPerTarget=")
        .append(config.requestsPerTarget())
        .append(", expectedTotalRequests=")
        .append(config.expectedTotalRequests())
        .append(", connectTimeout=")
        .append(config.connectTimeout())
        .append(", readTimeout=")
        .append(config.readTimeout());
    if (config.ratePerSec() != null) {
      sb.append(", rate=").append(String.format("%.2f", config.ratePerSec())).append("/s");
    }
    log.info(sb.toString());
  }

  @VisibleForTesting
  void logProgress() {
    long done = completed.get();
    long expected = config.expectedTotalRequests();
    var sb = new StringBuilder();
    sb.append("Task ")
        .append(config.taskId())
        .append(" progress: completed=")
        .append(done)
        .append("/")
        .append(expected);
    if (expected > 0) {
      sb.append(" (").append(String.format("%.1f", done * 100.0 / expected)).append("%)");
    }
    sb.append(", inFlight=")
        .append(Math.max(0L, dispatched.get() - done))
        .append(", failures=")
        .append(totalFailures())
        .append(", rps=")
        .append(String.format("%.2f", achievedRps()));
    latency.avgMs().ifPresent(avg -> sb.append(", lat(ms) avg=").append(String.format("%.2f", avg)));
    latency.p95Ms().ifPresent(p95 -> sb.append(", p95=").append(String.format("%.2f", p95)));
    log.info(sb.toString());
  }

  private void logFinal() {
    var sb = new StringBuilder();
    sb.append("Task ")
        .append(config.taskId())
        .append(" finished: dispatched=")
        .append(dispatched.get())
        .append(", completed=")
        .append(completed.get())
        .append(", successes=")
        .append(successes.get())
        .append(", rps=")
        .append(String.format("%.2f", achievedRps()));
    latency.minMs().ifPresent(min -> sb.append(", lat(ms) min=").append(String.format("%.2f", min)));
    latency.avgMs().ifPresent(avg -> sb.append(", avg=").append(String.format("%.2f", avg)));
    latency.maxMs().ifPresent(max -> sb.append(", max=").append(String.format("%.2f", max)));
    if (totalFailures() > 0) {
      sb.append(", failures=").append(snapshot(failuresByReason));
    }
    log.info(sb.toString());
  }
}
