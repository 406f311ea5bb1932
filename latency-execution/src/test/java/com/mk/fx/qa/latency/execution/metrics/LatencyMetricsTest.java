package com.mk.fx.qa.latency.execution.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import com.mk.fx.qa.latency.execution.model.WorkItem;
import com.mk.fx.qa.latency.execution.validation.Classification;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class LatencyMetricsTest {

  private static BenchmarkConfig config() {
    return new BenchmarkConfig(
        UUID.randomUUID().toString(),
        "LATENCY",
        List.of("google", "bing"),
        2,
        null,
        2,
        Duration.ofSeconds(10),
        Duration.ofSeconds(30),
        4,
        Duration.ofMillis(200));
  }

  private static RequestOutcome outcome(String target, long elapsedMs, Classification c) {
    return new RequestOutcome(
        target, 0, 0, Instant.now(), 0, elapsedMs * 1_000_000L, 200, 5, c, true, null);
  }

  @Test
  void snapshot_reflectsDispatchedAndCompleted() {
    var metrics = new LatencyMetrics(config());
    metrics.onDispatched(new WorkItem("google", 0, 0, Map.of()));
    metrics.onDispatched(new WorkItem("bing", 0, 1, Map.of()));
    metrics.onDispatched(new WorkItem("google", 1, 2, Map.of()));
    metrics.onCompleted(outcome("google", 100, Classification.ok()));
    metrics.onCompleted(outcome("bing", 300, Classification.httpStatus(503)));

    LatencySnapshot snap = metrics.snapshotNow();

    assertEquals(3, snap.dispatched());
    assertEquals(2, snap.completed());
    assertEquals(1, snap.inFlight());
    assertEquals(1, snap.successes());
    assertEquals(1, snap.failures());
    assertEquals(100.0, snap.latencyAvgMs(), 1e-9);
    assertEquals(Map.of("google", 1L, "bing", 1L), snap.completedByTarget());
    assertEquals(Map.of("HTTP_503", 1L), snap.failuresByReason());
    assertEquals(1, metrics.totalFailures());
    assertEquals(2, metrics.totalCompleted());
  }

  @Test
  void snapshot_withoutSuccesses_hasNoLatency() {
    var metrics = new LatencyMetrics(config());
    LatencySnapshot snap = metrics.snapshotNow();
    assertEquals(0, snap.completed());
    assertNull(snap.latencyAvgMs());
    assertNull(snap.latencyP95Ms());
  }

  @Test
  void startAndStop_logProgressWithoutError() {
    var metrics = new LatencyMetrics(config());
    metrics.start();
    metrics.onCompleted(outcome("google", 10, Classification.ok()));
    assertDoesNotThrow(metrics::logProgress);
    assertDoesNotThrow(metrics::stopAndSummarise);
  }
}
