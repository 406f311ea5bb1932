package com.mk.fx.qa.latency.execution.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import com.mk.fx.qa.latency.execution.validation.Classification;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatisticsAggregatorTest {

  private static RequestOutcome outcome(
      String target, long startMs, long endMs, Integer bytes, Classification classification) {
    return new RequestOutcome(
        target,
        0,
        0,
        Instant.now(),
        startMs * 1_000_000L,
        endMs * 1_000_000L,
        classification.success() ? 200 : 502,
        bytes,
        classification,
        true,
        null);
  }

  private static TargetAggregate twoSuccessesOneFailure() {
    var aggregate = new TargetAggregate("google");
    aggregate.record(outcome("google", 0, 100, 100, Classification.ok()));
    aggregate.record(outcome("google", 50, 250, 300, Classification.ok()));
    aggregate.record(outcome("google", 300, 400, null, Classification.httpStatus(502)));
    aggregate.freeze();
    return aggregate;
  }

  @Test
  void summarise_mixedOutcomes() {
    SummaryRow row = StatisticsAggregator.summarise(twoSuccessesOneFailure());

    assertEquals("google", row.targetId());
    assertEquals(3, row.totalRequests());
    assertEquals(2, row.successCount());
    assertEquals(1, row.failureCount());
    assertEquals(66.67, row.successRatePercent(), 0.01);
    assertEquals(150.0, row.meanLatencyMs(), 1e-9);
    assertEquals(200.0, row.meanResponseBytes(), 1e-9);
    assertEquals(400.0, row.spanMs(), 1e-9);
    assertEquals(0.4 / 3, row.secondsPerRequest(), 1e-9);
    assertEquals(100.0, row.minLatencyMs(), 1e-9);
    assertEquals(200.0, row.maxLatencyMs(), 1e-9);
    assertEquals(200.0, row.p95LatencyMs(), 1e-9);
    assertEquals(Map.of("HTTP_502", 1L), row.failuresByReason());
  }

  @Test
  void summarise_isIdempotent() {
    TargetAggregate aggregate = twoSuccessesOneFailure();
    assertEquals(StatisticsAggregator.summarise(aggregate), StatisticsAggregator.summarise(aggregate));
  }

  @Test
  void summarise_noSuccesses_latencyFieldsAbsent() {
    var aggregate = new TargetAggregate("bing");
    aggregate.record(outcome("bing", 0, 30, null, Classification.httpStatus(502)));
    aggregate.record(outcome("bing", 10, 60, null, Classification.parse("bad json")));
    aggregate.freeze();

    SummaryRow row = StatisticsAggregator.summarise(aggregate);

    assertEquals(0.0, row.successRatePercent());
    assertNull(row.meanLatencyMs());
    assertNull(row.meanResponseBytes());
    assertNull(row.minLatencyMs());
    assertNull(row.p95LatencyMs());
    assertNull(row.p99LatencyMs());
    assertNotNull(row.secondsPerRequest());
    assertEquals(2, row.failuresByReason().size());
  }

  @Test
  void summarise_noRequests_zeroRateAndNullAverages() {
    var aggregate = new TargetAggregate("idle");
    aggregate.freeze();

    SummaryRow row = StatisticsAggregator.summarise(aggregate);

    assertEquals(0, row.totalRequests());
    assertEquals(0.0, row.successRatePercent());
    assertEquals(0.0, row.spanMs());
    assertNull(row.secondsPerRequest());
    assertNull(row.meanLatencyMs());
    assertTrue(row.failuresByReason().isEmpty());
  }

  @Test
  void summarise_unfrozenAggregate_rejected() {
    var aggregate = new TargetAggregate("live");
    assertThrows(IllegalStateException.class, () -> StatisticsAggregator.summarise(aggregate));
  }

  @Test
  void summarise_keepsInputOrder() {
    var a = new TargetAggregate("a");
    var b = new TargetAggregate("b");
    a.freeze();
    b.freeze();
    List<SummaryRow> rows = StatisticsAggregator.summarise(List.of(b, a));
    assertEquals(List.of("b", "a"), rows.stream().map(SummaryRow::targetId).toList());
  }
}
