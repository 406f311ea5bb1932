package com.mk.fx.qa.latency.execution.processors.latency;

import com.mk.fx.qa.latency.execution.executors.dispatch.DispatchListener;
import com.mk.fx.qa.latency.execution.executors.dispatch.DispatchResult;
import com.mk.fx.qa.latency.execution.executors.dispatch.Dispatcher;
import com.mk.fx.qa.latency.execution.executors.request.RequestExecutor;
import com.mk.fx.qa.latency.execution.executors.request.WorkQueue;
import com.mk.fx.qa.latency.execution.metrics.DetailSink;
import com.mk.fx.qa.latency.execution.metrics.ResultSink;
import com.mk.fx.qa.latency.execution.metrics.StatisticsAggregator;
import com.mk.fx.qa.latency.execution.metrics.SummaryRow;
import com.mk.fx.qa.latency.execution.metrics.SummarySink;
import com.mk.fx.qa.latency.execution.metrics.TargetAggregate;
import com.mk.fx.qa.latency.execution.model.WorkItem;
import com.mk.fx.qa.latency.rest.LatencyHttpClient;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one {@link BenchmarkPlan} end to end: expands the work queue, dispatches it through the
 * {@link RequestExecutor}, collects outcomes in a {@link ResultSink} and hands the per-target
 * summary to the {@link SummarySink}.
 *
 * <p>Results are always flushed, also when the run is cancelled. A failing summary sink is logged
 * and reported in the result; it does not fail the run.
 */
@Slf4j
public class LatencyBenchmarkRunner {

  private final LatencyHttpClient client;

  public LatencyBenchmarkRunner(LatencyHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  public BenchmarkRunResult run(
      BenchmarkPlan plan,
      DetailSink detailSink,
      SummarySink summarySink,
      DispatchListener listener,
      BooleanSupplier cancellationRequested) {
    Objects.requireNonNull(plan, "plan");
    Objects.requireNonNull(summarySink, "summarySink");
    var parameters = plan.parameters();
    long startNanos = System.nanoTime();

    // the result sink owns the detail sink from here and closes it in finish()
    var resultSink =
        new ResultSink(plan.runId(), plan.targetIds(), detailSink, parameters.batchSize());

    List<WorkItem> items;
    DispatchResult dispatch;
    List<TargetAggregate> aggregates;
    try {
      items =
          WorkQueue.expand(plan.descriptors(), parameters.requestsPerTarget(), parameters.interleave());
      log.info(
          "Run {} planned {} requests across {} targets", plan.runId(), items.size(), plan.targets().size());
      var executor = new RequestExecutor(client, plan.targets(), parameters.detailedLogging());
      dispatch =
          Dispatcher.execute(
              plan.runId(),
              plan.dispatchParameters(),
              items,
              executor,
              resultSink,
              listener != null ? listener : DispatchListener.NONE,
              cancellationRequested != null ? cancellationRequested : () -> false);
    } finally {
      aggregates = resultSink.finish();
    }

    List<SummaryRow> rows = StatisticsAggregator.summarise(aggregates);
    String summaryError = null;
    try {
      summarySink.accept(plan.runId(), rows);
    } catch (IOException e) {
      summaryError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      log.warn("Run {} summary could not be written: {}", plan.runId(), summaryError, e);
    }

    return new BenchmarkRunResult(
        plan.runId(),
        items.size(),
        dispatch,
        rows,
        System.nanoTime() - startNanos,
        resultSink.detailRowsWritten(),
        resultSink.detailWriteFailures(),
        summaryError,
        client.leasesOpened(),
        client.cleanupFailures());
  }
}
