package com.mk.fx.qa.latency.execution.processors.latency;

import com.mk.fx.qa.latency.execution.executors.dispatch.DispatchResult;
import com.mk.fx.qa.latency.execution.metrics.SummaryRow;
import java.util.List;

/**
 * What a finished run produced.
 *
 * @param runId run identifier
 * @param planned work items generated for the run
 * @param dispatch dispatcher counters
 * @param rows per-target summary, in target declaration order
 * @param elapsedNanos wall time of the whole run including result flushing
 * @param detailRowsWritten outcomes written to the detail sink
 * @param detailWriteFailures detail batches that could not be written
 * @param summaryError failure message of the summary sink, or null
 * @param leasesOpened connection leases opened by the client
 * @param cleanupFailures leases whose release failed
 */
public record BenchmarkRunResult(
    String runId,
    long planned,
    DispatchResult dispatch,
    List<SummaryRow> rows,
    long elapsedNanos,
    long detailRowsWritten,
    long detailWriteFailures,
    String summaryError,
    long leasesOpened,
    long cleanupFailures) {

  public BenchmarkRunResult {
    rows = List.copyOf(rows);
  }

  public boolean cancelled() {
    return dispatch.cancelled();
  }
}
