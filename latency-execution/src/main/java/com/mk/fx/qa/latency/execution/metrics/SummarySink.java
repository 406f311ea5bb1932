package com.mk.fx.qa.latency.execution.metrics;

import java.io.IOException;
import java.util.List;

/** Receives the final per-target summary once per run. */
@FunctionalInterface
public interface SummarySink {

  void accept(String runId, List<SummaryRow> rows) throws IOException;
}
