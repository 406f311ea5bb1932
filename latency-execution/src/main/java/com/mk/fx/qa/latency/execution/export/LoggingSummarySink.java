package com.mk.fx.qa.latency.execution.export;

import com.mk.fx.qa.latency.execution.metrics.SummaryRow;
import com.mk.fx.qa.latency.execution.metrics.SummarySink;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Logs the summary table at INFO, one line per target. */
@Slf4j
public class LoggingSummarySink implements SummarySink {

  @Override
  public void accept(String runId, List<SummaryRow> rows) {
    var sb = new StringBuilder();
    sb.append("Run ").append(runId).append(" summary");
    for (SummaryRow row : rows) {
      sb.append(System.lineSeparator())
          .append("  ")
          .append(row.targetId())
          .append(": requests=")
          .append(row.totalRequests())
          .append(", success=")
          .append(row.successCount())
          .append(" (")
          .append(String.format("%.2f", row.successRatePercent()))
          .append("%), mean=")
          .append(format(row.meanLatencyMs(), "ms"))
          .append(", p95=")
          .append(format(row.p95LatencyMs(), "ms"))
          .append(", p99=")
          .append(format(row.p99LatencyMs(), "ms"))
          .append(", sec/req=")
          .append(format(row.secondsPerRequest(), "s"))
          .append(", span=")
          .append(String.format("%.2fms", row.spanMs()))
          .append(", meanSize=")
          .append(format(row.meanResponseBytes(), "B"));
      if (!row.failuresByReason().isEmpty()) {
        sb.append(", failures=").append(CsvFormat.reasons(row.failuresByReason()));
      }
    }
    log.info(sb.toString());
  }

  static String format(Double value, String unit) {
    return value != null ? String.format("%.2f%s", value, unit) : "N/A";
  }
}
