package com.mk.fx.qa.latency.execution.export;

import com.mk.fx.qa.latency.execution.model.RunParameters;
import com.mk.fx.qa.latency.execution.metrics.SummarySink;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Opens the export sinks of a run. With CSV export enabled the files go to {@code
 * <outputDir>/<yyyy-MM-dd>/<taskId>/}; the summary is always logged.
 */
@Component
public class ExportSinkFactory {

  public ExportSinks open(UUID taskId, RunParameters parameters) throws IOException {
    var logging = new LoggingSummarySink();
    if (!parameters.exportCsv()) {
      return new ExportSinks(null, logging, null);
    }
    Path directory =
        parameters.outputDir().resolve(LocalDate.now().toString()).resolve(taskId.toString());
    Files.createDirectories(directory);
    var csvSummary = new CsvSummarySink(directory.resolve(CsvSummarySink.FILE_NAME));
    SummarySink summary =
        (runId, rows) -> {
          logging.accept(runId, rows);
          csvSummary.accept(runId, rows);
        };
    return new ExportSinks(
        new CsvDetailSink(directory.resolve(CsvDetailSink.FILE_NAME)), summary, directory);
  }
}
