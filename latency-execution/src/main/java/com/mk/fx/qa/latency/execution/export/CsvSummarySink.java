package com.mk.fx.qa.latency.execution.export;

import com.mk.fx.qa.latency.execution.metrics.SummaryRow;
import com.mk.fx.qa.latency.execution.metrics.SummarySink;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/** Writes {@code summary_statistics.csv}, replacing any previous file. */
@Slf4j
public class CsvSummarySink implements SummarySink {

  public static final String FILE_NAME = "summary_statistics.csv";

  private final Path file;

  public CsvSummarySink(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public void accept(String runId, List<SummaryRow> rows) throws IOException {
    try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        var writer =
            CsvFormat.MAPPER
                .writerFor(SummaryCsvRow.class)
                .with(CsvFormat.schemaWithHeader(SummaryCsvRow.class))
                .writeValues(out)) {
      for (SummaryRow row : rows) {
        writer.write(SummaryCsvRow.from(row));
      }
    }
    log.info("Run {} summary written to {}", runId, file);
  }

  public Path file() {
    return file;
  }
}
