package com.mk.fx.qa.latency.execution.export;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.mk.fx.qa.latency.execution.metrics.DetailSink;
import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends outcomes to {@code detailed_results.csv}. The header is written once, with the first
 * batch; each batch is flushed before {@link #writeBatch} returns. Called from a single thread.
 */
@Slf4j
public class CsvDetailSink implements DetailSink {

  public static final String FILE_NAME = "detailed_results.csv";

  private final Path file;
  private SequenceWriter writer;

  public CsvDetailSink(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public void writeBatch(List<RequestOutcome> batch) throws IOException {
    if (batch.isEmpty()) {
      return;
    }
    if (writer == null) {
      writer = open();
    }
    for (RequestOutcome outcome : batch) {
      writer.write(DetailCsvRow.from(outcome));
    }
    writer.flush();
    log.debug("Wrote {} detail rows to {}", batch.size(), file);
  }

  @Override
  public void close() throws IOException {
    if (writer != null) {
      writer.close();
      writer = null;
    }
  }

  public Path file() {
    return file;
  }

  private SequenceWriter open() throws IOException {
    boolean writeHeader = !Files.exists(file) || Files.size(file) == 0;
    var schema = CsvFormat.schemaWithHeader(DetailCsvRow.class);
    Writer out =
        Files.newBufferedWriter(
            file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    try {
      return CsvFormat.MAPPER
          .writerFor(DetailCsvRow.class)
          .with(writeHeader ? schema : schema.withoutHeader())
          .writeValues(out);
    } catch (IOException e) {
      out.close();
      throw e;
    }
  }
}
