package com.mk.fx.qa.latency.execution.export;

import com.mk.fx.qa.latency.execution.metrics.DetailSink;
import com.mk.fx.qa.latency.execution.metrics.SummarySink;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Sinks opened for one run. Closing releases the detail file; it is safe after the run has already
 * closed it.
 *
 * @param detail detail trace sink, null when CSV export is off
 * @param summary summary sink, never null
 * @param directory export directory, null when CSV export is off
 */
public record ExportSinks(DetailSink detail, SummarySink summary, Path directory)
    implements AutoCloseable {

  @Override
  public void close() throws IOException {
    if (detail != null) {
      detail.close();
    }
  }
}
