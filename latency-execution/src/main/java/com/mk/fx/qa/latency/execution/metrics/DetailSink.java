package com.mk.fx.qa.latency.execution.metrics;

import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import java.io.IOException;
import java.util.List;

/** Receives batches of per-request outcomes for the detailed trace. */
public interface DetailSink extends AutoCloseable {

  void writeBatch(List<RequestOutcome> batch) throws IOException;

  @Override
  default void close() throws IOException {}
}
