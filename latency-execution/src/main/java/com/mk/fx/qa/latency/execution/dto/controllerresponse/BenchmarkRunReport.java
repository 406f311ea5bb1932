package com.mk.fx.qa.latency.execution.dto.controllerresponse;

import com.mk.fx.qa.latency.execution.metrics.SummaryRow;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Final report of a benchmark task: settings, dispatch counters, per-target statistics. */
public class BenchmarkRunReport {

  public String taskId;
  public String taskType;
  public String name;
  public Instant startTime;
  public Instant endTime;
  public double durationSec;

  public Config config;
  public Dispatch dispatch;
  public Connections connections;
  public List<SummaryRow> targets;
  public Export export;
  public Completion completion;

  public static class Config {
    public int concurrency;
    public Double ratePerSec;
    public int requestsPerTarget;
    public Duration connectTimeout;
    public Duration readTimeout;
    public boolean interleave;
    public long expectedTotalRequests;
    public List<String> targetIds;
  }

  public static class Dispatch {
    public long planned;
    public long dispatched;
    public long completed;
    public long skipped;
    public double dispatchSec;
  }

  public static class Connections {
    public long leasesOpened;
    public long cleanupFailures;
  }

  public static class Export {
    public String directory;
    public long detailRowsWritten;
    public long detailWriteFailures;
    public String summaryError;
  }

  public static class Completion {
    public String reason; // ALL_DISPATCHED, CANCELLED, FAILED
    public Integer percentComplete;
    public String message;
  }
}
