package com.mk.fx.qa.latency.execution.dto.controllerresponse;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** Live progress of a benchmark task for polling clients. */
@Data
@Builder
public class TaskLiveMetricsResponse {

  private String taskId;
  private String taskType;
  private List<String> targets;
  private int concurrency;
  private Double ratePerSec;
  private long expectedTotalRequests;

  private long dispatched;
  private long completed;
  private long inFlight;
  private long successes;
  private long failures;
  private Double percentComplete;
  private Double achievedRps;
  private Double latencyMinMs;
  private Double latencyAvgMs;
  private Double latencyMaxMs;
  private Double latencyP95Ms;
  private Map<String, Long> completedByTarget;
  private Map<String, Long> failuresByReason;
}
