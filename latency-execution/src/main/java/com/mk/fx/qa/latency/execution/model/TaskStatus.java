package com.mk.fx.qa.latency.execution.model;

/** Lifecycle states of a submitted benchmark task. */
public enum TaskStatus {
  QUEUED,
  PROCESSING,
  COMPLETED,
  ERROR,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR || this == CANCELLED;
  }
}
