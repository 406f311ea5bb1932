package com.mk.fx.qa.latency.execution.model;

/**
 * Raised when a benchmark definition cannot be run: missing targets, malformed URLs, non-positive
 * concurrency and similar. Always thrown before any request is issued.
 */
public class BenchmarkConfigurationException extends IllegalArgumentException {

  public BenchmarkConfigurationException(String message) {
    super(message);
  }

  public BenchmarkConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
