package com.mk.fx.qa.latency.execution.cfg;

import java.time.Instant;

/**
 * Body returned for rejected or failed API calls.
 *
 * @param error short error title
 * @param details what was wrong
 * @param timestamp when the error was produced
 */
public record ErrorResponse(String error, String details, Instant timestamp) {

  public ErrorResponse(String error, String details) {
    this(error, details, Instant.now());
  }
}
