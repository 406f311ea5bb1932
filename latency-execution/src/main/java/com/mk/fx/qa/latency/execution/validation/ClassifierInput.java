package com.mk.fx.qa.latency.execution.validation;

import com.mk.fx.qa.latency.rest.TransportFailureKind;

/**
 * Raw material for classification, captured after the timed interval has ended.
 *
 * @param statusCode HTTP status, null when no response was received
 * @param body raw response body, may be null
 * @param transportFailure transport failure kind, null when a response was received
 * @param transportDetail description of the transport failure, may be null
 */
public record ClassifierInput(
    Integer statusCode, byte[] body, TransportFailureKind transportFailure, String transportDetail) {

  public static ClassifierInput response(int statusCode, byte[] body) {
    return new ClassifierInput(statusCode, body, null, null);
  }

  public static ClassifierInput failure(TransportFailureKind kind, String detail) {
    return new ClassifierInput(null, null, kind, detail);
  }
}
