package com.mk.fx.qa.latency.execution.validation;

import com.mk.fx.qa.latency.rest.TransportFailureKind;

/**
 * Verdict for one response.
 *
 * @param success whether the response counts as successful
 * @param category failure category, null on success
 * @param reason machine-readable reason code, null on success
 * @param detail human-readable detail, may be null
 */
public record Classification(
    boolean success, FailureCategory category, String reason, String detail) {

  public static final String PARSE_ERROR = "PARSE_ERROR";
  public static final String MISSING_METADATA = "MISSING_METADATA";
  public static final String REPORTED_ERROR = "REPORTED_ERROR";
  public static final String EMPTY_RESULT = "EMPTY_RESULT";
  public static final String MISSING_FIELD = "MISSING_FIELD";
  public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

  private static final Classification SUCCESS = new Classification(true, null, null, null);

  public static Classification ok() {
    return SUCCESS;
  }

  public static Classification transport(TransportFailureKind kind, String detail) {
    return new Classification(false, FailureCategory.TRANSPORT, kind.name(), detail);
  }

  public static Classification httpStatus(int status) {
    return new Classification(false, FailureCategory.HTTP_STATUS, "HTTP_" + status, "HTTP " + status);
  }

  public static Classification parse(String detail) {
    return new Classification(false, FailureCategory.PARSE, PARSE_ERROR, detail);
  }

  public static Classification invalid(String reason, String detail) {
    return new Classification(false, FailureCategory.VALIDATION, reason, detail);
  }

  public static Classification internal(Throwable error) {
    var message = error.getMessage();
    return new Classification(
        false,
        FailureCategory.INTERNAL,
        INTERNAL_ERROR,
        error.getClass().getSimpleName() + (message != null ? ": " + message : ""));
  }

  /** Reason followed by detail, as written to logs and exports. */
  public String describe() {
    if (success) {
      return "OK";
    }
    return detail == null || detail.isBlank() ? reason : reason + ": " + detail;
  }
}
