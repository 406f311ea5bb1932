package com.mk.fx.qa.latency.execution.validation;

public enum FailureCategory {
  TRANSPORT,
  HTTP_STATUS,
  PARSE,
  VALIDATION,
  INTERNAL
}
