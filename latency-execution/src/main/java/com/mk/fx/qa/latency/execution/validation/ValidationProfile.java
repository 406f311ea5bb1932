package com.mk.fx.qa.latency.execution.validation;

/** How deep response validation goes. */
public enum ValidationProfile {
  /** Transport and status checks only. */
  STATUS_ONLY,
  /** Adds a well-formed JSON object check and optional required fields. */
  JSON,
  /** Full search-API validation: metadata, reported errors and result payload. */
  SEARCH_API
}
