package com.mk.fx.qa.latency.execution.dto.controllerresponse;

/** Liveness of the benchmark service: UP while it accepts tasks, DOWN after shutdown. */
public record HealthResponse(String status) {}
