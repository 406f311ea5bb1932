package com.mk.fx.qa.latency.execution.validation;

/**
 * Maps a raw response to success or to its earliest-detectable failure reason. Implementations must
 * be pure and deterministic: no I/O, no clocks, no shared mutable state.
 */
@FunctionalInterface
public interface ResponseClassifier {

  Classification classify(ClassifierInput input);
}
