package com.mk.fx.qa.latency.execution.executors.dispatch;

/**
 * Counters describing a finished dispatch.
 *
 * @param dispatched work items admitted for execution
 * @param completed work items whose outcome was handed to the consumer
 * @param skipped work items never dispatched because of cancellation
 * @param cancelled whether dispatch stopped early
 * @param elapsedNanos time from the first admission attempt to the last completion
 */
public record DispatchResult(
    long dispatched, long completed, long skipped, boolean cancelled, long elapsedNanos) {}
