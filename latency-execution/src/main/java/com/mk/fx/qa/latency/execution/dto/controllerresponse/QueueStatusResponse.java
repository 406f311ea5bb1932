package com.mk.fx.qa.latency.execution.dto.controllerresponse;

/**
 * Work waiting in and running on the benchmark queue.
 *
 * @param queuedBenchmarks benchmarks waiting for a worker
 * @param runningBenchmarks benchmarks being dispatched
 * @param workers benchmarks run side by side
 * @param acceptingTasks whether new submissions are accepted
 * @param queuedRequests requests planned by the waiting benchmarks
 * @param remainingRequests requests the running benchmarks have yet to complete
 */
public record QueueStatusResponse(
    int queuedBenchmarks,
    int runningBenchmarks,
    int workers,
    boolean acceptingTasks,
    long queuedRequests,
    long remainingRequests) {}
