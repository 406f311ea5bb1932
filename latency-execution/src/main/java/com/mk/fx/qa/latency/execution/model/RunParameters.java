package com.mk.fx.qa.latency.execution.model;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Resolved execution settings of one run.
 *
 * @param concurrency maximum requests in flight
 * @param ratePerSec global dispatch rate, null when unlimited
 * @param requestsPerTarget default number of requests per target
 * @param connectTimeout default connect timeout
 * @param readTimeout default read timeout
 * @param detailedLogging log every request at INFO
 * @param batchSize outcomes per detail export batch
 * @param progressInterval period of progress log lines
 * @param interleave alternate targets instead of running them one after another
 * @param exportCsv write CSV exports
 * @param outputDir root directory for exports
 */
public record RunParameters(
    int concurrency,
    Double ratePerSec,
    int requestsPerTarget,
    Duration connectTimeout,
    Duration readTimeout,
    boolean detailedLogging,
    int batchSize,
    Duration progressInterval,
    boolean interleave,
    boolean exportCsv,
    Path outputDir) {}
