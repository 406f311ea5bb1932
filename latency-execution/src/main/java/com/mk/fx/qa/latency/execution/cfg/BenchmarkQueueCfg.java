package com.mk.fx.qa.latency.execution.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Queue of submitted benchmarks, bound to {@code latency.queue}.
 *
 * <pre>{@code
 * latency:
 *   queue:
 *     workers: 1
 *     capacity: 100
 *     history-size: 50
 *     shutdown-grace: 30s
 * }</pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "latency.queue")
public class BenchmarkQueueCfg {

  /** Benchmarks run side by side. More than one skews the latencies each of them measures. */
  @Min(1)
  @Max(16)
  private int workers = 1;

  /** Benchmarks that may wait for a worker before submissions are refused. */
  @Positive private int capacity = 100;

  /** Finished benchmarks kept in the history. */
  @Positive private int historySize = 50;

  /**
   * How long shutdown waits for running benchmarks to finish on their own before they are
   * cancelled. Cancelled runs still flush their results.
   */
  @NotNull private Duration shutdownGrace = Duration.ofSeconds(30);
}
