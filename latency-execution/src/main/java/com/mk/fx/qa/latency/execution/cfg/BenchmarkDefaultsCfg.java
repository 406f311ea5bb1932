package com.mk.fx.qa.latency.execution.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Run-parameter defaults applied when a task payload leaves a value unset. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "latency.defaults")
public class BenchmarkDefaultsCfg {

  @Min(1)
  @Max(1024)
  private int concurrency = 5;

  /** Upper bound for {@code execution.concurrency} in task payloads. */
  @Min(1)
  @Max(4096)
  private int maxConcurrency = 256;

  /** Requests per second across all targets; 0 disables rate limiting. */
  @PositiveOrZero private double ratePerSec = 0.0;

  @Min(0)
  private int requestsPerTarget = 10;

  @Min(1)
  private int connectTimeoutMs = 10_000;

  @Min(1)
  private int readTimeoutMs = 20_000;

  private boolean detailedLogging = false;

  @Min(1)
  private int batchSize = 1_000;

  @NotBlank private String progressInterval = "10s";

  private boolean interleave = false;

  private boolean exportCsv = true;

  @NotBlank private String outputDir = "results";
}
