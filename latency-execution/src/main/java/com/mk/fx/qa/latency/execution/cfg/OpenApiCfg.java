package com.mk.fx.qa.latency.execution.cfg;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Latency Bench Runner API",
            description =
                "Queue HTTP latency benchmarks, poll their progress and fetch per-target statistics"
                    + " and CSV export locations.",
            version = "v1"))
public class OpenApiCfg {

  /** Benchmark endpoints only; actuator and error mappings stay out of the document. */
  @Bean
  public GroupedOpenApi benchmarksApi() {
    return GroupedOpenApi.builder()
        .group("benchmarks")
        .pathsToMatch("/api/benchmarks/**")
        .build();
  }
}
