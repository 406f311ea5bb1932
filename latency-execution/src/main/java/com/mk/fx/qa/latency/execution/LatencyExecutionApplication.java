package com.mk.fx.qa.latency.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LatencyExecutionApplication {

  public static void main(String[] args) {
    SpringApplication.run(LatencyExecutionApplication.class, args);
  }
}
