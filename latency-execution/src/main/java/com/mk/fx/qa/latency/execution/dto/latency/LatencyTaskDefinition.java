package com.mk.fx.qa.latency.execution.dto.latency;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Payload of a LATENCY task: the targets to measure, shared request settings and execution
 * parameters. Unset execution values fall back to the {@code latency.defaults.*} properties.
 */
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class LatencyTaskDefinition {

  @JsonProperty("name")
  private String name;

  @JsonProperty("globalConfig")
  private GlobalConfig globalConfig;

  @JsonProperty("targets")
  private List<TargetSpec> targets;

  @JsonProperty("execution")
  private ExecutionSpec execution;

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class GlobalConfig {

    @JsonProperty("headers")
    private Map<String, String> headers;

    @JsonProperty("vars")
    private Map<String, String> vars;

    @JsonProperty("proxy")
    private ProxyConfig proxy;

    @JsonProperty("proxyRotation")
    private ProxyRotationConfig proxyRotation;

    @JsonProperty("validation")
    private ValidationConfig validation;
  }

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TargetSpec {

    @JsonProperty("id")
    private String id;

    @JsonProperty("url")
    private String url;

    @JsonProperty("method")
    private String method;

    @JsonProperty("headers")
    private Map<String, String> headers;

    @JsonProperty("query")
    private Map<String, String> query;

    @JsonProperty("body")
    private Object body;

    /** Query parameter that receives a unique token per request. */
    @JsonProperty("cacheBuster")
    private String cacheBuster;

    @JsonProperty("requests")
    private Integer requests;

    @JsonProperty("ratePerSec")
    private Double ratePerSec;

    @JsonProperty("timeouts")
    private TimeoutConfig timeouts;

    @JsonProperty("proxy")
    private ProxyConfig proxy;

    @JsonProperty("proxyRotation")
    private ProxyRotationConfig proxyRotation;

    @JsonProperty("validation")
    private ValidationConfig validation;
  }

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TimeoutConfig {

    @JsonProperty("connectTimeoutMs")
    private Integer connectTimeoutMs;

    @JsonProperty("readTimeoutMs")
    private Integer readTimeoutMs;
  }

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ProxyConfig {

    @JsonProperty("host")
    private String host;

    @JsonProperty("port")
    private Integer port;

    @JsonProperty("username")
    private String username;

    @JsonProperty("password")
    private String password;
  }

  /** Geo-proxy whose region and country hint rotate with each request of a target. */
  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ProxyRotationConfig {

    /** e.g. "gw.{region}.proxy.example". */
    @JsonProperty("hostTemplate")
    private String hostTemplate;

    @JsonProperty("port")
    private Integer port;

    /** e.g. "customer-country-{country}". */
    @JsonProperty("usernameTemplate")
    private String usernameTemplate;

    @JsonProperty("password")
    private String password;

    @JsonProperty("regions")
    private List<String> regions;

    @JsonProperty("countries")
    private List<String> countries;
  }

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ValidationConfig {

    /** STATUS_ONLY, JSON or SEARCH_API. */
    @JsonProperty("profile")
    private String profile;

    @JsonProperty("metadataField")
    private String metadataField;

    @JsonProperty("metadataStatusField")
    private String metadataStatusField;

    @JsonProperty("errorStatusValue")
    private String errorStatusValue;

    @JsonProperty("errorField")
    private String errorField;

    @JsonProperty("resultFields")
    private List<String> resultFields;

    @JsonProperty("fallbackFieldThreshold")
    private Integer fallbackFieldThreshold;

    @JsonProperty("requiredFields")
    private List<String> requiredFields;
  }

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ExecutionSpec {

    @JsonProperty("concurrency")
    private Integer concurrency;

    @JsonProperty("ratePerSec")
    private Double ratePerSec;

    @JsonProperty("requestsPerTarget")
    private Integer requestsPerTarget;

    @JsonProperty("connectTimeoutMs")
    private Integer connectTimeoutMs;

    @JsonProperty("readTimeoutMs")
    private Integer readTimeoutMs;

    @JsonProperty("detailedLogging")
    private Boolean detailedLogging;

    @JsonProperty("batchSize")
    private Integer batchSize;

    /** e.g. "10s", "500ms". */
    @JsonProperty("progressInterval")
    private String progressInterval;

    @JsonProperty("interleave")
    private Boolean interleave;

    @JsonProperty("exportCsv")
    private Boolean exportCsv;
  }
}
