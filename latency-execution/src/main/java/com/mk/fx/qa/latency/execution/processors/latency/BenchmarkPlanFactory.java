package com.mk.fx.qa.latency.execution.processors.latency;

import static com.mk.fx.qa.latency.execution.utils.LoadUtils.millis;
import static com.mk.fx.qa.latency.execution.utils.LoadUtils.parseDuration;

import com.mk.fx.qa.latency.execution.cfg.BenchmarkDefaultsCfg;
import com.mk.fx.qa.latency.execution.dto.latency.LatencyTaskDefinition;
import com.mk.fx.qa.latency.execution.dto.latency.LatencyTaskDefinition.ExecutionSpec;
import com.mk.fx.qa.latency.execution.dto.latency.LatencyTaskDefinition.ProxyConfig;
import com.mk.fx.qa.latency.execution.dto.latency.LatencyTaskDefinition.ProxyRotationConfig;
import com.mk.fx.qa.latency.execution.dto.latency.LatencyTaskDefinition.TargetSpec;
import com.mk.fx.qa.latency.execution.dto.latency.LatencyTaskDefinition.ValidationConfig;
import com.mk.fx.qa.latency.execution.executors.request.TargetPlan;
import com.mk.fx.qa.latency.execution.model.BenchmarkConfigurationException;
import com.mk.fx.qa.latency.execution.model.RunParameters;
import com.mk.fx.qa.latency.execution.model.TargetDescriptor;
import com.mk.fx.qa.latency.execution.validation.JsonResponseClassifier;
import com.mk.fx.qa.latency.execution.validation.ValidationProfile;
import com.mk.fx.qa.latency.execution.validation.ValidationRules;
import com.mk.fx.qa.latency.rest.ConnectionPolicy;
import com.mk.fx.qa.latency.rest.HttpMethod;
import com.mk.fx.qa.latency.rest.ProxyRotation;
import com.mk.fx.qa.latency.rest.ProxySpec;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link LatencyTaskDefinition} into a {@link BenchmarkPlan}, filling unset values from
 * {@link BenchmarkDefaultsCfg}. Every configuration problem is reported here, before any request
 * is made, as a {@link BenchmarkConfigurationException}.
 */
@Component
@RequiredArgsConstructor
public class BenchmarkPlanFactory {

  private final BenchmarkDefaultsCfg defaults;

  public BenchmarkPlan create(UUID taskId, LatencyTaskDefinition definition) {
    if (definition == null) {
      throw new BenchmarkConfigurationException("data definition is required");
    }
    if (definition.getTargets() == null || definition.getTargets().isEmpty()) {
      throw new BenchmarkConfigurationException("targets must contain at least one target");
    }

    var global = definition.getGlobalConfig();
    Map<String, String> variables = global != null && global.getVars() != null ? global.getVars() : Map.of();
    Map<String, String> headers = global != null ? global.getHeaders() : null;
    ProxyConfig globalProxy = global != null ? global.getProxy() : null;
    ProxyRotationConfig globalRotation = global != null ? global.getProxyRotation() : null;
    ValidationConfig globalValidation = global != null ? global.getValidation() : null;

    RunParameters parameters = resolveParameters(definition.getExecution());
    ConnectionPolicy defaultPolicy =
        new ConnectionPolicy(parameters.connectTimeout(), parameters.readTimeout());

    List<TargetPlan> targets = new ArrayList<>();
    Set<String> ids = new HashSet<>();
    for (int i = 0; i < definition.getTargets().size(); i++) {
      TargetSpec spec = definition.getTargets().get(i);
      if (spec == null) {
        throw new BenchmarkConfigurationException("targets[" + i + "] is empty");
      }
      TargetDescriptor descriptor = toDescriptor(i, spec, variables, globalProxy, globalRotation, globalValidation);
      if (!ids.add(descriptor.id())) {
        throw new BenchmarkConfigurationException("Duplicate target id: " + descriptor.id());
      }
      ConnectionPolicy policy =
          defaultPolicy.withOverrides(descriptor.connectTimeout(), descriptor.readTimeout());
      targets.add(new TargetPlan(descriptor, policy, new JsonResponseClassifier(descriptor.rules())));
    }

    String name =
        definition.getName() != null && !definition.getName().isBlank()
            ? definition.getName()
            : "latency-" + taskId;
    return new BenchmarkPlan(taskId.toString(), name, targets, parameters, headers, variables);
  }

  RunParameters resolveParameters(ExecutionSpec execution) {
    ExecutionSpec spec = execution != null ? execution : new ExecutionSpec();

    int concurrency = spec.getConcurrency() != null ? spec.getConcurrency() : defaults.getConcurrency();
    if (concurrency < 1) {
      throw new BenchmarkConfigurationException("execution.concurrency must be >= 1");
    }
    if (concurrency > defaults.getMaxConcurrency()) {
      throw new BenchmarkConfigurationException(
          "execution.concurrency must be <= " + defaults.getMaxConcurrency() + ", was " + concurrency);
    }
    double rate = spec.getRatePerSec() != null ? spec.getRatePerSec() : defaults.getRatePerSec();
    if (rate < 0.0 || Double.isNaN(rate) || Double.isInfinite(rate)) {
      throw new BenchmarkConfigurationException("execution.ratePerSec must be a finite value >= 0");
    }
    int requests =
        spec.getRequestsPerTarget() != null
            ? spec.getRequestsPerTarget()
            : defaults.getRequestsPerTarget();
    if (requests < 0) {
      throw new BenchmarkConfigurationException("execution.requestsPerTarget must be >= 0");
    }
    Duration connect = positive("execution.connectTimeoutMs", millis(spec.getConnectTimeoutMs(), defaults.getConnectTimeoutMs()));
    Duration read = positive("execution.readTimeoutMs", millis(spec.getReadTimeoutMs(), defaults.getReadTimeoutMs()));
    int batchSize = spec.getBatchSize() != null ? spec.getBatchSize() : defaults.getBatchSize();
    if (batchSize < 1) {
      throw new BenchmarkConfigurationException("execution.batchSize must be >= 1");
    }

    Duration progress;
    try {
      progress =
          parseDuration(
              spec.getProgressInterval(), parseDuration(defaults.getProgressInterval(), Duration.ofSeconds(10)));
    } catch (RuntimeException e) {
      throw new BenchmarkConfigurationException(
          "execution.progressInterval is invalid: " + spec.getProgressInterval(), e);
    }
    positive("execution.progressInterval", progress);

    return new RunParameters(
        concurrency,
        rate > 0.0 ? rate : null,
        requests,
        connect,
        read,
        spec.getDetailedLogging() != null ? spec.getDetailedLogging() : defaults.isDetailedLogging(),
        batchSize,
        progress,
        spec.getInterleave() != null ? spec.getInterleave() : defaults.isInterleave(),
        spec.getExportCsv() != null ? spec.getExportCsv() : defaults.isExportCsv(),
        Path.of(defaults.getOutputDir()));
  }

  private TargetDescriptor toDescriptor(
      int index,
      TargetSpec spec,
      Map<String, String> variables,
      ProxyConfig globalProxy,
      ProxyRotationConfig globalRotation,
      ValidationConfig globalValidation) {
    String id = spec.getId() != null && !spec.getId().isBlank() ? spec.getId().trim() : null;
    String label = id != null ? "target '" + id + "'" : "targets[" + index + "]";
    if (id == null) {
      throw new BenchmarkConfigurationException(label + ": id is required");
    }
    if (spec.getUrl() == null || spec.getUrl().isBlank()) {
      throw new BenchmarkConfigurationException(label + ": url is required");
    }
    validateUrl(label, resolveVars(spec.getUrl().trim(), variables));

    HttpMethod method;
    try {
      method = spec.getMethod() != null ? HttpMethod.valueOf(spec.getMethod().trim().toUpperCase()) : HttpMethod.GET;
    } catch (IllegalArgumentException e) {
      throw new BenchmarkConfigurationException(label + ": unsupported HTTP method " + spec.getMethod(), e);
    }

    if (spec.getRequests() != null && spec.getRequests() < 0) {
      throw new BenchmarkConfigurationException(label + ": requests must be >= 0");
    }
    Duration minInterval = null;
    if (spec.getRatePerSec() != null) {
      if (spec.getRatePerSec() < 0.0 || spec.getRatePerSec().isNaN() || spec.getRatePerSec().isInfinite()) {
        throw new BenchmarkConfigurationException(label + ": ratePerSec must be a finite value >= 0");
      }
      if (spec.getRatePerSec() > 0.0) {
        minInterval = Duration.ofNanos((long) Math.ceil(1_000_000_000L / spec.getRatePerSec()));
      }
    }

    var timeouts = spec.getTimeouts();
    Duration connect = null;
    Duration read = null;
    if (timeouts != null) {
      if (timeouts.getConnectTimeoutMs() != null) {
        connect = positive(label + " connectTimeoutMs", Duration.ofMillis(timeouts.getConnectTimeoutMs()));
      }
      if (timeouts.getReadTimeoutMs() != null) {
        read = positive(label + " readTimeoutMs", Duration.ofMillis(timeouts.getReadTimeoutMs()));
      }
    }

    // a target-level proxy or rotation replaces both global ones
    ProxyConfig proxy = spec.getProxy();
    ProxyRotationConfig rotation = spec.getProxyRotation();
    if (proxy != null && rotation != null) {
      throw new BenchmarkConfigurationException(label + ": proxy and proxyRotation are mutually exclusive");
    }
    if (proxy == null && rotation == null) {
      proxy = globalProxy;
      rotation = globalRotation;
      if (proxy != null && rotation != null) {
        throw new BenchmarkConfigurationException(
            "globalConfig: proxy and proxyRotation are mutually exclusive");
      }
    }

    String cacheBuster =
        spec.getCacheBuster() != null && !spec.getCacheBuster().isBlank() ? spec.getCacheBuster().trim() : null;

    return new TargetDescriptor(
        id,
        spec.getUrl().trim(),
        method,
        spec.getHeaders(),
        spec.getQuery(),
        spec.getBody(),
        cacheBuster,
        spec.getRequests(),
        connect,
        read,
        minInterval,
        toProxy(label, proxy),
        toRotation(label, rotation),
        toRules(label, spec.getValidation() != null ? spec.getValidation() : globalValidation));
  }

  private ProxySpec toProxy(String label, ProxyConfig proxy) {
    if (proxy == null) {
      return null;
    }
    if (proxy.getPort() == null) {
      throw new BenchmarkConfigurationException(label + ": proxy port is required");
    }
    try {
      return new ProxySpec(proxy.getHost(), proxy.getPort(), proxy.getUsername(), proxy.getPassword());
    } catch (RuntimeException e) {
      throw new BenchmarkConfigurationException(label + ": invalid proxy: " + e.getMessage(), e);
    }
  }

  private ProxyRotation toRotation(String label, ProxyRotationConfig rotation) {
    if (rotation == null) {
      return null;
    }
    if (rotation.getPort() == null) {
      throw new BenchmarkConfigurationException(label + ": proxyRotation port is required");
    }
    try {
      return new ProxyRotation(
          rotation.getHostTemplate(),
          rotation.getPort(),
          rotation.getUsernameTemplate(),
          rotation.getPassword(),
          rotation.getRegions(),
          rotation.getCountries());
    } catch (RuntimeException e) {
      throw new BenchmarkConfigurationException(label + ": invalid proxyRotation: " + e.getMessage(), e);
    }
  }

  ValidationRules toRules(String label, ValidationConfig config) {
    if (config == null) {
      return ValidationRules.statusOnly();
    }
    ValidationProfile profile;
    try {
      profile =
          config.getProfile() != null
              ? ValidationProfile.valueOf(config.getProfile().trim().toUpperCase())
              : ValidationProfile.STATUS_ONLY;
    } catch (IllegalArgumentException e) {
      throw new BenchmarkConfigurationException(
          label + ": unknown validation profile " + config.getProfile(), e);
    }
    ValidationRules base =
        switch (profile) {
          case SEARCH_API -> ValidationRules.searchApi();
          case JSON -> ValidationRules.json(config.getRequiredFields());
          case STATUS_ONLY -> ValidationRules.statusOnly();
        };
    if (config.getFallbackFieldThreshold() != null && config.getFallbackFieldThreshold() < 0) {
      throw new BenchmarkConfigurationException(label + ": fallbackFieldThreshold must be >= 0");
    }
    return new ValidationRules(
        profile,
        firstNonNull(config.getMetadataField(), base.metadataField()),
        firstNonNull(config.getMetadataStatusField(), base.metadataStatusField()),
        firstNonNull(config.getErrorStatusValue(), base.errorStatusValue()),
        firstNonNull(config.getErrorField(), base.errorField()),
        config.getResultFields() != null ? config.getResultFields() : base.resultFields(),
        config.getFallbackFieldThreshold() != null
            ? config.getFallbackFieldThreshold()
            : base.fallbackFieldThreshold(),
        config.getRequiredFields() != null ? config.getRequiredFields() : base.requiredFields());
  }

  private static void validateUrl(String label, String url) {
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException e) {
      throw new BenchmarkConfigurationException(label + ": malformed url " + url, e);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new BenchmarkConfigurationException(label + ": url must use http or https: " + url);
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new BenchmarkConfigurationException(label + ": url has no host: " + url);
    }
  }

  private static Duration positive(String field, Duration value) {
    if (value.isZero() || value.isNegative()) {
      throw new BenchmarkConfigurationException(field + " must be positive");
    }
    return value;
  }

  private static String resolveVars(String text, Map<String, String> variables) {
    String result = text;
    for (var entry : variables.entrySet()) {
      result = result.replace("{{" + entry.getKey() + "}}", entry.getValue());
    }
    return result;
  }

  private static String firstNonNull(String value, String fallback) {
    return value != null ? value : fallback;
  }
}
