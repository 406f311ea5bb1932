package com.mk.fx.qa.latency.execution.model;

import com.mk.fx.qa.latency.execution.validation.ValidationRules;
import com.mk.fx.qa.latency.rest.HttpMethod;
import com.mk.fx.qa.latency.rest.ProxyRotation;
import com.mk.fx.qa.latency.rest.ProxySpec;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A logical benchmark target such as a search engine or a geo-proxied endpoint.
 *
 * @param id unique target identifier, used as the aggregation key
 * @param url endpoint URL
 * @param method HTTP method
 * @param headers target-specific headers
 * @param query static query parameters
 * @param body optional request body
 * @param cacheBusterParam name of the query parameter carrying a per-request unique token, or null
 * @param requestCount requests to issue against this target, or null for the run default
 * @param connectTimeout connect timeout override, or null
 * @param readTimeout read timeout override, or null
 * @param minInterval minimum spacing between dispatches to this target, or null
 * @param proxy proxy to route requests through, or null
 * @param proxyRotation geo-proxy rotated per request, or null; excludes {@code proxy}
 * @param rules response validation rules
 */
public record TargetDescriptor(
    String id,
    String url,
    HttpMethod method,
    Map<String, String> headers,
    Map<String, String> query,
    Object body,
    String cacheBusterParam,
    Integer requestCount,
    Duration connectTimeout,
    Duration readTimeout,
    Duration minInterval,
    ProxySpec proxy,
    ProxyRotation proxyRotation,
    ValidationRules rules) {

  public TargetDescriptor {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(url, "url");
    method = method != null ? method : HttpMethod.GET;
    headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
    query = query != null ? Collections.unmodifiableMap(new LinkedHashMap<>(query)) : Map.of();
    rules = rules != null ? rules : ValidationRules.statusOnly();
    if (proxy != null && proxyRotation != null) {
      throw new IllegalArgumentException("Target " + id + " sets both a proxy and a proxy rotation");
    }
  }

  /** Creates a GET target validated by status code only. */
  public static TargetDescriptor simple(String id, String url) {
    return new TargetDescriptor(
        id, url, HttpMethod.GET, null, null, null, null, null, null, null, null, null, null, null);
  }

  public TargetDescriptor withRules(ValidationRules newRules) {
    return new TargetDescriptor(
        id, url, method, headers, query, body, cacheBusterParam, requestCount, connectTimeout,
        readTimeout, minInterval, proxy, proxyRotation, newRules);
  }
}
