package com.mk.fx.qa.latency.execution.executors.request;

import com.mk.fx.qa.latency.execution.executors.dispatch.WorkItemExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import com.mk.fx.qa.latency.execution.model.RouteInfo;
import com.mk.fx.qa.latency.execution.model.TargetDescriptor;
import com.mk.fx.qa.latency.execution.model.WorkItem;
import com.mk.fx.qa.latency.execution.validation.ClassifierInput;
import com.mk.fx.qa.latency.rest.JsonUtil;
import com.mk.fx.qa.latency.rest.LatencyHttpClient;
import com.mk.fx.qa.latency.rest.ProxyRotation;
import com.mk.fx.qa.latency.rest.Request;
import com.mk.fx.qa.latency.rest.RestResponseData;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes one work item: builds the request for its target, performs the timed round trip on a
 * fresh connection and classifies the response once timing has ended. For targets behind a proxy
 * rotation the exit address and country are read from the JSON body, also after timing.
 */
@Slf4j
public class RequestExecutor implements WorkItemExecutor {

  private final LatencyHttpClient client;
  private final Map<String, TargetPlan> targets;
  private final boolean detailedLogging;

  public RequestExecutor(LatencyHttpClient client, List<TargetPlan> targets, boolean detailedLogging) {
    this.client = Objects.requireNonNull(client, "client");
    this.targets =
        Objects.requireNonNull(targets, "targets").stream()
            .collect(
                Collectors.toUnmodifiableMap(TargetPlan::id, Function.identity()));
    this.detailedLogging = detailedLogging;
  }

  @Override
  public RequestOutcome execute(WorkItem item) {
    TargetPlan plan = targets.get(item.targetId());
    if (plan == null) {
      throw new IllegalStateException("Unknown target " + item.targetId());
    }

    TargetDescriptor target = plan.descriptor();
    var request = toRequest(target, item);
    RouteInfo route = RouteInfo.NONE;
    if (target.proxyRotation() != null) {
      ProxyRotation.ProxyRoute hop = target.proxyRotation().route(item.sequence());
      request.setProxy(hop.proxy());
      route = new RouteInfo(hop.region(), hop.country(), null, null);
    }

    RestResponseData response = client.execute(request, plan.policy());

    var input =
        new ClassifierInput(
            response.getStatusCode(),
            response.getBody(),
            response.getTransportFailure(),
            response.getErrorMessage());
    var classification = plan.classifier().classify(input);

    var outcome =
        new RequestOutcome(
            item.targetId(),
            item.sequence(),
            item.globalIndex(),
            response.getStartedAt(),
            response.getStartNanos(),
            response.getEndNanos(),
            response.getStatusCode(),
            response.bodySize(),
            classification,
            response.isResourcesReleased(),
            response.getCleanupError(),
            target.proxyRotation() != null ? withExit(route, response) : route);

    if (detailedLogging) {
      log.info(
          "[{}] #{} {} {} ms {}",
          item.targetId(),
          item.sequence() + 1,
          response.getStatusCode() != null ? response.getStatusCode() : "-",
          String.format("%.2f", outcome.elapsedMillis()),
          classification.success() ? "OK" : classification.describe());
    }
    return outcome;
  }

  /** Reads {@code ip} and {@code country} from an ipinfo-style body; absent fields stay null. */
  private RouteInfo withExit(RouteInfo route, RestResponseData response) {
    if (response.getBody() == null || response.getBody().length == 0) {
      return route;
    }
    try {
      JsonNode body = JsonUtil.readStrictTree(response.getBody());
      return route.withExit(text(body, "ip"), text(body, "country"));
    } catch (IOException e) {
      log.debug("Exit location not readable from response body: {}", e.getMessage());
      return route;
    }
  }

  private static String text(JsonNode body, String field) {
    JsonNode value = body.get(field);
    return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
  }

  private Request toRequest(TargetDescriptor target, WorkItem item) {
    var request = new Request();
    request.setMethod(target.method());
    request.setUrl(target.url());
    request.setHeaders(target.headers());
    Map<String, String> query = new LinkedHashMap<>(target.query());
    query.putAll(item.parameters());
    request.setQuery(query);
    request.setBody(target.body());
    request.setProxy(target.proxy());
    return request;
  }
}
