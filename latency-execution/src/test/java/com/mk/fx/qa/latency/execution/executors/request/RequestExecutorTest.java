package com.mk.fx.qa.latency.execution.executors.request;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import com.mk.fx.qa.latency.execution.model.RouteInfo;
import com.mk.fx.qa.latency.execution.model.TargetDescriptor;
import com.mk.fx.qa.latency.execution.model.WorkItem;
import com.mk.fx.qa.latency.execution.validation.Classification;
import com.mk.fx.qa.latency.execution.validation.FailureCategory;
import com.mk.fx.qa.latency.execution.validation.JsonResponseClassifier;
import com.mk.fx.qa.latency.execution.validation.ResponseClassifier;
import com.mk.fx.qa.latency.execution.validation.ValidationRules;
import com.mk.fx.qa.latency.rest.ConnectionPolicy;
import com.mk.fx.qa.latency.rest.HttpMethod;
import com.mk.fx.qa.latency.rest.LatencyHttpClient;
import com.mk.fx.qa.latency.rest.ProxyRotation;
import com.mk.fx.qa.latency.rest.TransportFailureKind;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RequestExecutorTest {

  private static final String SEARCH_BODY =
      "{\"search_metadata\":{\"status\":\"Success\"},\"organic_results\":[{\"title\":\"coffee\"}]}";

  private HttpServer server;
  private String baseUrl;
  private final List<String> queries = new CopyOnWriteArrayList<>();
  private final List<String> proxyCredentials = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/search",
        exchange -> {
          queries.add(exchange.getRequestURI().getRawQuery());
          respond(exchange, 200, SEARCH_BODY);
        });
    server.createContext("/down", exchange -> respond(exchange, 503, "unavailable"));
    // reached in absolute form, acting as both the geo-proxy and the ipinfo endpoint behind it
    server.createContext(
        "/json",
        exchange -> {
          proxyCredentials.add(exchange.getRequestHeaders().getFirst("Proxy-Authorization"));
          respond(exchange, 200, "{\"ip\":\"203.0.113.7\",\"country\":\"DE\"}");
        });
    server.createContext("/text", exchange -> respond(exchange, 200, "not json"));
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  private static TargetDescriptor target(String id, String url, String cacheBuster) {
    return new TargetDescriptor(
        id, url, null, null, Map.of("q", "coffee"), null, cacheBuster, null, null, null, null, null,
        null, ValidationRules.searchApi());
  }

  private static TargetPlan plan(TargetDescriptor descriptor, ResponseClassifier classifier) {
    return new TargetPlan(descriptor, ConnectionPolicy.ofMillis(2_000, 2_000), classifier);
  }

  @Test
  void success_isClassifiedAndReleased() throws Exception {
    var client = new LatencyHttpClient(Map.of(), Map.of());
    TargetDescriptor descriptor = target("google", baseUrl + "/search", "nocache");
    var executor =
        new RequestExecutor(
            client, List.of(plan(descriptor, new JsonResponseClassifier(descriptor.rules()))), true);

    RequestOutcome outcome =
        executor.execute(new WorkItem("google", 0, 7, Map.of("nocache", "123_7")));

    assertTrue(outcome.success(), outcome.classification().describe());
    assertEquals(200, outcome.httpStatus());
    assertEquals(SEARCH_BODY.length(), outcome.responseBytes());
    assertEquals(7, outcome.globalIndex());
    assertTrue(outcome.resourcesReleased());
    assertFalse(outcome.cleanupFailed());
    assertEquals(0, client.liveLeases());
    assertTrue(queries.get(0).contains("q=coffee"));
    assertTrue(queries.get(0).contains("nocache=123_7"));
  }

  @Test
  void classificationTime_isExcludedFromLatency() throws Exception {
    ResponseClassifier slowClassifier =
        input -> {
          try {
            TimeUnit.MILLISECONDS.sleep(500);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return Classification.ok();
        };
    TargetDescriptor descriptor = target("google", baseUrl + "/search", null);
    var executor =
        new RequestExecutor(
            new LatencyHttpClient(Map.of(), Map.of()),
            List.of(plan(descriptor, slowClassifier)),
            false);

    long wallStart = System.nanoTime();
    RequestOutcome outcome = executor.execute(new WorkItem("google", 0, 0, Map.of()));
    double wallMs = (System.nanoTime() - wallStart) / 1_000_000.0;

    assertTrue(wallMs >= 500.0);
    assertTrue(
        outcome.elapsedMillis() < wallMs - 400.0,
        "Latency " + outcome.elapsedMillis() + " ms includes classification time");
  }

  @Test
  void httpError_classifiedByStatus() throws Exception {
    TargetDescriptor descriptor = target("bing", baseUrl + "/down", null);
    var executor =
        new RequestExecutor(
            new LatencyHttpClient(Map.of(), Map.of()),
            List.of(plan(descriptor, new JsonResponseClassifier(descriptor.rules()))),
            false);

    RequestOutcome outcome = executor.execute(new WorkItem("bing", 0, 0, Map.of()));

    assertFalse(outcome.success());
    assertEquals(503, outcome.httpStatus());
    assertEquals("HTTP_503", outcome.classification().reason());
    assertTrue(outcome.resourcesReleased());
  }

  @Test
  void refusedConnection_isTransportFailureWithReleasedLease() throws Exception {
    int closedPort;
    try (ServerSocket socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }
    TargetDescriptor descriptor = target("gone", "http://127.0.0.1:" + closedPort + "/search", null);
    var client = new LatencyHttpClient(Map.of(), Map.of());
    var executor =
        new RequestExecutor(
            client,
            List.of(plan(descriptor, new JsonResponseClassifier(descriptor.rules()))),
            false);

    RequestOutcome outcome = executor.execute(new WorkItem("gone", 0, 0, Map.of()));

    assertFalse(outcome.success());
    assertEquals(FailureCategory.TRANSPORT, outcome.classification().category());
    assertEquals(TransportFailureKind.CONNECTION_REFUSED.name(), outcome.classification().reason());
    assertNull(outcome.httpStatus());
    assertTrue(outcome.resourcesReleased());
    assertEquals(0, client.liveLeases());
  }

  private TargetDescriptor rotated(String id, String path) {
    int proxyPort = server.getAddress().getPort();
    var rotation =
        new ProxyRotation(
            "127.0.0.1", proxyPort, "cust-country-{country}", "pw", List.of("na", "eu", "as"),
            List.of("us", "de"));
    return new TargetDescriptor(
        id, "http://ipinfo.example" + path, HttpMethod.GET, null, null, null, null, null, null, null,
        null, null, rotation, ValidationRules.statusOnly());
  }

  @Test
  void proxyRotation_routesEachRequestAndRecordsTheExit() throws Exception {
    TargetDescriptor descriptor = rotated("ipinfo", "/json");
    var executor =
        new RequestExecutor(
            new LatencyHttpClient(Map.of(), Map.of()),
            List.of(plan(descriptor, new JsonResponseClassifier(descriptor.rules()))),
            false);

    RequestOutcome first = executor.execute(new WorkItem("ipinfo", 0, 0, Map.of()));
    RequestOutcome fifth = executor.execute(new WorkItem("ipinfo", 4, 4, Map.of()));

    assertTrue(first.success(), first.classification().describe());
    assertEquals(new RouteInfo("na", "us", "203.0.113.7", "DE"), first.route());
    assertEquals(new RouteInfo("eu", "us", "203.0.113.7", "DE"), fifth.route());
    assertEquals(
        List.of(basic("cust-country-us:pw"), basic("cust-country-us:pw")), proxyCredentials);
  }

  @Test
  void proxyRotation_unreadableBody_leavesExitEmpty() throws Exception {
    TargetDescriptor descriptor = rotated("ipinfo", "/text");
    var executor =
        new RequestExecutor(
            new LatencyHttpClient(Map.of(), Map.of()),
            List.of(plan(descriptor, new JsonResponseClassifier(descriptor.rules()))),
            false);

    RequestOutcome outcome = executor.execute(new WorkItem("ipinfo", 1, 1, Map.of()));

    assertTrue(outcome.success());
    assertEquals(new RouteInfo("eu", "de", null, null), outcome.route());
  }

  @Test
  void directTarget_hasNoRoute() throws Exception {
    TargetDescriptor descriptor = target("google", baseUrl + "/search", null);
    var executor =
        new RequestExecutor(
            new LatencyHttpClient(Map.of(), Map.of()),
            List.of(plan(descriptor, new JsonResponseClassifier(descriptor.rules()))),
            false);

    assertSame(RouteInfo.NONE, executor.execute(new WorkItem("google", 0, 0, Map.of())).route());
  }

  private static String basic(String credentials) {
    return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void unknownTarget_rejected() {
    TargetDescriptor descriptor = target("google", baseUrl + "/search", null);
    var executor =
        new RequestExecutor(
            new LatencyHttpClient(Map.of(), Map.of()),
            List.of(plan(descriptor, new JsonResponseClassifier(descriptor.rules()))),
            false);

    assertThrows(
        IllegalStateException.class, () -> executor.execute(new WorkItem("other", 0, 0, Map.of())));
  }
}
