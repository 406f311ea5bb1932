package com.mk.fx.qa.latency.execution.processors.latency;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.latency.execution.cfg.BenchmarkDefaultsCfg;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.BenchmarkRunReport;
import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskSubmissionRequest;
import com.mk.fx.qa.latency.execution.export.CsvDetailSink;
import com.mk.fx.qa.latency.execution.export.CsvSummarySink;
import com.mk.fx.qa.latency.execution.export.ExportSinkFactory;
import com.mk.fx.qa.latency.execution.export.ExportSinks;
import com.mk.fx.qa.latency.execution.metrics.BenchmarkMetricsRegistry;
import com.mk.fx.qa.latency.execution.metrics.DetailSink;
import com.mk.fx.qa.latency.execution.metrics.LatencyMetrics;
import com.mk.fx.qa.latency.execution.metrics.SummaryRow;
import com.mk.fx.qa.latency.execution.model.BenchmarkConfigurationException;
import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import com.mk.fx.qa.latency.execution.model.RunParameters;
import com.mk.fx.qa.latency.execution.model.TaskType;
import com.mk.fx.qa.latency.rest.JsonUtil;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LatencyTaskProcessorTest {

  private static final String SEARCH_BODY =
      "{\"search_metadata\":{\"status\":\"Success\"},\"organic_results\":[{\"title\":\"coffee\"}]}";

  @TempDir Path outputDir;

  private HttpServer server;
  private ExecutorService serverExecutor;
  private String baseUrl;
  private BenchmarkMetricsRegistry registry;
  private LatencyTaskProcessor processor;

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    serverExecutor = Executors.newCachedThreadPool();
    server.setExecutor(serverExecutor);
    server.createContext("/search", exchange -> respond(exchange, 200, SEARCH_BODY));
    server.createContext("/err", exchange -> respond(exchange, 500, "ERR"));
    server.createContext(
        "/slow",
        exchange -> {
          try {
            Thread.sleep(100);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          respond(exchange, 200, SEARCH_BODY);
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

    var defaults = new BenchmarkDefaultsCfg();
    defaults.setOutputDir(outputDir.toString());
    registry = new BenchmarkMetricsRegistry();
    processor =
        new LatencyTaskProcessor(
            registry, new BenchmarkPlanFactory(defaults), new ExportSinkFactory());
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
    if (serverExecutor != null) serverExecutor.shutdownNow();
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  @SuppressWarnings("unchecked")
  private static TaskSubmissionRequest request(UUID taskId, String dataJson) throws Exception {
    var request = new TaskSubmissionRequest();
    request.setTaskId(taskId.toString());
    request.setTaskType(TaskType.LATENCY.name());
    request.setData(JsonUtil.read(dataJson, Map.class));
    return request;
  }

  @Test
  void supportsLatencyTasks() {
    assertEquals(TaskType.LATENCY, processor.supportedTaskType());
  }

  @Test
  void execute_measuresEveryTarget_andWritesCsvExports() throws Exception {
    UUID taskId = UUID.randomUUID();
    var request =
        request(
            taskId,
            "{'name':'serp','globalConfig':{'validation':{'profile':'SEARCH_API'}},"
                + "'targets':[{'id':'google','url':'"
                + baseUrl
                + "/search','cacheBuster':'nocache'},"
                + "{'id':'broken','url':'"
                + baseUrl
                + "/err'}],"
                + "'execution':{'concurrency':2,'requestsPerTarget':3,'batchSize':2,'interleave':true}}");

    processor.execute(request);

    BenchmarkRunReport report = registry.getReport(taskId).orElseThrow();
    assertEquals("ALL_DISPATCHED", report.completion.reason);
    assertEquals(100, report.completion.percentComplete);
    assertEquals(6, report.dispatch.planned);
    assertEquals(6, report.dispatch.completed);
    assertEquals(0, report.dispatch.skipped);
    assertEquals(6, report.connections.leasesOpened);
    assertEquals(0, report.connections.cleanupFailures);
    assertEquals(6, report.export.detailRowsWritten);
    assertNull(report.export.summaryError);

    SummaryRow google = report.targets.get(0);
    assertEquals("google", google.targetId());
    assertEquals(3, google.successCount());
    assertEquals(100.0, google.successRatePercent());
    assertNotNull(google.meanLatencyMs());

    SummaryRow broken = report.targets.get(1);
    assertEquals(0, broken.successCount());
    assertEquals(Map.of("HTTP_500", 3L), broken.failuresByReason());
    assertNull(broken.meanLatencyMs());

    Path directory = outputDir.resolve(LocalDate.now().toString()).resolve(taskId.toString());
    assertEquals(directory.toString(), report.export.directory);
    List<String> detail = Files.readAllLines(directory.resolve(CsvDetailSink.FILE_NAME));
    assertEquals(7, detail.size());
    assertTrue(detail.get(0).startsWith("timestamp,request_index,target"));
    List<String> summary = Files.readAllLines(directory.resolve(CsvSummarySink.FILE_NAME));
    assertEquals(3, summary.size());
    assertTrue(summary.get(1).startsWith("google,3,3,0,100.0"));

    var snapshot = registry.getSnapshot(taskId).orElseThrow();
    assertEquals(6, snapshot.completed());
    assertEquals(3, snapshot.failures());
  }

  @Test
  void execute_withoutCsvExport_writesNoFiles() throws Exception {
    UUID taskId = UUID.randomUUID();
    var request =
        request(
            taskId,
            "{'targets':[{'id':'google','url':'"
                + baseUrl
                + "/search'}],'execution':{'requestsPerTarget':2,'exportCsv':false}}");

    processor.execute(request);

    BenchmarkRunReport report = registry.getReport(taskId).orElseThrow();
    assertEquals(2, report.targets.get(0).successCount());
    assertNull(report.export.directory);
    assertEquals(0, report.export.detailRowsWritten);
    try (var files = Files.list(outputDir)) {
      assertEquals(0, files.count());
    }
  }

  @Test
  void cancel_stopsDispatchAndReportsCancelled() throws Exception {
    UUID taskId = UUID.randomUUID();
    var request =
        request(
            taskId,
            "{'targets':[{'id':'slow','url':'"
                + baseUrl
                + "/slow'}],'execution':{'concurrency':1,'requestsPerTarget':50,'exportCsv':false}}");

    ExecutorService runner = Executors.newSingleThreadExecutor();
    try {
      Future<?> run =
          runner.submit(
              () -> {
                processor.execute(request);
                return null;
              });
      TimeUnit.MILLISECONDS.sleep(350);
      assertTrue(processor.cancel(taskId));

      var ex = assertThrows(ExecutionException.class, () -> run.get(10, TimeUnit.SECONDS));
      assertInstanceOf(InterruptedException.class, ex.getCause());
    } finally {
      runner.shutdownNow();
    }

    BenchmarkRunReport report = registry.getReport(taskId).orElseThrow();
    assertEquals("CANCELLED", report.completion.reason);
    assertTrue(report.dispatch.skipped > 0);
    assertEquals(report.dispatch.dispatched, report.dispatch.completed);
    assertEquals(50, report.dispatch.dispatched + report.dispatch.skipped);
    assertTrue(report.completion.percentComplete < 100);
    assertEquals(0, processor.runsInProgress());
  }

  @Test
  void failureBeforeDispatch_stillClosesTheDetailFile() throws Exception {
    var detailClosed = new AtomicBoolean(false);
    DetailSink detail =
        new DetailSink() {
          @Override
          public void writeBatch(List<RequestOutcome> batch) {
            fail("nothing should be written");
          }

          @Override
          public void close() {
            detailClosed.set(true);
          }
        };
    var failingRegistry =
        new BenchmarkMetricsRegistry() {
          @Override
          public void register(UUID taskId, LatencyMetrics metrics) {
            throw new IllegalStateException("registry unavailable");
          }
        };
    var sinkFactory =
        new ExportSinkFactory() {
          @Override
          public ExportSinks open(UUID taskId, RunParameters parameters) {
            return new ExportSinks(detail, (runId, rows) -> {}, outputDir);
          }
        };
    var failing =
        new LatencyTaskProcessor(
            failingRegistry, new BenchmarkPlanFactory(new BenchmarkDefaultsCfg()), sinkFactory);
    UUID taskId = UUID.randomUUID();

    var ex =
        assertThrows(
            IllegalStateException.class,
            () ->
                failing.execute(
                    request(
                        taskId,
                        "{'targets':[{'id':'google','url':'" + baseUrl + "/search'}]}")));

    assertEquals("registry unavailable", ex.getMessage());
    assertTrue(detailClosed.get());
    assertEquals("FAILED", failingRegistry.getReport(taskId).orElseThrow().completion.reason);
    assertEquals(0, failing.runsInProgress());
  }

  @Test
  void cancelAfterCompletion_leavesNoTokenBehind() throws Exception {
    UUID taskId = UUID.randomUUID();
    processor.execute(
        request(
            taskId,
            "{'targets':[{'id':'google','url':'"
                + baseUrl
                + "/search'}],'execution':{'requestsPerTarget':1,'exportCsv':false}}"));

    assertFalse(processor.cancel(taskId));
    assertFalse(processor.cancel(UUID.randomUUID()));
    assertEquals(0, processor.runsInProgress());
  }

  @Test
  void cancelRacingCompletion_neverLeaksATokenOrFailsACompletedRun() throws Exception {
    ExecutorService canceller = Executors.newSingleThreadExecutor();
    try {
      for (int i = 0; i < 20; i++) {
        UUID taskId = UUID.randomUUID();
        var request =
            request(
                taskId,
                "{'targets':[{'id':'google','url':'"
                    + baseUrl
                    + "/search'}],'execution':{'requestsPerTarget':1,'exportCsv':false}}");
        Future<?> cancel =
            canceller.submit(
                () -> {
                  for (int attempt = 0; attempt < 200 && !processor.cancel(taskId); attempt++) {
                    Thread.onSpinWait();
                  }
                });
        try {
          processor.execute(request);
        } catch (InterruptedException cancelledInTime) {
          assertEquals(
              "CANCELLED", registry.getReport(taskId).orElseThrow().completion.reason);
        }
        cancel.get(5, TimeUnit.SECONDS);
        assertEquals(0, processor.runsInProgress(), "token left behind for run " + i);
      }
    } finally {
      canceller.shutdownNow();
    }
  }

  @Test
  void validate_rejectsInvalidDefinition() throws Exception {
    var request =
        request(UUID.randomUUID(), "{'targets':[{'id':'a','url':'not a url'}]}");
    assertThrows(BenchmarkConfigurationException.class, () -> processor.validate(request));
  }

  @Test
  void validate_rejectsMalformedTaskId() throws Exception {
    var request = request(UUID.randomUUID(), "{'targets':[{'id':'a','url':'http://a.example.com'}]}");
    request.setTaskId("not-a-uuid");
    assertThrows(BenchmarkConfigurationException.class, () -> processor.validate(request));
  }

  @Test
  void validate_rejectsWrongShape() throws Exception {
    var request = request(UUID.randomUUID(), "{'targets':'google'}");
    assertThrows(BenchmarkConfigurationException.class, () -> processor.validate(request));
  }

  @Test
  void validate_acceptsValidDefinition_andCountsPlannedRequests() throws Exception {
    var request =
        request(
            UUID.randomUUID(),
            "{'targets':[{'id':'a','url':'http://a.example.com'},"
                + "{'id':'b','url':'http://b.example.com'}],"
                + "'execution':{'requestsPerTarget':7}}");
    assertEquals(14L, processor.validate(request));
  }
}
