package com.gentoro.reportbatch.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.reportbatch.batch.BatchOrchestrator;
import com.gentoro.reportbatch.batch.queue.InMemoryJobQueue;
import com.gentoro.reportbatch.batch.results.ResultFileManager;
import com.gentoro.reportbatch.batch.store.InMemoryJobStore;
import com.gentoro.reportbatch.exception.ValidationException;
import com.gentoro.reportbatch.filters.FilterCache;
import com.gentoro.reportbatch.filters.FilterOptionsService;
import com.gentoro.reportbatch.http.EmbeddedJettyServer;
import com.gentoro.reportbatch.security.AllowlistValidator;
import com.gentoro.reportbatch.upstream.RecordExtractor;
import com.gentoro.reportbatch.upstream.UpstreamClient;
import com.gentoro.reportbatch.upstream.UpstreamResponse;
import com.gentoro.reportbatch.utility.JacksonUtility;
import java.net.InetAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

/** Drives the HTTP surface end to end on an ephemeral Jetty port. */
@Timeout(60)
class BatchServletTest {

  @TempDir Path tempDir;

  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private final HttpClient http = HttpClient.newHttpClient();
  private EmbeddedJettyServer server;
  private BatchOrchestrator orchestrator;
  private String baseUrl;

  @BeforeEach
  void setUp() throws Exception {
    // echoes the parameter set back as a one-record report
    UpstreamClient upstream =
        request ->
            new UpstreamResponse(
                200,
                mapper.createObjectNode().set("records", mapper.createArrayNode().add(request.payload())),
                0);
    AllowlistValidator validator =
        new AllowlistValidator(
            "https://reports.example.com",
            List.of(),
            host -> new InetAddress[] {InetAddress.getByName("93.184.216.34")});
    orchestrator =
        new BatchOrchestrator(
            new InMemoryJobStore(Duration.ofHours(1)),
            new InMemoryJobQueue(),
            validator,
            upstream,
            new ResultFileManager(tempDir, Duration.ofHours(1)),
            new BatchOrchestrator.Limits(
                2, 2, 3, 100, OptionalLong.empty(), 2 * 1024 * 1024, Duration.ofMillis(20), ""),
            Clock.systemUTC());
    orchestrator.start();
    FilterOptionsService filters =
        new FilterOptionsService(
            new FilterCache(10, Duration.ofSeconds(30)), validator, upstream, "", OptionalLong.empty(), 100);

    server = new EmbeddedJettyServer("127.0.0.1", 0);
    server.prepare();
    new ReportBatchServer(server, orchestrator, filters).register();
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getPort();
  }

  @AfterEach
  void tearDown() {
    server.stop();
    orchestrator.close();
  }

  private HttpResponse<String> send(String method, String path, String body) throws Exception {
    HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(baseUrl + path));
    if (body == null) {
      b.method(method, HttpRequest.BodyPublishers.noBody());
    } else {
      b.header("Content-Type", "application/json")
          .method(method, HttpRequest.BodyPublishers.ofString(body));
    }
    return http.send(b.build(), HttpResponse.BodyHandlers.ofString());
  }

  private JsonNode awaitTerminal(String jobId) throws Exception {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
    while (System.nanoTime() < deadline) {
      JsonNode status = mapper.readTree(send("GET", "/batch/" + jobId, null).body());
      String s = status.path("status").asText();
      if (s.equals("completed") || s.equals("failed") || s.equals("cancelled")) return status;
      Thread.sleep(20);
    }
    fail("job did not finish");
    return null;
  }

  @Test
  void submitThenPollUntilCompleted() throws Exception {
    HttpResponse<String> submitted =
        send(
            "POST",
            "/batch",
            """
            {"endpoint": "/dtj/api/plan", "method": "POST", "sourceId": 1161,
             "params": [{"page": 1}, {"page": 2}]}
            """);
    assertEquals(200, submitted.statusCode());
    JsonNode ack = mapper.readTree(submitted.body());
    assertEquals("queued", ack.get("status").asText());
    String jobId = ack.get("job_id").asText();

    JsonNode status = awaitTerminal(jobId);

    assertEquals("completed", status.get("status").asText());
    assertEquals(2, status.at("/progress/total").asInt());
    assertEquals(2, status.at("/progress/completed").asInt());
    assertFalse(status.has("result_file"));
    JsonNode results = status.get("results");
    assertEquals(2, results.size());
    assertEquals(1, RecordExtractor.records(results.get(0).get("data")).get(0).get("page").asInt());
    assertEquals(2, RecordExtractor.records(results.get(1).get("data")).get(0).get("page").asInt());

    HttpResponse<String> raw = send("GET", "/batch/" + jobId + "/results", null);
    assertEquals(200, raw.statusCode());
    assertEquals(2, mapper.readTree(raw.body()).size());
  }

  @Test
  void overLimitSubmissionIs413() throws Exception {
    HttpResponse<String> resp =
        send("POST", "/batch", "{\"endpoint\": \"/p\", \"params\": [{}, {}, {}, {}]}");
    assertEquals(413, resp.statusCode());
    assertEquals("LIMIT_EXCEEDED", mapper.readTree(resp.body()).at("/error/code").asText());
  }

  @Test
  void malformedSubmissionIs400() throws Exception {
    assertEquals(400, send("POST", "/batch", "{not json").statusCode());
    assertEquals(400, send("POST", "/batch", "{\"params\": \"nope\"}").statusCode());
    assertEquals(400, send("POST", "/batch", "{\"params\": [1, 2]}").statusCode());
  }

  @Test
  void unreadableBodiesAreValidationErrors() throws Exception {
    byte[] broken = "{\"params\": [".getBytes(StandardCharsets.UTF_8);
    assertThrows(ValidationException.class, () -> BatchServlet.parse(broken));
    assertThrows(ValidationException.class, () -> FilterOptionsServlet.parse(broken));

    HttpResponse<String> resp = send("POST", "/api/report/filters", "{\"fields\": [");
    assertEquals(400, resp.statusCode());
    assertEquals("VALIDATION_ERROR", mapper.readTree(resp.body()).at("/error/code").asText());
  }

  @Test
  void deniedEndpointIs403() throws Exception {
    HttpResponse<String> resp =
        send("POST", "/batch", "{\"endpoint\": \"http://127.0.0.1/x\", \"params\": [{}]}");
    assertEquals(403, resp.statusCode());
    assertEquals(
        "NO_ALLOWLIST_CONFIGURED", mapper.readTree(resp.body()).at("/error/context/reason").asText());
  }

  @Test
  void unknownJobIs404() throws Exception {
    assertEquals(404, send("GET", "/batch/does-not-exist", null).statusCode());
    assertEquals(404, send("DELETE", "/batch/does-not-exist", null).statusCode());
  }

  @Test
  void deleteOnFinishedJobIsAcceptedAndKeepsStatus() throws Exception {
    String jobId =
        mapper
            .readTree(send("POST", "/batch", "{\"endpoint\": \"/p\", \"params\": [{}]}").body())
            .get("job_id")
            .asText();
    awaitTerminal(jobId);

    HttpResponse<String> resp = send("DELETE", "/batch/" + jobId, null);
    assertEquals(202, resp.statusCode());
    assertEquals("completed", mapper.readTree(resp.body()).get("status").asText());
  }

  @Test
  void filterOptionsAndHealth() throws Exception {
    HttpResponse<String> resp =
        send(
            "POST",
            "/api/report/filters",
            """
            {"templateId": "t1",
             "remoteSource": {"endpoint": "/sales", "method": "POST", "body": {"region": "EU"}},
             "fields": ["region"]}
            """);
    assertEquals(200, resp.statusCode());
    JsonNode body = mapper.readTree(resp.body());
    assertEquals("EU", body.at("/options/region/0").asText());
    assertFalse(body.at("/meta/region/cached").asBoolean());
    assertFalse(body.at("/truncated/region").asBoolean());

    HttpResponse<String> health = send("GET", "/health", null);
    assertEquals(200, health.statusCode());
    assertEquals("ok", mapper.readTree(health.body()).get("status").asText());
  }
}
