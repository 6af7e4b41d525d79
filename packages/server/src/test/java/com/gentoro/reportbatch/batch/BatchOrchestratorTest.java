package com.gentoro.reportbatch.batch;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.reportbatch.MutableClock;
import com.gentoro.reportbatch.ReportBatchSettings;
import com.gentoro.reportbatch.batch.queue.InMemoryJobQueue;
import com.gentoro.reportbatch.batch.results.ResultFileManager;
import com.gentoro.reportbatch.batch.store.InMemoryJobStore;
import com.gentoro.reportbatch.exception.AllowlistDeniedException;
import com.gentoro.reportbatch.exception.LimitExceededException;
import com.gentoro.reportbatch.exception.NotFoundException;
import com.gentoro.reportbatch.exception.ReportBatchErrorCode;
import com.gentoro.reportbatch.exception.UpstreamException;
import com.gentoro.reportbatch.exception.ValidationException;
import com.gentoro.reportbatch.security.AllowlistValidator;
import com.gentoro.reportbatch.security.HostResolver;
import com.gentoro.reportbatch.upstream.UpstreamClient;
import com.gentoro.reportbatch.upstream.UpstreamRequest;
import com.gentoro.reportbatch.upstream.UpstreamResponse;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(60)
class BatchOrchestratorTest {

  private static final String BASE = "https://reports.example.com";
  private static final HostResolver PUBLIC =
      host -> new InetAddress[] {InetAddress.getByName("93.184.216.34")};

  /** Records every call and answers with {@code behavior}. */
  static final class FakeUpstream implements UpstreamClient {
    final List<UpstreamRequest> calls = new CopyOnWriteArrayList<>();
    volatile Function<UpstreamRequest, JsonNode> behavior = UpstreamRequest::payload;

    @Override
    public UpstreamResponse execute(UpstreamRequest request) {
      calls.add(request);
      return new UpstreamResponse(200, behavior.apply(request), 0);
    }
  }

  @TempDir Path tempDir;

  private FakeUpstream upstream;
  private InMemoryJobStore store;
  private InMemoryJobQueue queue;
  private ResultFileManager results;
  private BatchOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    upstream = new FakeUpstream();
    queue = new InMemoryJobQueue();
    store = new InMemoryJobStore(Duration.ofHours(1));
    results = new ResultFileManager(tempDir.resolve("results"), Duration.ofHours(1));
  }

  @AfterEach
  void tearDown() {
    if (orchestrator != null) orchestrator.close();
  }

  private BatchOrchestrator orchestrator(BatchOrchestrator.Limits limits, Clock clock) {
    orchestrator =
        new BatchOrchestrator(
            store,
            queue,
            new AllowlistValidator(BASE, List.of(), PUBLIC),
            upstream,
            results,
            limits,
            clock);
    return orchestrator;
  }

  private static BatchOrchestrator.Limits limits(int itemConcurrency, int maxItems) {
    return new BatchOrchestrator.Limits(
        2,
        itemConcurrency,
        maxItems,
        100,
        OptionalLong.empty(),
        ReportBatchSettings.DEFAULT_INLINE_MAX_BYTES,
        Duration.ofMillis(20),
        "");
  }

  private BatchOrchestrator started(int itemConcurrency) {
    BatchOrchestrator o = orchestrator(limits(itemConcurrency, 100), Clock.systemUTC());
    o.start();
    return o;
  }

  private static ObjectNode set(String key, int value) {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put(key, value);
    return node;
  }

  private static BatchSubmission submission(String endpoint, List<JsonNode> params) {
    return new BatchSubmission(endpoint, "POST", "1161", params, null);
  }

  private BatchJob awaitTerminal(String id) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
    while (System.nanoTime() < deadline) {
      BatchJob job = orchestrator.get(id);
      if (job.isTerminal()) return job;
      Thread.sleep(10);
    }
    fail("Job " + id + " did not finish in time");
    return null;
  }

  @Test
  void overLimitSubmissionCreatesNoJob() {
    BatchOrchestrator o = orchestrator(limits(2, 3), Clock.systemUTC());
    LimitExceededException ex =
        assertThrows(
            LimitExceededException.class,
            () -> o.submit(submission("/plan", TestJobs.params(4))));

    assertEquals(ReportBatchErrorCode.LIMIT_EXCEEDED, ex.getCode());
    assertEquals(0, queue.size());
    assertTrue(upstream.calls.isEmpty());
  }

  @Test
  void recordCeilingCountsExpectedRowsAcrossParameterSets() {
    BatchOrchestrator o =
        orchestrator(
            new BatchOrchestrator.Limits(
                1, 1, 100, 100, OptionalLong.of(100), 1024, Duration.ofMillis(20), ""),
            Clock.systemUTC());

    LimitExceededException ex =
        assertThrows(
            LimitExceededException.class,
            () -> o.submit(submission("/plan", List.of(set("limit", 60), set("pageSize", 60)))));
    assertEquals(120, ex.getActual());
    assertNotNull(o.submit(submission("/plan", List.of(set("limit", 60), set("page", 9)))));
  }

  @Test
  void recordCeilingCannotBeBypassedByOverflowOrNumericStrings() {
    BatchOrchestrator o =
        orchestrator(
            new BatchOrchestrator.Limits(
                1, 1, 100, 100, OptionalLong.of(100), 1024, Duration.ofMillis(20), ""),
            Clock.systemUTC());
    ObjectNode huge = JsonNodeFactory.instance.objectNode().put("limit", Long.MAX_VALUE);
    ObjectNode text = JsonNodeFactory.instance.objectNode().put("limit", "1000000");
    ObjectNode fractional = JsonNodeFactory.instance.objectNode().put("pageSize", 10.5);
    ObjectNode garbage = JsonNodeFactory.instance.objectNode().put("limit", "lots");

    LimitExceededException overflow =
        assertThrows(
            LimitExceededException.class,
            () -> o.submit(submission("/plan", List.of(huge, huge.deepCopy()))));
    assertEquals(Long.MAX_VALUE, overflow.getActual());
    LimitExceededException textual =
        assertThrows(
            LimitExceededException.class, () -> o.submit(submission("/plan", List.of(text))));
    assertEquals(1_000_000, textual.getActual());
    assertThrows(
        LimitExceededException.class, () -> o.submit(submission("/plan", List.of(fractional))));
    ValidationException invalid =
        assertThrows(
            ValidationException.class, () -> o.submit(submission("/plan", List.of(garbage))));
    assertFalse(invalid instanceof LimitExceededException);
    assertEquals(0, queue.size());

    ObjectNode small = JsonNodeFactory.instance.objectNode().put("limit", " 40 ");
    assertNotNull(o.submit(submission("/plan", List.of(small))));
  }

  @Test
  void fullQueueRejectsSubmissionWithoutStoringAJob() {
    BatchOrchestrator o =
        orchestrator(
            new BatchOrchestrator.Limits(
                1, 1, 10, 2, OptionalLong.empty(), 1024, Duration.ofMillis(20), ""),
            Clock.systemUTC());
    String first = o.submit(submission("/plan", TestJobs.params(1)));
    String second = o.submit(submission("/plan", TestJobs.params(1)));

    LimitExceededException ex =
        assertThrows(
            LimitExceededException.class,
            () -> o.submit(submission("/plan", TestJobs.params(1))));

    assertEquals("Queued jobs", ex.getLimitName());
    assertEquals(2, queue.size());
    assertEquals(2, store.size());
    assertEquals(BatchJobStatus.QUEUED, o.get(first).status());

    o.cancel(second);
    assertNotNull(o.submit(submission("/plan", TestJobs.params(1))));
  }

  @Test
  void queueThatRefusesTheOfferLeavesNoRecordBehind() {
    queue = new InMemoryJobQueue(1);
    BatchOrchestrator.Limits lenient =
        new BatchOrchestrator.Limits(
            1, 1, 10, 5, OptionalLong.empty(), 1024, Duration.ofMillis(20), "");
    BatchOrchestrator o = orchestrator(lenient, Clock.systemUTC());
    o.submit(submission("/plan", TestJobs.params(1)));

    assertThrows(
        LimitExceededException.class, () -> o.submit(submission("/plan", TestJobs.params(1))));
    assertEquals(1, store.size());
  }

  @Test
  void endpointProblemsAreRejectedAtSubmission() {
    BatchOrchestrator o = orchestrator(limits(1, 10), Clock.systemUTC());
    assertThrows(ValidationException.class, () -> o.submit(submission(" ", TestJobs.params(1))));
    assertThrows(ValidationException.class, () -> o.submit(submission("/plan", List.of())));
    assertThrows(
        AllowlistDeniedException.class,
        () -> o.submit(submission("https://other.example.org/plan", TestJobs.params(1))));
    assertEquals(0, queue.size());
  }

  @Test
  void blankEndpointFallsBackToConfiguredDefault() throws Exception {
    orchestrator(
            new BatchOrchestrator.Limits(
                1,
                1,
                10,
                100,
                OptionalLong.empty(),
                1024 * 1024,
                Duration.ofMillis(20),
                "/default"),
            Clock.systemUTC())
        .start();
    String id = orchestrator.submit(submission(null, TestJobs.params(1)));
    awaitTerminal(id);
    assertEquals(BASE + "/default", upstream.calls.get(0).url());
  }

  @Test
  void resultsAlignWithInputIndexRegardlessOfCompletionOrder() throws Exception {
    int n = 12;
    upstream.behavior =
        request -> {
          int page = request.payload().get("page").asInt();
          try {
            Thread.sleep((n - page) * 5L); // later items finish first
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return set("echo", page);
        };
    String id = started(4).submit(submission("/plan", TestJobs.params(n)));

    BatchJob job = awaitTerminal(id);

    assertEquals(BatchJobStatus.COMPLETED, job.status());
    List<BatchItemResult> items = job.result().items();
    assertEquals(n, items.size());
    for (int i = 0; i < n; i++) {
      assertEquals(i, items.get(i).index());
      assertEquals(i, items.get(i).data().get("echo").asInt());
    }
    assertEquals(n, job.completedItems());
    assertNotNull(job.startedAt());
    assertFalse(job.completedAt().isBefore(job.startedAt()));
  }

  @Test
  void itemFailuresAreCapturedWithoutFailingTheJob() throws Exception {
    upstream.behavior =
        request -> {
          int page = request.payload().get("page").asInt();
          if (page == 1) {
            throw new UpstreamException(UpstreamException.Kind.HTTP_STATUS, 500, "boom", null);
          }
          if (page == 2) {
            throw new UpstreamException(UpstreamException.Kind.TIMEOUT, "slow", null);
          }
          return request.payload();
        };
    String id = started(2).submit(submission("/plan", TestJobs.params(3)));

    BatchJob job = awaitTerminal(id);

    assertEquals(BatchJobStatus.COMPLETED, job.status());
    List<BatchItemResult> items = job.result().items();
    assertTrue(items.get(0).ok());
    assertFalse(items.get(1).ok());
    assertEquals("HTTP_STATUS", items.get(1).error().type());
    assertEquals(500, items.get(1).error().statusCode());
    assertEquals("TIMEOUT", items.get(2).error().type());
    assertNull(items.get(2).error().statusCode());
    assertEquals(3, upstream.calls.size());
  }

  @Test
  void oversizedResultsAreStoredInAFileWithExactByteSize() throws Exception {
    String chunk = StringUtils.repeat('x', 1_200_000);
    upstream.behavior = request -> JsonNodeFactory.instance.textNode(chunk);
    String id = started(2).submit(submission("/plan", TestJobs.params(2)));

    BatchJob job = awaitTerminal(id);

    assertEquals(BatchJobStatus.COMPLETED, job.status());
    JobResultRef ref = job.result();
    assertFalse(ref.isInline());
    assertNull(ref.items());
    assertEquals(2, ref.itemCount());
    assertTrue(ref.byteSize() > ReportBatchSettings.DEFAULT_INLINE_MAX_BYTES);
    assertEquals(Files.size(results.directory().resolve(ref.fileReference())), ref.byteSize());

    BatchJobView view = orchestrator.view(id);
    assertNull(view.results());
    assertEquals(ref.fileReference(), view.resultFile().reference());

    List<BatchItemResult> items = orchestrator.readResults(id);
    assertEquals(2, items.size());
    assertEquals(chunk, items.get(1).data().asText());
  }

  @Test
  void cancellingAQueuedJobDispatchesNothing() throws Exception {
    BatchOrchestrator o = orchestrator(limits(2, 10), Clock.systemUTC());
    String id = o.submit(submission("/plan", TestJobs.params(3)));

    BatchJob cancelled = o.cancel(id);
    assertEquals(BatchJobStatus.CANCELLED, cancelled.status());
    assertEquals(0, queue.size());

    o.start();
    Thread.sleep(200);
    assertTrue(upstream.calls.isEmpty());
    assertEquals(BatchJobStatus.CANCELLED, o.get(id).status());
    assertTrue(o.readResults(id).isEmpty());
  }

  @Test
  void cancellingARunningJobKeepsRecordedOutcomesAndStopsDispatch() throws Exception {
    CountDownLatch firstCallEntered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    upstream.behavior =
        request -> {
          firstCallEntered.countDown();
          try {
            release.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return request.payload();
        };
    String id = started(1).submit(submission("/plan", TestJobs.params(5)));

    assertTrue(firstCallEntered.await(10, TimeUnit.SECONDS));
    assertEquals(BatchJobStatus.RUNNING, orchestrator.get(id).status());
    BatchJob requested = orchestrator.cancel(id);
    assertTrue(requested.cancelRequested());
    release.countDown();

    BatchJob job = awaitTerminal(id);

    assertEquals(BatchJobStatus.CANCELLED, job.status());
    assertEquals(1, upstream.calls.size());
    List<BatchItemResult> items = job.result().items();
    assertEquals(5, items.size());
    assertTrue(items.get(0).ok());
    for (int i = 1; i < 5; i++) {
      assertTrue(items.get(i).isCancelled(), "item " + i + " should be cancelled");
      assertEquals(i, items.get(i).index());
    }
  }

  @Test
  void cancellingATerminalJobIsANoOp() throws Exception {
    String id = started(1).submit(submission("/plan", TestJobs.params(1)));
    BatchJob done = awaitTerminal(id);

    BatchJob again = orchestrator.cancel(id);
    assertEquals(BatchJobStatus.COMPLETED, again.status());
    assertEquals(done.completedAt(), again.completedAt());
  }

  @Test
  @DisplayName("Relative plan endpoint: two items, inline results in submitted order")
  void planScenarioReturnsInlineResults() throws Exception {
    upstream.behavior = request -> set("rows", request.payload().get("page").asInt() + 10);
    String id =
        started(2)
            .submit(
                new BatchSubmission(
                    "/dtj/api/plan",
                    "POST",
                    "1161",
                    List.of(set("page", 0), set("page", 1)),
                    JsonNodeFactory.instance.objectNode().put("requestedBy", "test")));

    awaitTerminal(id);
    BatchJobView view = orchestrator.view(id);

    assertEquals("completed", view.status());
    assertNull(view.resultFile());
    assertEquals(2, view.results().size());
    assertEquals(10, view.results().get(0).data().get("rows").asInt());
    assertEquals(11, view.results().get(1).data().get("rows").asInt());
    assertEquals(new BatchJobView.Progress(2, 2), view.progress());
    for (UpstreamRequest call : upstream.calls) {
      assertEquals(BASE + "/dtj/api/plan", call.url());
      assertEquals("POST", call.method());
    }
  }

  @Test
  void finishedJobIsNotFoundAfterItsTtl() throws Exception {
    MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    store = new InMemoryJobStore(Duration.ofSeconds(1), clock);
    orchestrator(limits(1, 10), clock).start();
    String id = orchestrator.submit(submission("/plan", TestJobs.params(1)));
    awaitTerminal(id);

    clock.advance(Duration.ofSeconds(2));

    assertThrows(NotFoundException.class, () -> orchestrator.get(id));
    assertThrows(NotFoundException.class, () -> orchestrator.view(id));
    assertThrows(NotFoundException.class, () -> orchestrator.cancel(id));
  }

  @Test
  void closeLetsARunningJobFinishBeforeStopping() throws Exception {
    CountDownLatch firstCallEntered = new CountDownLatch(1);
    upstream.behavior =
        request -> {
          firstCallEntered.countDown();
          try {
            Thread.sleep(150);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return request.payload();
        };
    String id = started(1).submit(submission("/plan", TestJobs.params(3)));
    assertTrue(firstCallEntered.await(10, TimeUnit.SECONDS));

    orchestrator.close(Duration.ofSeconds(20));

    BatchJob job = orchestrator.get(id);
    assertEquals(BatchJobStatus.COMPLETED, job.status());
    assertEquals(3, upstream.calls.size());
    assertNull(job.error());
  }

  @Test
  void jobsStillQueuedAtCloseStayQueued() throws Exception {
    BatchOrchestrator o = started(1);
    o.close(Duration.ofSeconds(5));

    String id = o.submit(submission("/plan", TestJobs.params(1)));
    Thread.sleep(100);

    assertEquals(BatchJobStatus.QUEUED, o.get(id).status());
    assertEquals(1, queue.size());
    assertTrue(upstream.calls.isEmpty());
  }

  @Test
  void infrastructureFailureMarksJobFailed() throws Exception {
    orchestrator(
            new BatchOrchestrator.Limits(
                1, 1, 10, 100, OptionalLong.empty(), 1, Duration.ofMillis(20), ""),
            Clock.systemUTC())
        .start();
    // replace the results directory with a plain file so writes fail
    Path dir = results.directory();
    Files.delete(dir);
    Files.writeString(dir, "not a directory");

    String id = orchestrator.submit(submission("/plan", TestJobs.params(2)));
    BatchJob job = awaitTerminal(id);

    assertEquals(BatchJobStatus.FAILED, job.status());
    assertNotNull(job.error());
    assertTrue(job.error().contains("StoreException"));
  }

  @Test
  void unknownJobIsNotFound() {
    BatchOrchestrator o = orchestrator(limits(1, 10), Clock.systemUTC());
    assertThrows(NotFoundException.class, () -> o.get("nope"));
    assertThrows(NotFoundException.class, () -> o.cancel("nope"));
  }
}
