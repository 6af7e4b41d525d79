package com.gentoro.reportbatch.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.reportbatch.ReportBatchSettings;
import com.gentoro.reportbatch.batch.queue.JobQueue;
import com.gentoro.reportbatch.batch.results.ResultFileManager;
import com.gentoro.reportbatch.batch.results.StoredResult;
import com.gentoro.reportbatch.batch.store.JobStore;
import com.gentoro.reportbatch.exception.ExceptionUtil;
import com.gentoro.reportbatch.exception.LimitExceededException;
import com.gentoro.reportbatch.exception.NotFoundException;
import com.gentoro.reportbatch.exception.StateException;
import com.gentoro.reportbatch.exception.StoreException;
import com.gentoro.reportbatch.exception.UpstreamException;
import com.gentoro.reportbatch.exception.ValidationException;
import com.gentoro.reportbatch.security.AllowlistValidator;
import com.gentoro.reportbatch.upstream.UpstreamClient;
import com.gentoro.reportbatch.upstream.UpstreamRequest;
import com.gentoro.reportbatch.upstream.UpstreamResponse;
import com.gentoro.reportbatch.utility.JacksonUtility;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import org.apache.commons.lang3.StringUtils;

/**
 * Accepts batch submissions and runs them on a fixed pool of workers.
 *
 * <p>Submission validates and stores a QUEUED record, enqueues its id and returns at once. Each
 * worker takes ids from the {@link JobQueue}, moves the job to RUNNING and dispatches its items
 * against the upstream endpoint, at most {@code itemConcurrency} at a time per job. Every item
 * outcome lands at its submission index. Cancellation is checked before each dispatch and never
 * interrupts a call in flight. All state changes go through {@link JobStore#update}, so the
 * submission path, the workers and cancel requests never overwrite each other.
 */
public final class BatchOrchestrator implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(BatchOrchestrator.class);

  /** Parameter fields read as the expected row count of one parameter set. */
  static final List<String> ROW_COUNT_FIELDS = List.of("limit", "pageSize");

  static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

  /** Tuning knobs taken from configuration. */
  public record Limits(
      int workers,
      int itemConcurrency,
      int maxItems,
      int queueMaxSize,
      OptionalLong maxRecords,
      long inlineMaxBytes,
      Duration pollInterval,
      String defaultEndpoint) {

    public static Limits fromSettings(ReportBatchSettings s) {
      return new Limits(
          s.batchConcurrency(),
          s.itemConcurrency(),
          s.maxItemsPerBatch(),
          s.queueMaxSize(),
          s.maxRecords(),
          s.inlineMaxBytes(),
          s.pollInterval(),
          s.upstreamDefaultUrl());
    }
  }

  private final JobStore store;
  private final JobQueue queue;
  private final AllowlistValidator validator;
  private final UpstreamClient upstream;
  private final ResultFileManager results;
  private final Limits limits;
  private final Clock clock;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  private final Map<String, AtomicBoolean> localCancels = new ConcurrentHashMap<>();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private ExecutorService workers;
  private ExecutorService itemExecutor;

  public BatchOrchestrator(
      JobStore store,
      JobQueue queue,
      AllowlistValidator validator,
      UpstreamClient upstream,
      ResultFileManager results,
      Limits limits,
      Clock clock) {
    this.store = store;
    this.queue = queue;
    this.validator = validator;
    this.upstream = upstream;
    this.results = results;
    this.limits = limits;
    this.clock = clock;
  }

  /** Start the worker pool. Submission works without it; jobs simply stay queued. */
  public synchronized void start() {
    if (!running.compareAndSet(false, true)) return;
    workers = Executors.newFixedThreadPool(limits.workers(), named("batch-worker"));
    itemExecutor =
        Executors.newFixedThreadPool(
            limits.workers() * limits.itemConcurrency(), named("batch-item"));
    for (int i = 0; i < limits.workers(); i++) {
      workers.submit(this::workerLoop);
    }
    log.info(
        "Batch orchestrator started: {} worker(s), {} item call(s) per job",
        limits.workers(),
        limits.itemConcurrency());
  }

  /**
   * Validate and enqueue a submission.
   *
   * @return the new job id
   * @throws LimitExceededException when the item count, the record ceiling or the pending queue
   *     limit is exceeded
   * @throws ValidationException when no endpoint can be resolved
   * @throws com.gentoro.reportbatch.exception.AllowlistDeniedException when the endpoint is denied
   */
  public String submit(BatchSubmission submission) {
    int count = submission.params().size();
    if (count == 0) {
      throw new ValidationException("At least one parameter set is required");
    }
    if (count > limits.maxItems()) {
      throw new LimitExceededException("Items per batch", count, limits.maxItems());
    }
    if (limits.maxRecords().isPresent()) {
      long expected = expectedRows(submission.params());
      if (expected > limits.maxRecords().getAsLong()) {
        throw new LimitExceededException("Record limit", expected, limits.maxRecords().getAsLong());
      }
    }
    String endpoint = StringUtils.defaultIfBlank(submission.endpoint(), limits.defaultEndpoint());
    if (StringUtils.isBlank(endpoint)) {
      throw new ValidationException("Endpoint is required and no default upstream is configured");
    }
    String url = validator.requirePermitted(endpoint);
    int pending = queue.size();
    if (pending >= limits.queueMaxSize()) {
      throw new LimitExceededException("Queued jobs", pending + 1L, limits.queueMaxSize());
    }

    String id = UUID.randomUUID().toString();
    BatchJob job =
        new BatchJob(
            id,
            url,
            submission.method(),
            submission.sourceId(),
            submission.params(),
            submission.metadata(),
            clock.instant());
    store.put(job);
    boolean accepted;
    try {
      accepted = queue.offer(id);
    } catch (RuntimeException e) {
      store.delete(id);
      throw e;
    }
    if (!accepted) {
      // lost a race for the last queue slot
      store.delete(id);
      throw new LimitExceededException(
          "Queued jobs", limits.queueMaxSize() + 1L, limits.queueMaxSize());
    }
    log.info("Job {} queued: {} item(s) against {}", id, count, url);
    return id;
  }

  /**
   * Current job record.
   *
   * @throws NotFoundException when the job is unknown or its TTL has elapsed
   */
  public BatchJob get(String id) {
    return store.get(id).orElseThrow(() -> new NotFoundException("Unknown job: " + id));
  }

  public BatchJobView view(String id) {
    return BatchJobView.from(get(id));
  }

  /**
   * Request cancellation. A queued job is cancelled at once; a running job stops dispatching at
   * its next item. A terminal job is returned untouched.
   */
  public BatchJob cancel(String id) {
    BatchJob current = get(id);
    if (current.isTerminal()) return current;
    BatchJob updated =
        store.update(
            id,
            job -> {
              if (job.status() == BatchJobStatus.QUEUED) {
                job.markCancelled(null, clock.instant());
              } else if (job.status() == BatchJobStatus.RUNNING) {
                job.requestCancel();
              }
              return job;
            });
    AtomicBoolean flag = localCancels.get(id);
    if (flag != null) flag.set(true);
    if (updated.status() == BatchJobStatus.CANCELLED && updated.result() == null) {
      queue.remove(id);
      log.info("Job {} cancelled before start", id);
    } else {
      log.info("Cancellation requested for job {} ({})", id, updated.status().wireName());
    }
    return updated;
  }

  /**
   * Item results of a terminal job, read from the job record or its result file.
   *
   * @throws NotFoundException when the job is unknown, not finished, or its file is gone
   */
  public List<BatchItemResult> readResults(String id) {
    BatchJob job = get(id);
    if (!job.isTerminal()) {
      throw new NotFoundException("Job " + id + " has not finished");
    }
    JobResultRef ref = job.result();
    if (ref == null) return List.of();
    return ref.isInline() ? ref.items() : results.get(ref.fileReference());
  }

  /** Raw JSON of a terminal job's item results. */
  public byte[] readResultBytes(String id) {
    BatchJob job = get(id);
    JobResultRef ref = job.result();
    if (job.isTerminal() && ref != null && !ref.isInline()) {
      return results.read(ref.fileReference());
    }
    try {
      return mapper.writeValueAsBytes(readResults(id));
    } catch (JsonProcessingException e) {
      throw new StoreException("Could not serialize results of job " + id, e);
    }
  }

  private void workerLoop() {
    while (running.get()) {
      try {
        queue.poll(limits.pollInterval()).ifPresent(this::runJob);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      } catch (RuntimeException e) {
        log.error("Worker loop error: {}", ExceptionUtil.formatCompactStackTrace(e));
        try {
          Thread.sleep(limits.pollInterval().toMillis());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          return;
        }
      }
    }
  }

  void runJob(String id) {
    BatchJob job;
    try {
      job =
          store.update(
              id,
              current -> {
                if (current.status() == BatchJobStatus.QUEUED) {
                  current.markRunning(clock.instant());
                }
                return current;
              });
    } catch (NotFoundException e) {
      log.warn("Job {} expired before it could run", id);
      return;
    } catch (RuntimeException e) {
      fail(id, e);
      return;
    }
    if (job.status() != BatchJobStatus.RUNNING) {
      log.debug("Skipping job {} in state {}", id, job.status());
      return;
    }

    AtomicBoolean cancelFlag = localCancels.computeIfAbsent(id, k -> new AtomicBoolean(false));
    try {
      execute(job, cancelFlag);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      fail(id, new StateException("Shut down before job " + id + " finished", e));
    } catch (RuntimeException e) {
      fail(id, e);
    } finally {
      localCancels.remove(id);
    }
  }

  private void execute(BatchJob job, AtomicBoolean cancelFlag) throws InterruptedException {
    String id = job.id();
    int total = job.itemCount();
    int permitsTotal = limits.itemConcurrency();
    AtomicReferenceArray<BatchItemResult> outcomes = new AtomicReferenceArray<>(total);
    AtomicInteger completed = new AtomicInteger();
    Semaphore permits = new Semaphore(permitsTotal);
    log.info("Job {} running: {} item(s)", id, total);

    int dispatched = 0;
    for (int i = 0; i < total; i++) {
      permits.acquire();
      if (isCancelRequested(id, cancelFlag)) {
        permits.release();
        break;
      }
      final int index = i;
      final JsonNode params = job.params().get(i);
      try {
        itemExecutor.execute(
            () -> {
              try {
                outcomes.set(index, callItem(job, index, params));
                recordProgress(id, completed.incrementAndGet());
              } finally {
                permits.release();
              }
            });
      } catch (RuntimeException e) {
        permits.release();
        throw e;
      }
      dispatched++;
    }
    // wait for in-flight items
    permits.acquire(permitsTotal);
    permits.release(permitsTotal);

    boolean stoppedEarly = dispatched < total;
    List<BatchItemResult> items = new ArrayList<>(total);
    for (int i = 0; i < total; i++) {
      BatchItemResult outcome = outcomes.get(i);
      items.add(
          outcome != null
              ? outcome
              : BatchItemResult.failure(i, ItemError.cancelled(), clock.instant()));
    }
    JobResultRef ref = consolidate(id, items);

    store.update(
        id,
        current -> {
          if (stoppedEarly) {
            current.markCancelled(ref, clock.instant());
          } else {
            current.markCompleted(ref, clock.instant());
          }
          return current;
        });
    if (stoppedEarly) {
      log.info("Job {} cancelled after {} of {} item(s)", id, dispatched, total);
    } else {
      log.info("Job {} completed: {} item(s)", id, total);
    }
  }

  private JobResultRef consolidate(String id, List<BatchItemResult> items) {
    byte[] payload;
    try {
      payload = mapper.writeValueAsBytes(items);
    } catch (JsonProcessingException e) {
      throw new StoreException("Could not serialize results of job " + id, e);
    }
    if (payload.length <= limits.inlineMaxBytes()) {
      return JobResultRef.inline(items, payload.length);
    }
    StoredResult stored = results.put(id, payload, items.size());
    return JobResultRef.file(stored.reference(), stored.itemCount(), stored.byteSize());
  }

  private BatchItemResult callItem(BatchJob job, int index, JsonNode params) {
    try {
      UpstreamResponse response =
          upstream.execute(UpstreamRequest.of(job.endpoint(), job.method(), params));
      return BatchItemResult.success(index, response.body(), clock.instant());
    } catch (UpstreamException e) {
      log.debug("Job {} item {} failed: {}", job.id(), index, e.getMessage());
      Integer status = e.getStatusCode() > 0 ? e.getStatusCode() : null;
      return BatchItemResult.failure(
          index, new ItemError(e.getKind().name(), e.getMessage(), status), clock.instant());
    } catch (RuntimeException e) {
      log.warn("Job {} item {} failed unexpectedly", job.id(), index, e);
      return BatchItemResult.failure(
          index,
          new ItemError(ItemError.INTERNAL, ExceptionUtil.extractErrorMessage(e), null),
          clock.instant());
    }
  }

  private boolean isCancelRequested(String id, AtomicBoolean cancelFlag) {
    if (cancelFlag.get()) return true;
    boolean requested = store.get(id).map(BatchJob::cancelRequested).orElse(false);
    if (requested) cancelFlag.set(true);
    return requested;
  }

  private void recordProgress(String id, int completed) {
    try {
      store.update(
          id,
          current -> {
            current.recordProgress(completed);
            return current;
          });
    } catch (RuntimeException e) {
      log.warn("Could not record progress of job {}: {}", id, e.getMessage());
    }
  }

  private void fail(String id, Throwable cause) {
    String message = ExceptionUtil.extractErrorMessage(cause);
    log.error("Job {} failed: {}", id, ExceptionUtil.formatCompactStackTrace(cause));
    try {
      store.update(
          id,
          current -> {
            if (!current.isTerminal()) current.markFailed(message, clock.instant());
            return current;
          });
    } catch (RuntimeException e) {
      log.error("Could not record failure of job {}: {}", id, e.getMessage());
    }
  }

  /**
   * Sum of the row counts the parameter sets ask for. The first positive {@link #ROW_COUNT_FIELDS}
   * value of each set counts; the sum saturates at {@link Long#MAX_VALUE}.
   */
  static long expectedRows(List<JsonNode> params) {
    long sum = 0;
    for (JsonNode set : params) {
      if (set == null || !set.isObject()) continue;
      for (String field : ROW_COUNT_FIELDS) {
        long rows = rowCount(field, set.get(field));
        if (rows > 0) {
          sum = rows > Long.MAX_VALUE - sum ? Long.MAX_VALUE : sum + rows;
          break;
        }
      }
    }
    return sum;
  }

  /**
   * Row count of one field. Numbers and numeric strings are accepted; fractional or
   * out-of-range values count as {@link Long#MAX_VALUE}, zero and negatives as nothing.
   *
   * @throws ValidationException when the value is present but not numeric
   */
  static long rowCount(String field, JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) return 0;
    BigDecimal decimal;
    if (value.isNumber()) {
      decimal = value.decimalValue();
    } else if (value.isTextual()) {
      try {
        decimal = new BigDecimal(value.asText().trim());
      } catch (NumberFormatException e) {
        throw new ValidationException(
            "'" + field + "' must be a whole number, got: " + value.asText(), e);
      }
    } else {
      throw new ValidationException("'" + field + "' must be a whole number, got: " + value);
    }
    if (decimal.signum() <= 0) return 0;
    if (decimal.stripTrailingZeros().scale() > 0) return Long.MAX_VALUE;
    try {
      return decimal.longValueExact();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private static ThreadFactory named(String prefix) {
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  @Override
  public void close() {
    close(DEFAULT_DRAIN_TIMEOUT);
  }

  /**
   * Stop taking jobs from the queue and wait up to {@code drainTimeout} for running jobs to
   * finish. Jobs still running after that have their item calls and workers interrupted and end
   * FAILED. Jobs left in the queue stay QUEUED.
   */
  public synchronized void close(Duration drainTimeout) {
    if (!running.compareAndSet(true, false)) return;
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Jobs still running after {}, interrupting them", drainTimeout);
        itemExecutor.shutdownNow();
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
      itemExecutor.shutdown();
      itemExecutor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
      itemExecutor.shutdownNow();
    }
    log.info("Batch orchestrator stopped");
  }
}
