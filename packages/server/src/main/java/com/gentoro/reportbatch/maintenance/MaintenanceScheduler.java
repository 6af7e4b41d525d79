package com.gentoro.reportbatch.maintenance;

import com.gentoro.reportbatch.batch.results.ResultFileManager;
import com.gentoro.reportbatch.batch.store.InMemoryJobStore;
import com.gentoro.reportbatch.batch.store.JobStore;
import com.gentoro.reportbatch.exception.ExceptionUtil;
import com.gentoro.reportbatch.filters.FilterCache;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic cleanup owned by the application lifecycle. Deletes expired result files and purges
 * expired filter-cache entries, plus expired in-process job records (Redis expires its own).
 * {@link #close()} cancels the task and stops its thread.
 */
public final class MaintenanceScheduler implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(MaintenanceScheduler.class);

  private final ResultFileManager results;
  private final FilterCache filterCache;
  private final JobStore jobStore;
  private final Duration interval;
  private final ScheduledExecutorService executor;
  private ScheduledFuture<?> task;

  public MaintenanceScheduler(
      ResultFileManager results, FilterCache filterCache, JobStore jobStore, Duration interval) {
    this.results = results;
    this.filterCache = filterCache;
    this.jobStore = jobStore;
    this.interval = interval;
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "maintenance-sweep");
              t.setDaemon(true);
              return t;
            });
  }

  public synchronized void start() {
    if (task != null) return;
    long millis = interval.toMillis();
    task = executor.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Maintenance sweep scheduled every {}s", interval.toSeconds());
  }

  /** One sweep pass. A failure is logged and the next pass still runs. */
  public void runOnce() {
    try {
      int files = results.sweep();
      int entries = filterCache.purgeExpired();
      int jobs = jobStore instanceof InMemoryJobStore mem ? mem.purgeExpired() : 0;
      log.debug(
          "Sweep removed {} result file(s), {} cache entr(ies), {} job(s)", files, entries, jobs);
    } catch (RuntimeException e) {
      log.error("Maintenance sweep failed: {}", ExceptionUtil.formatCompactStackTrace(e));
    }
  }

  public synchronized boolean isScheduled() {
    return task != null && !task.isCancelled();
  }

  @Override
  public synchronized void close() {
    if (task != null) {
      task.cancel(false);
    }
    executor.shutdownNow();
  }
}
