package com.gentoro.reportbatch;

import com.gentoro.reportbatch.batch.BatchOrchestrator;
import com.gentoro.reportbatch.batch.results.ResultFileManager;
import com.gentoro.reportbatch.batch.store.JobBackends;
import com.gentoro.reportbatch.endpoints.ReportBatchServer;
import com.gentoro.reportbatch.exception.StateException;
import com.gentoro.reportbatch.filters.FilterCache;
import com.gentoro.reportbatch.filters.FilterOptionsService;
import com.gentoro.reportbatch.http.EmbeddedJettyServer;
import com.gentoro.reportbatch.http.OkHttpFactory;
import com.gentoro.reportbatch.maintenance.MaintenanceScheduler;
import com.gentoro.reportbatch.security.AllowlistValidator;
import com.gentoro.reportbatch.upstream.OkHttpUpstreamClient;
import com.gentoro.reportbatch.upstream.UpstreamClient;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application wiring and lifecycle. {@link #initialize()} builds every component from
 * configuration and starts the HTTP listener, the worker pool and the maintenance sweep; {@link
 * #shutdown()} stops them in reverse order.
 */
public class ReportBatch {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(ReportBatch.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ReportBatchSettings settings;
  private JobBackends backends;
  private BatchOrchestrator orchestrator;
  private MaintenanceScheduler maintenance;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public ReportBatch(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.reportbatch.logging.LoggingService.applyConfiguration(configuration());
    this.settings = ReportBatchSettings.from(configuration());

    AllowlistValidator validator =
        new AllowlistValidator(settings.upstreamBaseUrl(), settings.upstreamAllowlist());
    if (!validator.hasAllowlist()) {
      log.info("No upstream allowlist configured; absolute endpoints will be denied");
    }
    UpstreamClient upstream =
        new OkHttpUpstreamClient(OkHttpFactory.create(settings.upstreamTimeout()));
    ResultFileManager results =
        new ResultFileManager(settings.resultsDir(), settings.resultsTtl());
    FilterCache filterCache =
        new FilterCache(settings.filterCacheMaxEntries(), settings.filterCacheTtl());
    FilterOptionsService filterOptions =
        new FilterOptionsService(
            filterCache,
            validator,
            upstream,
            settings.upstreamDefaultUrl(),
            settings.maxRecords(),
            settings.filterMaxValuesPerField());

    this.backends = JobBackends.fromSettings(settings);
    this.orchestrator =
        new BatchOrchestrator(
            backends.store(),
            backends.queue(),
            validator,
            upstream,
            results,
            BatchOrchestrator.Limits.fromSettings(settings),
            Clock.systemUTC());
    this.maintenance =
        new MaintenanceScheduler(
            results, filterCache, backends.store(), settings.sweepInterval());

    this.httpServer =
        new EmbeddedJettyServer(
            configuration().getString("http.hostname", "0.0.0.0"),
            configuration().getInt("http.port", 8080));
    httpServer.prepare();
    new ReportBatchServer(httpServer, orchestrator, filterOptions).register();

    try {
      orchestrator.start();
      maintenance.start();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
  }

  /** Block until a shutdown signal (Ctrl+C, JVM termination) arrives, then release resources. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "report-batch-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down");
      try {
        closeQuietly(httpServer);
        closeQuietly(maintenance);
        closeQuietly(orchestrator);
        closeQuietly(backends);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Error while closing {}: {}", closeable.getClass().getSimpleName(), e.getMessage());
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("ReportBatch not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public ReportBatchSettings settings() {
    return settings;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public BatchOrchestrator orchestrator() {
    return orchestrator;
  }
}
