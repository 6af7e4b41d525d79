package com.gentoro.reportbatch;

import com.gentoro.reportbatch.exception.ConfigException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads {@code application.yaml} (from an explicit path or the classpath) and applies environment
 * variable overrides on top of it.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  /** Environment variable name to configuration key. */
  static final Map<String, String> ENV_OVERRIDES = new LinkedHashMap<>();

  static {
    ENV_OVERRIDES.put("HTTP_HOSTNAME", "http.hostname");
    ENV_OVERRIDES.put("HTTP_PORT", "http.port");
    ENV_OVERRIDES.put("UPSTREAM_BASE_URL", "upstream.baseUrl");
    ENV_OVERRIDES.put("UPSTREAM_URL", "upstream.url");
    ENV_OVERRIDES.put("UPSTREAM_TIMEOUT", "upstream.timeoutSeconds");
    ENV_OVERRIDES.put("REPORT_REMOTE_ALLOWLIST", "upstream.allowlist");
    // wins over REPORT_REMOTE_ALLOWLIST when both are set
    ENV_OVERRIDES.put("UPSTREAM_ALLOWLIST", "upstream.allowlist");
    ENV_OVERRIDES.put("BATCH_CONCURRENCY", "batch.concurrency");
    ENV_OVERRIDES.put("BATCH_ITEM_CONCURRENCY", "batch.itemConcurrency");
    ENV_OVERRIDES.put("BATCH_MAX_ITEMS", "batch.maxItems");
    ENV_OVERRIDES.put("REPORT_JOB_QUEUE_MAX_SIZE", "batch.queueMaxSize");
    ENV_OVERRIDES.put("BATCH_JOB_TTL_SECONDS", "batch.jobTtlSeconds");
    ENV_OVERRIDES.put("BATCH_RESULTS_TTL_SECONDS", "batch.resultsTtlSeconds");
    ENV_OVERRIDES.put("BATCH_INLINE_MAX_BYTES", "batch.inlineMaxBytes");
    ENV_OVERRIDES.put("BATCH_RESULTS_DIR", "batch.resultsDir");
    ENV_OVERRIDES.put("BATCH_POLL_INTERVAL_MS", "batch.pollIntervalMs");
    ENV_OVERRIDES.put("BATCH_SWEEP_INTERVAL_SECONDS", "batch.sweepIntervalSeconds");
    ENV_OVERRIDES.put("REPORT_MAX_RECORDS", "report.maxRecords");
    ENV_OVERRIDES.put("REPORT_FILTERS_CACHE_TTL", "report.filters.cacheTtlSeconds");
    ENV_OVERRIDES.put("REPORT_FILTERS_CACHE_MAX", "report.filters.cacheMaxEntries");
    ENV_OVERRIDES.put("REPORT_FILTERS_MAX_VALUES", "report.filters.maxValuesPerField");
    ENV_OVERRIDES.put("REDIS_URL", "redis.url");
  }

  private final YAMLConfiguration config;

  public ConfigurationProvider(Path configFile) {
    this(configFile, System.getenv());
  }

  public ConfigurationProvider(Path configFile, Map<String, String> environment) {
    this.config = load(configFile);
    applyEnvironment(environment);
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration load(Path configFile) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      if (configFile != null) {
        if (!Files.isRegularFile(configFile)) {
          throw new ConfigException("Configuration file not found: " + configFile);
        }
        log.info("Loading configuration from {}", configFile.toAbsolutePath());
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
          yaml.read(reader);
        }
        return yaml;
      }
      try (InputStream in =
          ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
        if (in == null) {
          log.warn("No {} on classpath, using built-in defaults", DEFAULT_RESOURCE);
          return yaml;
        }
        log.debug("Loading configuration from classpath:{}", DEFAULT_RESOURCE);
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
          yaml.read(reader);
        }
      }
      return yaml;
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Failed to read configuration", e);
    }
  }

  private void applyEnvironment(Map<String, String> environment) {
    if (environment == null) return;
    ENV_OVERRIDES.forEach(
        (env, key) -> {
          String value = environment.get(env);
          if (value != null) {
            log.debug("Configuration {} overridden by environment variable {}", key, env);
            config.setProperty(key, value);
          }
        });
  }
}
