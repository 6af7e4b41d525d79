package com.gentoro.reportbatch;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Typed view over the recognized configuration options. Numeric values that do not parse, or
 * that are not positive, fall back to their defaults.
 */
public record ReportBatchSettings(
    String upstreamBaseUrl,
    String upstreamDefaultUrl,
    Duration upstreamTimeout,
    List<String> upstreamAllowlist,
    int batchConcurrency,
    int itemConcurrency,
    int maxItemsPerBatch,
    int queueMaxSize,
    Duration jobTtl,
    Duration resultsTtl,
    long inlineMaxBytes,
    Path resultsDir,
    Duration pollInterval,
    Duration sweepInterval,
    OptionalLong maxRecords,
    Duration filterCacheTtl,
    int filterCacheMaxEntries,
    int filterMaxValuesPerField,
    String redisUrl) {

  public static final long DEFAULT_INLINE_MAX_BYTES = 2L * 1024 * 1024;

  public static ReportBatchSettings from(Configuration c) {
    long jobTtlSeconds = positiveLong(c, "batch.jobTtlSeconds", 3600);
    return new ReportBatchSettings(
        trimToEmpty(c.getString("upstream.baseUrl", "")),
        trimToEmpty(c.getString("upstream.url", "")),
        Duration.ofMillis((long) (positiveDouble(c, "upstream.timeoutSeconds", 30.0) * 1000)),
        allowlist(c),
        (int) positiveLong(c, "batch.concurrency", 5),
        (int) positiveLong(c, "batch.itemConcurrency", 4),
        (int) positiveLong(c, "batch.maxItems", 100),
        (int) positiveLong(c, "batch.queueMaxSize", 100),
        Duration.ofSeconds(jobTtlSeconds),
        Duration.ofSeconds(positiveLong(c, "batch.resultsTtlSeconds", jobTtlSeconds)),
        positiveLong(c, "batch.inlineMaxBytes", DEFAULT_INLINE_MAX_BYTES),
        Path.of(StringUtils.defaultIfBlank(c.getString("batch.resultsDir"), "./batch_results")),
        Duration.ofMillis(positiveLong(c, "batch.pollIntervalMs", 200)),
        Duration.ofSeconds(positiveLong(c, "batch.sweepIntervalSeconds", 60)),
        optionalPositiveLong(c, "report.maxRecords"),
        Duration.ofSeconds(positiveLong(c, "report.filters.cacheTtlSeconds", 30)),
        (int) positiveLong(c, "report.filters.cacheMaxEntries", 20),
        (int) positiveLong(c, "report.filters.maxValuesPerField", 500),
        StringUtils.trimToNull(c.getString("redis.url")));
  }

  public boolean hasRedis() {
    return redisUrl != null;
  }

  private static String trimToEmpty(String s) {
    return StringUtils.trimToEmpty(s);
  }

  private static List<String> allowlist(Configuration c) {
    List<String> out = new ArrayList<>();
    for (String raw : c.getList(String.class, "upstream.allowlist", List.of())) {
      for (String part : StringUtils.split(StringUtils.defaultString(raw), ',')) {
        String entry = part.trim();
        if (!entry.isEmpty()) out.add(entry);
      }
    }
    return List.copyOf(out);
  }

  private static long positiveLong(Configuration c, String key, long defaultValue) {
    OptionalLong v = optionalPositiveLong(c, key);
    return v.isPresent() ? v.getAsLong() : defaultValue;
  }

  private static OptionalLong optionalPositiveLong(Configuration c, String key) {
    String raw = StringUtils.trimToNull(c.getString(key, null));
    if (raw == null) return OptionalLong.empty();
    try {
      long parsed = Long.parseLong(raw);
      return parsed > 0 ? OptionalLong.of(parsed) : OptionalLong.empty();
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }

  private static double positiveDouble(Configuration c, String key, double defaultValue) {
    String raw = StringUtils.trimToNull(c.getString(key, null));
    if (raw == null) return defaultValue;
    try {
      double parsed = Double.parseDouble(raw);
      return parsed > 0 ? parsed : defaultValue;
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }
}
