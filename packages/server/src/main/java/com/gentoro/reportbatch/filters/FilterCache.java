package com.gentoro.reportbatch.filters;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Capacity- and TTL-bounded LRU cache of resolved filter value lists.
 *
 * <p>A single lock guards an access-ordered map, so recency updates on {@link #get} and the
 * eviction choice on {@link #put} are serialized and the entry count never exceeds {@code
 * maxEntries}. Expired entries read as misses and are dropped lazily or by {@link
 * #purgeExpired()}.
 */
public final class FilterCache {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(FilterCache.class);

  private final int maxEntries;
  private final Duration defaultTtl;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);

  public FilterCache(int maxEntries, Duration defaultTtl) {
    this(maxEntries, defaultTtl, Clock.systemUTC());
  }

  public FilterCache(int maxEntries, Duration defaultTtl, Clock clock) {
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive");
    }
    this.maxEntries = maxEntries;
    this.defaultTtl = defaultTtl;
    this.clock = clock;
  }

  public Optional<List<JsonNode>> get(String key) {
    return lookup(key).map(CacheEntry::values);
  }

  /** Live entry for {@code key}, with its metadata. Refreshes recency like {@link #get}. */
  public Optional<CacheEntry> lookup(String key) {
    if (key == null || key.isEmpty()) return Optional.empty();
    lock.lock();
    try {
      CacheEntry entry = entries.get(key);
      if (entry == null) return Optional.empty();
      if (entry.isExpired(clock.instant())) {
        entries.remove(key);
        return Optional.empty();
      }
      return Optional.of(entry);
    } finally {
      lock.unlock();
    }
  }

  public void put(String key, List<JsonNode> values) {
    put(key, values, false, defaultTtl);
  }

  public void put(String key, List<JsonNode> values, boolean truncated) {
    put(key, values, truncated, defaultTtl);
  }

  public void put(String key, List<JsonNode> values, Duration ttl) {
    put(key, values, false, ttl);
  }

  /**
   * Insert or replace an entry. Inserting a new key at capacity evicts exactly one entry, the
   * least recently used.
   */
  public void put(String key, List<JsonNode> values, boolean truncated, Duration ttl) {
    if (key == null || key.isEmpty()) return;
    Instant now = clock.instant();
    CacheEntry entry = new CacheEntry(key, values, truncated, now, now.plus(ttl));
    lock.lock();
    try {
      if (!entries.containsKey(key) && entries.size() >= maxEntries) {
        Iterator<Map.Entry<String, CacheEntry>> eldest = entries.entrySet().iterator();
        String evicted = eldest.next().getKey();
        eldest.remove();
        log.debug("Filter cache at capacity ({}), evicted {}", maxEntries, evicted);
      }
      entries.put(key, entry);
    } finally {
      lock.unlock();
    }
  }

  public void invalidate(String key) {
    lock.lock();
    try {
      entries.remove(key);
    } finally {
      lock.unlock();
    }
  }

  /** Drop every expired entry; returns how many were removed. */
  public int purgeExpired() {
    Instant now = clock.instant();
    lock.lock();
    try {
      int before = entries.size();
      entries.values().removeIf(e -> e.isExpired(now));
      return before - entries.size();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public int maxEntries() {
    return maxEntries;
  }

  public void clear() {
    lock.lock();
    try {
      entries.clear();
    } finally {
      lock.unlock();
    }
  }
}
