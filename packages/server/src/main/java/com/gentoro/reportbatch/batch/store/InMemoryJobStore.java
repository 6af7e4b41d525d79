package com.gentoro.reportbatch.batch.store;

import com.gentoro.reportbatch.batch.BatchJob;
import com.gentoro.reportbatch.exception.NotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-process JobStore. Only valid when submission and workers share one JVM. Records are kept in
 * serialized form so callers never share mutable state with the store.
 */
public final class InMemoryJobStore implements JobStore {
  private final Map<String, Entry> map = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;

  private record Entry(String json, Instant expiresAt) {}

  public InMemoryJobStore(Duration ttl) {
    this(ttl, Clock.systemUTC());
  }

  public InMemoryJobStore(Duration ttl, Clock clock) {
    this.ttl = ttl;
    this.clock = clock;
  }

  @Override
  public void put(BatchJob job) {
    map.put(job.id(), entry(job));
  }

  @Override
  public Optional<BatchJob> get(String id) {
    Entry entry = map.get(id);
    if (entry == null) return Optional.empty();
    if (isExpired(entry)) {
      map.remove(id, entry);
      return Optional.empty();
    }
    return Optional.of(JobCodec.decode(entry.json()));
  }

  @Override
  public void delete(String id) {
    map.remove(id);
  }

  @Override
  public BatchJob update(String id, UnaryOperator<BatchJob> mutator) {
    Entry written =
        map.compute(
            id,
            (key, current) -> {
              if (current == null || isExpired(current)) {
                throw new NotFoundException("Unknown job: " + id);
              }
              return entry(mutator.apply(JobCodec.decode(current.json())));
            });
    return JobCodec.decode(written.json());
  }

  /** Number of held records, expired ones not yet purged included. */
  public int size() {
    return map.size();
  }

  /** Drop expired records; returns how many were removed. */
  public int purgeExpired() {
    int before = map.size();
    map.values().removeIf(this::isExpired);
    return before - map.size();
  }

  private Entry entry(BatchJob job) {
    return new Entry(JobCodec.encode(job), clock.instant().plus(ttl));
  }

  private boolean isExpired(Entry entry) {
    return !clock.instant().isBefore(entry.expiresAt());
  }
}
