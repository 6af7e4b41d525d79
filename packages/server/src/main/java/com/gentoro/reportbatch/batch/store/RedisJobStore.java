package com.gentoro.reportbatch.batch.store;

import com.gentoro.reportbatch.batch.BatchJob;
import com.gentoro.reportbatch.exception.NotFoundException;
import com.gentoro.reportbatch.exception.StoreException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.redisson.api.RBucket;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;

/**
 * Redis-backed JobStore shared by every process. Each job is a string bucket holding its JSON
 * record, with the job TTL as the key expiry; Redis drops expired keys, so reads after the TTL
 * see nothing. {@link #update} is serialized through a per-job Redisson lock.
 *
 * <pre>
 * {prefix}job:{id}       = JSON record (TTL = job TTL)
 * {prefix}job:{id}:lock  = update lock
 * </pre>
 */
public final class RedisJobStore implements JobStore {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(RedisJobStore.class);

  static final long LOCK_WAIT_MS = 5_000;
  static final long LOCK_LEASE_MS = 30_000;

  private final RedissonClient redisson;
  private final String prefix;
  private final Duration ttl;

  public RedisJobStore(RedissonClient redisson, String prefix, Duration ttl) {
    this.redisson = redisson;
    this.prefix = prefix;
    this.ttl = ttl;
  }

  @Override
  public void put(BatchJob job) {
    String json = JobCodec.encode(job);
    try {
      bucket(job.id()).set(json, ttl);
    } catch (RedisException e) {
      throw new StoreException("Redis unavailable while writing job " + job.id(), e);
    }
  }

  @Override
  public Optional<BatchJob> get(String id) {
    String json;
    try {
      json = bucket(id).get();
    } catch (RedisException e) {
      throw new StoreException("Redis unavailable while reading job " + id, e);
    }
    return json == null ? Optional.empty() : Optional.of(JobCodec.decode(json));
  }

  @Override
  public void delete(String id) {
    try {
      bucket(id).delete();
    } catch (RedisException e) {
      throw new StoreException("Redis unavailable while deleting job " + id, e);
    }
  }

  @Override
  public BatchJob update(String id, UnaryOperator<BatchJob> mutator) {
    RLock lock = redisson.getLock(key(id) + ":lock");
    boolean locked;
    try {
      locked = lock.tryLock(LOCK_WAIT_MS, LOCK_LEASE_MS, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException("Interrupted while locking job " + id, e);
    } catch (RedisException e) {
      throw new StoreException("Redis unavailable while locking job " + id, e);
    }
    if (!locked) {
      throw new StoreException("Timed out waiting for lock on job " + id);
    }
    try {
      BatchJob current = get(id).orElseThrow(() -> new NotFoundException("Unknown job: " + id));
      BatchJob updated = mutator.apply(current);
      put(updated);
      return updated;
    } finally {
      try {
        lock.unlock();
      } catch (RedisException e) {
        // the lease expires on its own
        log.warn("Failed to release lock for job {}: {}", id, e.getMessage());
      }
    }
  }

  private RBucket<String> bucket(String id) {
    return redisson.getBucket(key(id), StringCodec.INSTANCE);
  }

  private String key(String id) {
    return prefix + "job:" + id;
  }
}
