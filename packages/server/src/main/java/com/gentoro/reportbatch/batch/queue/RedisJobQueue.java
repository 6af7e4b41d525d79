package com.gentoro.reportbatch.batch.queue;

import com.gentoro.reportbatch.exception.StoreException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.redisson.api.RBlockingQueue;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;

/**
 * Redis blocking list shared between the submission process and worker processes. The capacity
 * check reads the list size before appending, so concurrent submitters may overshoot it by at
 * most one entry each.
 */
public final class RedisJobQueue implements JobQueue {
  private final RBlockingQueue<String> queue;
  private final int capacity;

  public RedisJobQueue(RedissonClient redissonClient, String queueName, int capacity) {
    this.queue = redissonClient.getBlockingQueue(queueName, StringCodec.INSTANCE);
    this.capacity = capacity;
  }

  @Override
  public boolean offer(String jobId) {
    try {
      if (queue.size() >= capacity) return false;
      if (!queue.offer(jobId)) {
        throw new StoreException("Job queue rejected " + jobId);
      }
      return true;
    } catch (RedisException e) {
      throw new StoreException("Redis unavailable while enqueueing job " + jobId, e);
    }
  }

  @Override
  public Optional<String> poll(Duration timeout) throws InterruptedException {
    try {
      return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    } catch (RedisException e) {
      throw new StoreException("Redis unavailable while polling job queue", e);
    }
  }

  @Override
  public boolean remove(String jobId) {
    try {
      return queue.remove(jobId);
    } catch (RedisException e) {
      throw new StoreException("Redis unavailable while removing job " + jobId, e);
    }
  }

  @Override
  public int size() {
    try {
      return queue.size();
    } catch (RedisException e) {
      throw new StoreException("Redis unavailable while reading job queue size", e);
    }
  }
}
