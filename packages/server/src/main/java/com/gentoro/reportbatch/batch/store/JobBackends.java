package com.gentoro.reportbatch.batch.store;

import com.gentoro.reportbatch.ReportBatchSettings;
import com.gentoro.reportbatch.batch.queue.InMemoryJobQueue;
import com.gentoro.reportbatch.batch.queue.JobQueue;
import com.gentoro.reportbatch.batch.queue.RedisJobQueue;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

/**
 * Job store and queue pair chosen by configuration: Redis when {@code redis.url} is set,
 * otherwise the in-process variants. Owns the Redis client and closes it.
 */
public final class JobBackends implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(JobBackends.class);

  static final String KEY_PREFIX = "report-batch:";

  private final JobStore store;
  private final JobQueue queue;
  private final RedissonClient redisson;

  public JobBackends(JobStore store, JobQueue queue) {
    this(store, queue, null);
  }

  private JobBackends(JobStore store, JobQueue queue, RedissonClient redisson) {
    this.store = store;
    this.queue = queue;
    this.redisson = redisson;
  }

  public static JobBackends fromSettings(ReportBatchSettings settings) {
    if (!settings.hasRedis()) {
      log.info("No redis.url configured, using in-process job store and queue");
      return new JobBackends(
          new InMemoryJobStore(settings.jobTtl()), new InMemoryJobQueue(settings.queueMaxSize()));
    }
    Config config = new Config();
    config.useSingleServer().setAddress(settings.redisUrl());
    RedissonClient client = Redisson.create(config);
    log.info("Using Redis job store and queue at {}", settings.redisUrl());
    return new JobBackends(
        new RedisJobStore(client, KEY_PREFIX, settings.jobTtl()),
        new RedisJobQueue(client, KEY_PREFIX + "queue", settings.queueMaxSize()),
        client);
  }

  public JobStore store() {
    return store;
  }

  public JobQueue queue() {
    return queue;
  }

  @Override
  public void close() {
    if (redisson != null) {
      redisson.shutdown();
    }
  }
}
