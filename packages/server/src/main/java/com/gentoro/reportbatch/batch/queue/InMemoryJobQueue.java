package com.gentoro.reportbatch.batch.queue;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/** In-process queue; pairs with the in-memory job store. */
public final class InMemoryJobQueue implements JobQueue {
  private final BlockingQueue<String> queue;

  public InMemoryJobQueue() {
    this(Integer.MAX_VALUE);
  }

  public InMemoryJobQueue(int capacity) {
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  @Override
  public boolean offer(String jobId) {
    return queue.offer(jobId);
  }

  @Override
  public Optional<String> poll(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  @Override
  public boolean remove(String jobId) {
    return queue.remove(jobId);
  }

  @Override
  public int size() {
    return queue.size();
  }
}
