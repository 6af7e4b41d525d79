package com.gentoro.reportbatch.batch.queue;

import java.time.Duration;
import java.util.Optional;

/** Pending set of job ids awaiting a worker, in submission order. */
public interface JobQueue {

  /** Append a job id; returns {@code false} when the queue is at capacity. */
  boolean offer(String jobId);

  /** Wait up to {@code timeout} for the next job id. */
  Optional<String> poll(Duration timeout) throws InterruptedException;

  /** Remove a still-pending id; returns {@code false} when a worker already took it. */
  boolean remove(String jobId);

  int size();
}
