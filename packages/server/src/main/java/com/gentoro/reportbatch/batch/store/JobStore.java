package com.gentoro.reportbatch.batch.store;

import com.gentoro.reportbatch.batch.BatchJob;
import com.gentoro.reportbatch.exception.NotFoundException;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * TTL-governed storage of batch job records. A record whose TTL has elapsed is absent: {@link
 * #get} never returns it, stale or otherwise. Implementations are safe for concurrent use.
 */
public interface JobStore {

  /** Insert or replace the record and restart its TTL. */
  void put(BatchJob job);

  Optional<BatchJob> get(String id);

  void delete(String id);

  /**
   * Atomically read, modify and write back a record, restarting its TTL. Concurrent updates of
   * the same id are serialized.
   *
   * @return the record as written
   * @throws NotFoundException when the record is unknown or expired
   */
  BatchJob update(String id, UnaryOperator<BatchJob> mutator);
}
