package com.gentoro.reportbatch.batch;

/** Lifecycle of a batch job. Transitions only move forward; terminal states are final. */
public enum BatchJobStatus {
  /** Accepted and waiting for a worker. */
  QUEUED,
  /** At least one item has been dispatched. */
  RUNNING,
  /** Every item has a recorded outcome. */
  COMPLETED,
  /** Orchestration failed before or outside item execution. */
  FAILED,
  /** Cancelled by request. */
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public boolean canTransitionTo(BatchJobStatus next) {
    return switch (this) {
      case QUEUED -> next == RUNNING || next == FAILED || next == CANCELLED;
      case RUNNING -> next == COMPLETED || next == FAILED || next == CANCELLED;
      case COMPLETED, FAILED, CANCELLED -> false;
    };
  }

  /** Lower-case wire name. */
  public String wireName() {
    return name().toLowerCase(java.util.Locale.ROOT);
  }
}
