package com.gentoro.reportbatch.batch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportbatch.exception.StateException;
import java.time.Instant;
import java.util.List;

/**
 * Batch job record as persisted in the {@link com.gentoro.reportbatch.batch.store.JobStore}.
 *
 * <p>Identity and inputs are fixed at construction. Lifecycle fields are changed only through
 * the transition methods, which reject any move out of a terminal state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BatchJob {
  private final String id;
  private final String endpoint;
  private final String method;
  private final String sourceId;
  private final List<JsonNode> params;
  private final JsonNode metadata;
  private final Instant createdAt;

  @JsonProperty private BatchJobStatus status;
  @JsonProperty private Instant startedAt;
  @JsonProperty private Instant completedAt;
  @JsonProperty private int completedItems;
  @JsonProperty private boolean cancelRequested;
  @JsonProperty private JobResultRef result;
  @JsonProperty private String error;

  @JsonCreator
  public BatchJob(
      @JsonProperty("id") String id,
      @JsonProperty("endpoint") String endpoint,
      @JsonProperty("method") String method,
      @JsonProperty("sourceId") String sourceId,
      @JsonProperty("params") List<JsonNode> params,
      @JsonProperty("metadata") JsonNode metadata,
      @JsonProperty("createdAt") Instant createdAt) {
    this.id = id;
    this.endpoint = endpoint;
    this.method = method;
    this.sourceId = sourceId;
    this.params = params == null ? List.of() : List.copyOf(params);
    this.metadata = metadata;
    this.createdAt = createdAt;
    this.status = BatchJobStatus.QUEUED;
  }

  @JsonProperty("id")
  public String id() {
    return id;
  }

  @JsonProperty("endpoint")
  public String endpoint() {
    return endpoint;
  }

  @JsonProperty("method")
  public String method() {
    return method;
  }

  @JsonProperty("sourceId")
  public String sourceId() {
    return sourceId;
  }

  @JsonProperty("params")
  public List<JsonNode> params() {
    return params;
  }

  @JsonProperty("metadata")
  public JsonNode metadata() {
    return metadata;
  }

  @JsonProperty("createdAt")
  public Instant createdAt() {
    return createdAt;
  }

  public BatchJobStatus status() {
    return status;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public Instant completedAt() {
    return completedAt;
  }

  public int completedItems() {
    return completedItems;
  }

  public boolean cancelRequested() {
    return cancelRequested;
  }

  public JobResultRef result() {
    return result;
  }

  public String error() {
    return error;
  }

  @JsonIgnore
  public int itemCount() {
    return params.size();
  }

  @JsonIgnore
  public boolean isTerminal() {
    return status.isTerminal();
  }

  public void markRunning(Instant at) {
    transition(BatchJobStatus.RUNNING);
    this.startedAt = at;
  }

  public void markCompleted(JobResultRef result, Instant at) {
    transition(BatchJobStatus.COMPLETED);
    this.result = result;
    this.completedItems = itemCount();
    this.completedAt = at;
  }

  /** Cancelled job; {@code result} is {@code null} when nothing was ever dispatched. */
  public void markCancelled(JobResultRef result, Instant at) {
    transition(BatchJobStatus.CANCELLED);
    this.cancelRequested = true;
    this.result = result;
    this.completedAt = at;
  }

  public void markFailed(String error, Instant at) {
    transition(BatchJobStatus.FAILED);
    this.error = error;
    this.completedAt = at;
  }

  public void requestCancel() {
    if (!isTerminal()) this.cancelRequested = true;
  }

  public void recordProgress(int completed) {
    if (!isTerminal() && completed > completedItems) {
      this.completedItems = Math.min(completed, itemCount());
    }
  }

  private void transition(BatchJobStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new StateException("Job %s cannot move from %s to %s".formatted(id, status, next));
    }
    this.status = next;
  }
}
