package com.gentoro.reportbatch.batch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Outcome of one item, bound to the position of its parameter set in the submission. Exactly one
 * of {@code data} and {@code error} is present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchItemResult(
    @JsonProperty("index") int index,
    @JsonProperty("ok") boolean ok,
    @JsonProperty("data") JsonNode data,
    @JsonProperty("error") ItemError error,
    @JsonProperty("timestamp") Instant timestamp) {

  public static BatchItemResult success(int index, JsonNode data, Instant at) {
    return new BatchItemResult(index, true, data, null, at);
  }

  public static BatchItemResult failure(int index, ItemError error, Instant at) {
    return new BatchItemResult(index, false, null, error, at);
  }

  @JsonIgnore
  public boolean isCancelled() {
    return error != null && ItemError.CANCELLED.equals(error.type());
  }
}
