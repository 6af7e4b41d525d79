package com.gentoro.reportbatch.batch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Where a terminal job's results live: inline in the job record, or in a result file of which
 * only the reference and summary are kept.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResultRef(
    @JsonProperty("items") List<BatchItemResult> items,
    @JsonProperty("file") String fileReference,
    @JsonProperty("itemCount") int itemCount,
    @JsonProperty("byteSize") long byteSize) {

  public static JobResultRef inline(List<BatchItemResult> items, long byteSize) {
    return new JobResultRef(List.copyOf(items), null, items.size(), byteSize);
  }

  public static JobResultRef file(String reference, int itemCount, long byteSize) {
    return new JobResultRef(null, reference, itemCount, byteSize);
  }

  @JsonIgnore
  public boolean isInline() {
    return fileReference == null;
  }
}
