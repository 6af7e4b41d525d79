package com.gentoro.reportbatch.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/** Status answer for a job as exposed over HTTP. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchJobView(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("status") String status,
    @JsonProperty("progress") Progress progress,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("error") String error,
    @JsonProperty("results") List<BatchItemResult> results,
    @JsonProperty("result_file") ResultFile resultFile) {

  public record Progress(@JsonProperty("total") int total, @JsonProperty("completed") int completed) {}

  public record ResultFile(
      @JsonProperty("reference") String reference,
      @JsonProperty("item_count") int itemCount,
      @JsonProperty("byte_size") long byteSize) {}

  public static BatchJobView from(BatchJob job) {
    JobResultRef ref = job.result();
    List<BatchItemResult> inline = null;
    ResultFile file = null;
    if (ref != null) {
      if (ref.isInline()) {
        inline = ref.items();
      } else {
        file = new ResultFile(ref.fileReference(), ref.itemCount(), ref.byteSize());
      }
    }
    return new BatchJobView(
        job.id(),
        job.status().wireName(),
        new Progress(job.itemCount(), job.completedItems()),
        job.createdAt(),
        job.startedAt(),
        job.completedAt(),
        job.error(),
        inline,
        file);
  }
}
