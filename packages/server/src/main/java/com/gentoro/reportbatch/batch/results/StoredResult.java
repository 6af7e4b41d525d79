package com.gentoro.reportbatch.batch.results;

/** Summary of a written result file; this, not the payload, goes into the job record. */
public record StoredResult(String reference, int itemCount, long byteSize) {}
