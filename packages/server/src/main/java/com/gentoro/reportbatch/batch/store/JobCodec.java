package com.gentoro.reportbatch.batch.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.reportbatch.batch.BatchJob;
import com.gentoro.reportbatch.exception.StoreException;
import com.gentoro.reportbatch.utility.JacksonUtility;

/** JSON form of a job record, shared by every store so both behave identically. */
final class JobCodec {
  private static final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  private JobCodec() {}

  static String encode(BatchJob job) {
    try {
      return mapper.writeValueAsString(job);
    } catch (JsonProcessingException e) {
      throw new StoreException("Could not serialize job " + job.id(), e);
    }
  }

  static BatchJob decode(String json) {
    try {
      return mapper.readValue(json, BatchJob.class);
    } catch (JsonProcessingException e) {
      throw new StoreException("Could not deserialize job record", e);
    }
  }
}
