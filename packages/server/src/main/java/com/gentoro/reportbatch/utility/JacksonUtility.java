package com.gentoro.reportbatch.utility;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared, pre-configured Jackson mappers. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER = createJsonMapper();

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  private static ObjectMapper createJsonMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    // canonical key order, cache keys depend on it
    mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    return mapper;
  }
}
