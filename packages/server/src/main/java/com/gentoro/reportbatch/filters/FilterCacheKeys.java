package com.gentoro.reportbatch.filters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.reportbatch.exception.StoreException;
import com.gentoro.reportbatch.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives cache keys from a filter query signature: SHA-256 over the canonical (key-sorted) JSON
 * of template id, endpoint, method, request body and field.
 */
public final class FilterCacheKeys {
  private static final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  private FilterCacheKeys() {}

  public static String forField(FilterQuery query, String field) {
    Map<String, Object> signature = new LinkedHashMap<>();
    signature.put("templateId", query.templateId() == null ? "" : query.templateId());
    signature.put("endpoint", query.endpoint());
    signature.put("method", query.method());
    // convert to plain maps so ORDER_MAP_ENTRIES_BY_KEYS canonicalizes nested objects too
    signature.put("body", query.body() == null ? null : mapper.convertValue(query.body(), Object.class));
    signature.put("field", field);
    try {
      return sha256Hex(mapper.writeValueAsString(signature));
    } catch (JsonProcessingException e) {
      throw new StoreException("Could not serialize filter query signature", e);
    }
  }

  private static String sha256Hex(String value) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      StringBuilder sb = new StringBuilder();
      for (byte b : md.digest(value.getBytes(StandardCharsets.UTF_8))) {
        sb.append(String.format("%02x", b));
      }
      return sb.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
