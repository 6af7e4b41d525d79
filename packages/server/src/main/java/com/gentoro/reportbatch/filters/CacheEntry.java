package com.gentoro.reportbatch.filters;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;

/**
 * A cached list of permissible filter values. {@code truncated} records whether the list was cut
 * at the per-field value cap when it was computed.
 */
public record CacheEntry(
    String key, List<JsonNode> values, boolean truncated, Instant insertedAt, Instant expiresAt) {

  public CacheEntry {
    values = List.copyOf(values);
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
