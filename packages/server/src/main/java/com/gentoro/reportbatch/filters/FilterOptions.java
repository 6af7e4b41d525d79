package com.gentoro.reportbatch.filters;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/**
 * Resolved filter values per field, with per-field metadata and truncation flags. Maps keep the
 * requested field order.
 */
public record FilterOptions(
    Map<String, List<JsonNode>> options,
    Map<String, FieldMeta> meta,
    Map<String, Boolean> truncated) {

  /** Whether a field was served from cache, and how many values it has. */
  public record FieldMeta(boolean cached, int count) {}
}
