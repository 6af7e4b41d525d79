package com.gentoro.reportbatch.filters;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** A filter-value lookup: which fields to enumerate from which remote report source. */
public record FilterQuery(
    String templateId, String endpoint, String method, JsonNode body, List<String> fields) {

  public FilterQuery {
    fields = fields == null ? List.of() : List.copyOf(fields);
  }
}
