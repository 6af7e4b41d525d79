package com.gentoro.reportbatch.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Pulls the record list out of an upstream report response. Accepted shapes, in order: {@code
 * {"result": {"records": [...]}}}, {@code {"data": {"records": [...]}}}, {@code {"records":
 * [...]}} and a bare JSON array. Anything else yields no records.
 */
public final class RecordExtractor {
  private RecordExtractor() {}

  public static List<JsonNode> records(JsonNode body) {
    if (body == null) return List.of();
    if (body.isArray()) return toList(body);
    if (!body.isObject()) return List.of();

    JsonNode container = body.get("result");
    if (container == null || container.isNull()) container = body.get("data");
    if (container == null || container.isNull()) container = body;
    if (container.isObject()) {
      JsonNode records = container.get("records");
      if (records != null && records.isArray()) return toList(records);
    }
    return List.of();
  }

  private static List<JsonNode> toList(JsonNode array) {
    List<JsonNode> out = new ArrayList<>(array.size());
    array.forEach(out::add);
    return out;
  }
}
