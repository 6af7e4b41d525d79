package com.gentoro.reportbatch.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Job fixtures shared by batch tests. */
public final class TestJobs {
  private TestJobs() {}

  public static List<JsonNode> params(int count) {
    List<JsonNode> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      ObjectNode set = JsonNodeFactory.instance.objectNode();
      set.put("page", i);
      out.add(set);
    }
    return out;
  }

  public static BatchJob queued(String id, int items, Instant createdAt) {
    return new BatchJob(
        id, "https://reports.example.com/plan", "POST", "1161", params(items), null, createdAt);
  }
}
