package com.gentoro.reportbatch.batch;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A request to run one upstream endpoint once per parameter set. {@code endpoint} may be
 * relative (resolved against the upstream base URL), absolute (subject to the allowlist) or
 * blank (the configured default endpoint is used).
 */
public record BatchSubmission(
    String endpoint, String method, String sourceId, List<JsonNode> params, JsonNode metadata) {

  public BatchSubmission {
    params = params == null ? List.of() : List.copyOf(params);
  }
}
