package com.gentoro.reportbatch.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;
import java.util.Map;

/**
 * One call against the upstream report service. For body-carrying methods {@code payload} is
 * sent as the JSON body; otherwise its top-level scalar fields become query parameters.
 */
public record UpstreamRequest(
    String url, String method, JsonNode payload, Map<String, String> headers) {

  public UpstreamRequest {
    method = method == null || method.isBlank() ? "POST" : method.trim().toUpperCase(Locale.ROOT);
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public static UpstreamRequest of(String url, String method, JsonNode payload) {
    return new UpstreamRequest(url, method, payload, Map.of());
  }

  public boolean hasBody() {
    return method.equals("POST") || method.equals("PUT") || method.equals("PATCH");
  }
}
