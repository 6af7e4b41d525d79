package com.gentoro.reportbatch.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportbatch.exception.ValidationException;
import com.gentoro.reportbatch.filters.FilterOptionsService;
import com.gentoro.reportbatch.filters.FilterQuery;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * POST /api/report/filters - distinct values of report filter fields.
 *
 * <p>Body: {@code {templateId, remoteSource: {endpoint, method, body}, fields: [..]}}. Returns
 * {@code {options, meta, truncated}}.
 */
public final class FilterOptionsServlet extends HttpServlet {
  private final transient FilterOptionsService service;

  public FilterOptionsServlet(FilterOptionsService service) {
    this.service = service;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    try {
      JsonResponses.write(resp, 200, service.resolve(parse(req.getInputStream().readAllBytes())));
    } catch (RuntimeException e) {
      JsonResponses.writeError(resp, e);
    }
  }

  static FilterQuery parse(byte[] body) {
    JsonNode root;
    try {
      root = body.length == 0 ? null : JsonResponses.MAPPER.readTree(body);
    } catch (IOException e) {
      throw new ValidationException("Request body is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new ValidationException("Request body must be a JSON object");
    }
    JsonNode source = root.path("remoteSource");
    if (!source.isObject()) source = root;

    List<String> fields = new ArrayList<>();
    JsonNode requested = root.path("fields");
    if (!requested.isArray()) {
      throw new ValidationException("'fields' must be an array of field keys");
    }
    requested.forEach(f -> fields.add(f.asText()));

    return new FilterQuery(
        root.path("templateId").asText(null),
        source.path("endpoint").asText(null),
        source.path("method").asText(null),
        source.get("body"),
        fields);
  }
}
