package com.gentoro.reportbatch.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.reportbatch.exception.ErrorDetails;
import com.gentoro.reportbatch.exception.ExceptionUtil;
import com.gentoro.reportbatch.exception.ReportBatchException;
import com.gentoro.reportbatch.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/** Shared JSON writers for the servlets. */
final class JsonResponses {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(JsonResponses.class);

  static final ObjectMapper MAPPER = JacksonUtility.getJsonMapper();

  private JsonResponses() {}

  static void write(HttpServletResponse resp, int status, Object body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
    resp.getWriter().write(MAPPER.writeValueAsString(body));
  }

  static void writeRaw(HttpServletResponse resp, int status, byte[] json) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setContentLength(json.length);
    resp.getOutputStream().write(json);
  }

  /** Map an exception to its HTTP status and write {@code {"error": {...}}}. */
  static void writeError(HttpServletResponse resp, Throwable t) throws IOException {
    int status = 500;
    if (t instanceof ReportBatchException ex) {
      status = ex.getCode().httpStatus();
    }
    if (status >= 500) {
      log.error("Request failed: {}", ExceptionUtil.formatCompactStackTrace(t));
    } else {
      log.debug("Request rejected ({}): {}", status, t.getMessage());
    }
    ErrorDetails details = ExceptionUtil.toErrorDetails(t);
    ObjectNode node = MAPPER.createObjectNode();
    ObjectNode error = node.putObject("error");
    error.put("type", details.type());
    error.put("message", details.message());
    error.put("code", details.code().name());
    if (details.context() != null && !details.context().isEmpty()) {
      error.set("context", MAPPER.valueToTree(details.context()));
    }
    write(resp, status, node);
  }
}
