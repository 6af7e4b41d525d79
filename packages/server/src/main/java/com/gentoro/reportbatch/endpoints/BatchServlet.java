package com.gentoro.reportbatch.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.reportbatch.batch.BatchJob;
import com.gentoro.reportbatch.batch.BatchJobStatus;
import com.gentoro.reportbatch.batch.BatchOrchestrator;
import com.gentoro.reportbatch.batch.BatchSubmission;
import com.gentoro.reportbatch.exception.ValidationException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch API.
 *
 * <ul>
 *   <li>POST /batch - submit; returns {@code {job_id, status}}
 *   <li>GET /batch/{id} - status, progress and results
 *   <li>GET /batch/{id}/results - item results as a JSON array
 *   <li>DELETE /batch/{id} - cancel
 * </ul>
 */
public final class BatchServlet extends HttpServlet {
  private final transient BatchOrchestrator orchestrator;

  public BatchServlet(BatchOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String path = req.getPathInfo();
    if (path != null && path.length() > 1) {
      resp.sendError(405, "POST is only supported on /batch");
      return;
    }
    try {
      String jobId = orchestrator.submit(parse(req.getInputStream().readAllBytes()));
      ObjectNode node = JsonResponses.MAPPER.createObjectNode();
      node.put("job_id", jobId);
      node.put("status", BatchJobStatus.QUEUED.wireName());
      JsonResponses.write(resp, 200, node);
    } catch (RuntimeException e) {
      JsonResponses.writeError(resp, e);
    }
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String[] parts = pathParts(req);
    if (parts == null) {
      resp.sendError(400, "Missing jobId");
      return;
    }
    try {
      if (parts.length == 1) {
        JsonResponses.write(resp, 200, orchestrator.view(parts[0]));
      } else if (parts.length == 2 && parts[1].equals("results")) {
        JsonResponses.writeRaw(resp, 200, orchestrator.readResultBytes(parts[0]));
      } else {
        resp.sendError(404, "Unknown path");
      }
    } catch (RuntimeException e) {
      JsonResponses.writeError(resp, e);
    }
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String[] parts = pathParts(req);
    if (parts == null || parts.length != 1) {
      resp.sendError(400, "Missing jobId");
      return;
    }
    try {
      BatchJob job = orchestrator.cancel(parts[0]);
      ObjectNode node = JsonResponses.MAPPER.createObjectNode();
      node.put("job_id", job.id());
      node.put("status", job.status().wireName());
      node.put("cancel_requested", job.cancelRequested());
      JsonResponses.write(resp, 202, node);
    } catch (RuntimeException e) {
      JsonResponses.writeError(resp, e);
    }
  }

  private static String[] pathParts(HttpServletRequest req) {
    String path = req.getPathInfo();
    if (path == null || path.length() <= 1) return null;
    return path.substring(1).split("/");
  }

  static BatchSubmission parse(byte[] body) {
    if (body.length == 0) {
      throw new ValidationException("Empty request body");
    }
    JsonNode root;
    try {
      root = JsonResponses.MAPPER.readTree(body);
    } catch (IOException e) {
      throw new ValidationException("Request body is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new ValidationException("Request body must be a JSON object");
    }
    JsonNode params = root.path("params");
    if (!params.isArray()) {
      throw new ValidationException("'params' must be an array of parameter objects");
    }
    List<JsonNode> sets = new ArrayList<>(params.size());
    for (JsonNode set : params) {
      if (!set.isObject()) {
        throw new ValidationException("Every parameter set must be a JSON object");
      }
      sets.add(set);
    }
    JsonNode source = root.path("sourceId");
    return new BatchSubmission(
        textOrNull(root.get("endpoint")),
        textOrNull(root.get("method")),
        source.isMissingNode() || source.isNull() ? null : source.asText(),
        sets,
        root.get("metadata"));
  }

  private static String textOrNull(JsonNode node) {
    return node == null || node.isNull() ? null : node.asText();
  }
}
