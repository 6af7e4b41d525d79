package com.gentoro.reportbatch.upstream;

import com.fasterxml.jackson.databind.JsonNode;

/** Successful (2xx) upstream response. Non-JSON bodies are carried as a text node. */
public record UpstreamResponse(int statusCode, JsonNode body, long contentLength) {}
