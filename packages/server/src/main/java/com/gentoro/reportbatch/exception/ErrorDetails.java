package com.gentoro.reportbatch.exception;

import java.time.Instant;
import java.util.Map;

/** Structured error information suitable for logs and API responses. */
public record ErrorDetails(
    String type,
    String message,
    ReportBatchErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
