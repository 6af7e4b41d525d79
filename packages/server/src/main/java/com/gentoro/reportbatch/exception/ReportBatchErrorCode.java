package com.gentoro.reportbatch.exception;

/** Stable error codes exposed to API callers. */
public enum ReportBatchErrorCode {
  UNKNOWN(500),
  VALIDATION_ERROR(400),
  LIMIT_EXCEEDED(413),
  ALLOWLIST_DENIED(403),
  NOT_FOUND(404),
  GONE(410),
  UPSTREAM_ERROR(502),
  INTERNAL_ERROR(500),
  CONFIG_ERROR(500),
  NETWORK_ERROR(500),
  STATE_ERROR(500);

  private final int httpStatus;

  ReportBatchErrorCode(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
