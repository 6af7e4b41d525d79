package com.gentoro.reportbatch.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Root of the application's unchecked exception hierarchy. */
public class ReportBatchException extends RuntimeException {
  private final ReportBatchErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public ReportBatchException(ReportBatchErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ReportBatchException(ReportBatchErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ReportBatchErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic key/value; returns {@code this} for chaining. */
  public ReportBatchException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
