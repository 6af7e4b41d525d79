package com.gentoro.reportbatch.exception;

/**
 * A single upstream call failed. Batch items capture this on the item itself; it only reaches a
 * caller directly on synchronous read paths.
 */
public class UpstreamException extends ReportBatchException {

  /** Failure category of an upstream call. */
  public enum Kind {
    TIMEOUT,
    CONNECTION,
    HTTP_STATUS,
    IO
  }

  private final Kind kind;
  private final int statusCode;

  public UpstreamException(Kind kind, String message, Throwable cause) {
    this(kind, 0, message, cause);
  }

  public UpstreamException(Kind kind, int statusCode, String message, Throwable cause) {
    super(ReportBatchErrorCode.UPSTREAM_ERROR, message, cause);
    this.kind = kind;
    this.statusCode = statusCode;
    withContext("kind", kind.name());
    if (statusCode > 0) withContext("status", statusCode);
  }

  public Kind getKind() {
    return kind;
  }

  /** HTTP status for {@link Kind#HTTP_STATUS}; 0 otherwise. */
  public int getStatusCode() {
    return statusCode;
  }
}
