package com.gentoro.reportbatch.exception;

/** A submission or query was rejected before any work was created. */
public class ValidationException extends ReportBatchException {
  public ValidationException(String message) {
    super(ReportBatchErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(ReportBatchErrorCode.VALIDATION_ERROR, message, cause);
  }

  protected ValidationException(ReportBatchErrorCode code, String message) {
    super(code, message);
  }
}
