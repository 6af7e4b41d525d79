package com.gentoro.reportbatch.exception;

/** A component was used outside its lifecycle. */
public class StateException extends ReportBatchException {
  public StateException(String message) {
    super(ReportBatchErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(ReportBatchErrorCode.STATE_ERROR, message, cause);
  }
}
