package com.gentoro.reportbatch.exception;

/** Backing store unavailable or a record could not be (de)serialized. */
public class StoreException extends ReportBatchException {
  public StoreException(String message) {
    super(ReportBatchErrorCode.INTERNAL_ERROR, message);
  }

  public StoreException(String message, Throwable cause) {
    super(ReportBatchErrorCode.INTERNAL_ERROR, message, cause);
  }
}
