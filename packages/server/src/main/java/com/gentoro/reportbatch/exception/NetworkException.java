package com.gentoro.reportbatch.exception;

/** Failure binding or operating a network listener. */
public class NetworkException extends ReportBatchException {
  public NetworkException(String message) {
    super(ReportBatchErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(ReportBatchErrorCode.NETWORK_ERROR, message, cause);
  }
}
