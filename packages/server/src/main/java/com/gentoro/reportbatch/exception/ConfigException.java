package com.gentoro.reportbatch.exception;

/** Invalid or missing configuration. */
public class ConfigException extends ReportBatchException {
  public ConfigException(String message) {
    super(ReportBatchErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ReportBatchErrorCode.CONFIG_ERROR, message, cause);
  }
}
