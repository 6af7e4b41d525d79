package com.gentoro.reportbatch.exception;

/**
 * Unknown or expired job, result or cache entry. {@code gone} marks a record that existed but
 * has since expired or been swept.
 */
public class NotFoundException extends ReportBatchException {
  private final boolean gone;

  public NotFoundException(String message) {
    this(message, false);
  }

  public NotFoundException(String message, boolean gone) {
    super(gone ? ReportBatchErrorCode.GONE : ReportBatchErrorCode.NOT_FOUND, message);
    this.gone = gone;
  }

  public boolean isGone() {
    return gone;
  }
}
