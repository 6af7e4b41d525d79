package com.gentoro.reportbatch.exception;

import com.gentoro.reportbatch.security.DenyReason;

/** A remote destination was refused by the allowlist validator. */
public class AllowlistDeniedException extends ReportBatchException {
  private final DenyReason reason;

  public AllowlistDeniedException(DenyReason reason, String message) {
    super(ReportBatchErrorCode.ALLOWLIST_DENIED, message);
    this.reason = reason;
    withContext("reason", reason.name());
  }

  public DenyReason getReason() {
    return reason;
  }
}
