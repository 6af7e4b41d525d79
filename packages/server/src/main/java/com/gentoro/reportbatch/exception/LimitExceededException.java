package com.gentoro.reportbatch.exception;

/** A configured volume limit (items per batch, record ceiling) was exceeded. */
public class LimitExceededException extends ValidationException {
  private final String limitName;
  private final long actual;
  private final long limit;

  public LimitExceededException(String limitName, long actual, long limit) {
    super(
        ReportBatchErrorCode.LIMIT_EXCEEDED,
        "%s exceeded: %d > %d".formatted(limitName, actual, limit));
    this.limitName = limitName;
    this.actual = actual;
    this.limit = limit;
    withContext("limit", limitName).withContext("actual", actual).withContext("max", limit);
  }

  public String getLimitName() {
    return limitName;
  }

  public long getActual() {
    return actual;
  }

  public long getLimit() {
    return limit;
  }
}
