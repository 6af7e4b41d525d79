package com.gentoro.reportbatch.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is a {@link ReportBatchException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof ReportBatchException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        ReportBatchErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, top frames
   * first, joined with {@code " > "}.
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Short, user-facing message: the first non-blank message in the cause chain prefixed by the
   * top-level exception type, or just the type when no message exists.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    String className = t.getClass().getSimpleName();
    Throwable current = t;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        return className + ": " + message.trim();
      }
      current = current.getCause();
    }
    return className;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static ReportBatchException rethrowIfUnchecked(
      Throwable t, Function<Throwable, ReportBatchException> supplier) {
    if (t instanceof ReportBatchException) {
      return (ReportBatchException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
