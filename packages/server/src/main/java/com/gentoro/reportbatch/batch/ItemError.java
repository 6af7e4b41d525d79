package com.gentoro.reportbatch.batch;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Failure detail attached to a single batch item. {@code type} is one of the upstream failure
 * kinds ({@code TIMEOUT}, {@code CONNECTION}, {@code HTTP_STATUS}, {@code IO}), {@code
 * CANCELLED} for items never dispatched because of cancellation, or {@code INTERNAL}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemError(String type, String message, Integer statusCode) {

  public static final String CANCELLED = "CANCELLED";
  public static final String INTERNAL = "INTERNAL";

  public static ItemError cancelled() {
    return new ItemError(CANCELLED, "Cancelled before dispatch", null);
  }
}
