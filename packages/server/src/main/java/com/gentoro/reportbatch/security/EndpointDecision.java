package com.gentoro.reportbatch.security;

/** Outcome of validating an endpoint designator: a resolved URL, or a deny reason. */
public record EndpointDecision(String url, DenyReason denyReason, String message) {

  public static EndpointDecision permit(String url) {
    return new EndpointDecision(url, null, null);
  }

  public static EndpointDecision deny(DenyReason reason, String message) {
    return new EndpointDecision(null, reason, message);
  }

  public boolean isPermitted() {
    return denyReason == null;
  }
}
