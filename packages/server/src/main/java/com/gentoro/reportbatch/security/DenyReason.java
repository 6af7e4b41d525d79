package com.gentoro.reportbatch.security;

/** Why a remote destination was refused. */
public enum DenyReason {
  /** An absolute URL was given but no allowlist is configured. */
  NO_ALLOWLIST_CONFIGURED,
  /** The host does not match any allowlist entry. */
  NOT_ALLOWLISTED,
  /** The destination is loopback, link-local or in a private range. Never overridable. */
  PRIVATE_ADDRESS_BLOCKED
}
