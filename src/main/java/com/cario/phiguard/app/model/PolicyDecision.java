package com.cario.phiguard.app.model;

/** Outcome of the policy gate for one query. */
public enum PolicyDecision {
  /** Nothing detected; the original text is forwarded as is. */
  FORWARD,
  /** Entities detected in redact mode; only the redacted text is forwarded. */
  FORWARD_REDACTED,
  /** Entities detected in reject mode; nothing is forwarded. */
  REJECT;

  public boolean isForwarded() {
    return this != REJECT;
  }
}
