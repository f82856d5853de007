package com.cario.phiguard.app.model;

import java.util.Locale;

/** Status of an agent run as reported by the agent service. */
public enum RunStatus {
  QUEUED,
  IN_PROGRESS,
  REQUIRES_ACTION,
  CANCELLING,
  CANCELLED,
  FAILED,
  COMPLETED,
  EXPIRED,
  INCOMPLETE;

  public boolean isTerminal() {
    return switch (this) {
      case QUEUED, IN_PROGRESS, REQUIRES_ACTION, CANCELLING -> false;
      default -> true;
    };
  }

  public static RunStatus fromWire(String value) {
    if (value == null) {
      throw new IllegalArgumentException("run status is missing");
    }
    return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
