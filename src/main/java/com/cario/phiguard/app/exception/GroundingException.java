package com.cario.phiguard.app.exception;

import lombok.Getter;

/**
 * Detection and redaction succeeded but the grounded agent stage failed. The already computed
 * detection result stays valid and may still be shown to the user.
 */
@Getter
public class GroundingException extends PhiGuardException {

  /** Thread the failure happened on, when one was opened. */
  private final String threadId;

  /** Run that failed, when one was started. */
  private final String runId;

  public GroundingException(String message, String threadId, String runId) {
    super(message);
    this.threadId = threadId;
    this.runId = runId;
  }

  public GroundingException(String message, String threadId, String runId, Throwable cause) {
    super(message, cause);
    this.threadId = threadId;
    this.runId = runId;
  }
}
