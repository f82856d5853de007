package com.cario.phiguard.app.exception;

import java.time.Duration;
import lombok.Getter;

/** The agent run did not reach a terminal state within the configured wait. */
@Getter
public class GroundingTimeoutException extends GroundingException {

  private final Duration timeout;

  public GroundingTimeoutException(String threadId, String runId, Duration timeout) {
    super(
        "Agent run " + runId + " on thread " + threadId + " did not finish within " + timeout,
        threadId,
        runId);
    this.timeout = timeout;
  }
}
