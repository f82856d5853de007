package com.cario.phiguard.app.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AgentRun {
  String id;
  String threadId;
  RunStatus status;

  /** Error code reported with a failed run, e.g. {@code server_error} or {@code tool_error}. */
  String lastErrorCode;

  String lastErrorMessage;
}
