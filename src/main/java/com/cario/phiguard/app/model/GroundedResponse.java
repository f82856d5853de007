package com.cario.phiguard.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Final answer handed back to the caller. */
@Value
@Builder
public class GroundedResponse {
  String answerText;
  @Singular List<Citation> citations;
  String threadId;
  String runId;
  boolean groundingUsed;
}
