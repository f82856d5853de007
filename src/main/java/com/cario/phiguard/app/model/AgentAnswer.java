package com.cario.phiguard.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Raw terminal assistant message: its text plus the annotations the service attached to it. */
@Value
@Builder
public class AgentAnswer {
  String messageId;
  String text;
  @Singular List<UrlAnnotation> annotations;
}
