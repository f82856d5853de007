package com.cario.phiguard.app.model;

import java.time.Instant;
import lombok.Value;

/** Agent and thread a grounded exchange runs on. */
@Value
public class Conversation {
  String agentId;
  String threadId;
  Instant createdAt;
}
