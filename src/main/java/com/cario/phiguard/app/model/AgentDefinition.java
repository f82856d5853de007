package com.cario.phiguard.app.model;

import lombok.Builder;
import lombok.Value;

/** Parameters used when the agent has to be created. */
@Value
@Builder
public class AgentDefinition {
  String name;
  String model;
  String instructions;

  /** Bing grounding connection; null creates an agent without the search tool. */
  String groundingConnectionId;

  boolean groundingEnabled;
}
