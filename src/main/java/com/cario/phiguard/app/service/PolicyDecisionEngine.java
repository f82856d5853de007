package com.cario.phiguard.app.service;

import com.cario.phiguard.app.model.PolicyDecision;
import com.cario.phiguard.app.model.PolicyMode;
import com.cario.phiguard.app.model.ResolvedEntitySet;

/** Stateless redact/reject gate, evaluated once per query. */
public class PolicyDecisionEngine {

  public PolicyDecision decide(ResolvedEntitySet entities, PolicyMode mode) {
    if (entities.isEmpty()) {
      return PolicyDecision.FORWARD;
    }
    return mode == PolicyMode.REJECT ? PolicyDecision.REJECT : PolicyDecision.FORWARD_REDACTED;
  }
}
