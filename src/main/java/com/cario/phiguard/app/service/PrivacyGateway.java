package com.cario.phiguard.app.service;

import com.cario.phiguard.app.exception.ConfigurationException;
import com.cario.phiguard.app.exception.ConfigurationException.Reason;
import com.cario.phiguard.app.exception.QueryRejectedException;
import com.cario.phiguard.app.model.DetectionResult;
import com.cario.phiguard.app.model.GroundedResponse;
import com.cario.phiguard.app.model.PolicySettings;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Entry point for callers: {@link #process} runs detection and the policy gate, {@link #ground}
 * forwards an approved result to the grounded agent.
 *
 * <p>A rejected result never reaches the orchestrator, and in redact mode only the redacted text
 * does. Each call works on one immutable {@link PolicySettings} snapshot.
 */
@Log4j2
public class PrivacyGateway {

  private final PiiDetectionService detectionService;
  private final GroundedConversationOrchestrator orchestrator;
  private final PolicySettings defaults;

  public PrivacyGateway(
      PiiDetectionService detectionService,
      GroundedConversationOrchestrator orchestrator,
      PolicySettings defaults) {
    this.detectionService = Objects.requireNonNull(detectionService);
    this.orchestrator = Objects.requireNonNull(orchestrator);
    this.defaults = Objects.requireNonNull(defaults);
  }

  public PolicySettings defaults() {
    return defaults;
  }

  public DetectionResult process(String query) {
    return process(query, defaults);
  }

  public DetectionResult process(String query, PolicySettings settings) {
    return detectionService.process(query, settings);
  }

  public GroundedResponse ground(DetectionResult result, String threadId) {
    return ground(result, threadId, defaults);
  }

  /**
   * @throws QueryRejectedException if the result was rejected by policy
   * @throws ConfigurationException if grounding is disabled in {@code settings}
   * @throws com.cario.phiguard.app.exception.GroundingException if the agent stage fails
   */
  public GroundedResponse ground(DetectionResult result, String threadId, PolicySettings settings) {
    if (result.isShouldReject()) {
      log.warn("phiguard.ground.blocked entities={}", result.getEntities().size());
      throw new QueryRejectedException(result.getEntities().size());
    }
    if (!settings.isEnableGrounding()) {
      throw new ConfigurationException(Reason.GROUNDING_DISABLED, "Web grounding is disabled");
    }
    return orchestrator.ground(result.forwardableText(), blankToNull(threadId));
  }

  public String highlight(DetectionResult result) {
    return detectionService.highlight(result);
  }

  public void resetConversation(String threadId) {
    orchestrator.resetConversation(threadId);
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s.trim();
  }
}
