package com.cario.phiguard.app.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of running one query through detection, redaction and the policy gate.
 *
 * <p>{@code hasPii} is true exactly when at least one entity survived filtering. When it is false
 * {@code redactedText} is the original text. {@code shouldReject} means the query must never be
 * sent to the grounded agent.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DetectionResult {

  String originalText;
  String redactedText;
  ResolvedEntitySet entities;
  PolicyDecision decision;

  public static DetectionResult of(
      String originalText,
      String redactedText,
      ResolvedEntitySet entities,
      PolicyDecision decision) {
    String redacted = entities.isEmpty() ? originalText : redactedText;
    return new DetectionResult(originalText, redacted, entities, decision);
  }

  public boolean isHasPii() {
    return !entities.isEmpty();
  }

  public boolean isShouldReject() {
    return decision == PolicyDecision.REJECT;
  }

  /**
   * Text allowed to cross into the grounded agent. Never the original text when entities were
   * detected.
   *
   * @throws IllegalStateException for a rejected query
   */
  public String forwardableText() {
    if (isShouldReject()) {
      throw new IllegalStateException("rejected query has no forwardable text");
    }
    return redactedText;
  }

  @Override
  public String toString() {
    // no query text in log output
    return "DetectionResult(entities="
        + entities
        + ", decision="
        + decision
        + ", length="
        + originalText.length()
        + ")";
  }
}
