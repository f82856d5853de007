package com.cario.phiguard.app.service;

import com.cario.phiguard.app.model.DetectionResult;
import com.cario.phiguard.app.model.PiiEntity;
import com.cario.phiguard.app.model.PolicyDecision;
import com.cario.phiguard.app.model.PolicySettings;
import com.cario.phiguard.app.model.ResolvedEntitySet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;

/**
 * Detection and redaction decision engine.
 *
 * <ol>
 *   <li>Ask the {@link EntityDetector} for candidate spans.
 *   <li>Filter by confidence and resolve overlaps with {@link SpanResolver}.
 *   <li>Render the redacted text with {@link RedactionRenderer}.
 *   <li>Apply the redact/reject gate with {@link PolicyDecisionEngine}.
 * </ol>
 *
 * Any failure aborts before a {@link DetectionResult} exists, so nothing can be forwarded on a
 * failed or partial detection.
 */
@Log4j2
public class PiiDetectionService {

  private final EntityDetector detector;
  private final SpanResolver spanResolver;
  private final RedactionRenderer renderer;
  private final PolicyDecisionEngine policyEngine;

  public PiiDetectionService(
      EntityDetector detector,
      SpanResolver spanResolver,
      RedactionRenderer renderer,
      PolicyDecisionEngine policyEngine) {
    this.detector = Objects.requireNonNull(detector);
    this.spanResolver = Objects.requireNonNull(spanResolver);
    this.renderer = Objects.requireNonNull(renderer);
    this.policyEngine = Objects.requireNonNull(policyEngine);
  }

  public DetectionResult process(String query, PolicySettings settings) {
    Objects.requireNonNull(query, "query");
    String reqId = UUID.randomUUID().toString();
    long t0 = System.nanoTime();

    log.info(
        "phiguard.detect.start id={} length={} mode={} threshold={} domain={}",
        reqId,
        query.length(),
        settings.getMode(),
        settings.getConfidenceThreshold(),
        settings.getDomainFilter());

    try {
      List<PiiEntity> raw =
          detector.detect(query, settings.getDomainFilter(), settings.getLanguage());
      ResolvedEntitySet entities = spanResolver.resolve(raw, settings.getConfidenceThreshold());
      String redacted = renderer.render(query, entities);
      PolicyDecision decision = policyEngine.decide(entities, settings.getMode());
      DetectionResult result = DetectionResult.of(query, redacted, entities, decision);

      log.info(
          "phiguard.detect.done id={} raw={} entities={} categories={} hasPii={} shouldReject={}"
              + " durationMs={}",
          reqId,
          raw.size(),
          entities.size(),
          entities.countByCategory(),
          result.isHasPii(),
          result.isShouldReject(),
          (System.nanoTime() - t0) / 1_000_000);
      return result;

    } catch (RuntimeException e) {
      log.error(
          "phiguard.detect.failed id={} durationMs={} error={}",
          reqId,
          (System.nanoTime() - t0) / 1_000_000,
          e.toString());
      throw e;
    }
  }

  /** Markdown highlighting of the detected entities, for display to the user. */
  public String highlight(DetectionResult result) {
    return renderer.highlight(result.getOriginalText(), result.getEntities());
  }
}
