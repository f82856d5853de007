package com.cario.phiguard.app.service;

import static com.cario.phiguard.app.support.Entities.find;
import static org.junit.jupiter.api.Assertions.*;

import com.cario.phiguard.app.exception.ServiceException;
import com.cario.phiguard.app.model.DetectionResult;
import com.cario.phiguard.app.model.DomainFilter;
import com.cario.phiguard.app.model.PiiEntity;
import com.cario.phiguard.app.model.PolicyDecision;
import com.cario.phiguard.app.model.PolicySettings;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class PiiDetectionServiceTest {

  private static final String PATIENT = "Patient John Doe, MRN 12345, has diabetes.";

  private final AtomicReference<DomainFilter> seenDomain = new AtomicReference<>();

  private PiiDetectionService serviceReturning(List<PiiEntity> entities) {
    EntityDetector detector =
        (text, domain, language) -> {
          seenDomain.set(domain);
          return entities;
        };
    return new PiiDetectionService(
        detector, new SpanResolver(), new RedactionRenderer(), new PolicyDecisionEngine());
  }

  private static List<PiiEntity> patientEntities() {
    return List.of(
        find("Person", PATIENT, "John Doe", 0.98),
        find("MedicalRecordNumber", PATIENT, "12345", 0.90));
  }

  @Test
  void redactModeReplacesEntitiesAndForwards() {
    PolicySettings settings = PolicySettings.of("redact", 0.8, "healthcare", "en", true);

    DetectionResult result = serviceReturning(patientEntities()).process(PATIENT, settings);

    assertTrue(result.isHasPii());
    assertFalse(result.isShouldReject());
    assertEquals(PolicyDecision.FORWARD_REDACTED, result.getDecision());
    assertEquals(
        "Patient [PERSON], MRN [MEDICALRECORDNUMBER], has diabetes.", result.getRedactedText());
    assertEquals(PATIENT, result.getOriginalText());
    assertEquals(DomainFilter.HEALTHCARE, seenDomain.get());
  }

  @Test
  void rejectModeBlocksQueryWithEntities() {
    PolicySettings settings = PolicySettings.of("reject", 0.8, "healthcare", "en", true);

    DetectionResult result = serviceReturning(patientEntities()).process(PATIENT, settings);

    assertTrue(result.isShouldReject());
    assertEquals(2, result.getEntities().size());
    assertThrows(IllegalStateException.class, result::forwardableText);
  }

  @Test
  void cleanQueryPassesUnchanged() {
    String query = "What is the capital of France?";
    PolicySettings settings = PolicySettings.of("reject", 0.8, "general", "en", true);

    DetectionResult result = serviceReturning(List.of()).process(query, settings);

    assertFalse(result.isHasPii());
    assertFalse(result.isShouldReject());
    assertEquals(query, result.getRedactedText());
    assertEquals(query, result.forwardableText());
  }

  @Test
  void lowConfidenceEntityIsTreatedAsAbsent() {
    String query = "Call Jordan tomorrow";
    PolicySettings settings = PolicySettings.of("reject", 0.8, "general", "en", true);

    DetectionResult result =
        serviceReturning(List.of(find("Person", query, "Jordan", 0.62))).process(query, settings);

    assertFalse(result.isHasPii());
    assertFalse(result.isShouldReject());
    assertEquals(query, result.getRedactedText());
  }

  @Test
  void detectorFailurePropagatesWithoutResult() {
    EntityDetector failing =
        (text, domain, language) -> {
          throw new ServiceException("language", 401, false, "unauthorized");
        };
    PiiDetectionService service =
        new PiiDetectionService(
            failing, new SpanResolver(), new RedactionRenderer(), new PolicyDecisionEngine());

    ServiceException ex =
        assertThrows(
            ServiceException.class,
            () -> service.process(PATIENT, PolicySettings.of("redact", 0.8, "general", "en", true)));
    assertEquals(401, ex.getStatusCode());
  }

  @Test
  void highlightUsesOriginalText() {
    PolicySettings settings = PolicySettings.of("redact", 0.8, "healthcare", "en", true);
    PiiDetectionService service = serviceReturning(patientEntities());

    String highlighted = service.highlight(service.process(PATIENT, settings));

    assertEquals(
        "Patient **[John Doe](Person)**, MRN **[12345](MedicalRecordNumber)**, has diabetes.",
        highlighted);
  }
}
