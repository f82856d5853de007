package com.cario.phiguard.app.api;

import com.cario.phiguard.app.exception.GroundingException;
import com.cario.phiguard.app.exception.GroundingTimeoutException;
import com.cario.phiguard.app.exception.ThreadBusyException;
import com.cario.phiguard.app.model.DetectionResult;
import com.cario.phiguard.app.model.GroundedResponse;
import com.cario.phiguard.app.model.PolicySettings;
import com.cario.phiguard.app.service.DirectAnswerService;
import com.cario.phiguard.app.service.PrivacyGateway;
import com.cario.phiguard.app.util.CitationFormatUtils;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Log4j2
@Validated
@RestController
@RequestMapping("/phiguard")
@RequiredArgsConstructor
public class PhiGuardController {

  private final PrivacyGateway gateway;
  private final ObjectProvider<DirectAnswerService> directAnswerService;

  // ------------------------------------------------------------
  // /phiguard/detect
  // ------------------------------------------------------------
  @PostMapping(
      path = "/detect",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DetectResponse> detect(@RequestBody @Validated QueryRequest req) {
    PolicySettings settings = settingsFor(req);
    DetectionResult result = gateway.process(req.getQuery(), settings);
    return ResponseEntity.ok(detectResponse(result));
  }

  // ------------------------------------------------------------
  // /phiguard/query
  // ------------------------------------------------------------
  @PostMapping(
      path = "/query",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<QueryResponse> query(@RequestBody @Validated QueryRequest req) {
    PolicySettings settings = settingsFor(req);
    DetectionResult result = gateway.process(req.getQuery(), settings);
    QueryResponse.QueryResponseBuilder body =
        QueryResponse.builder()
            .detection(detectResponse(result))
            .rejected(result.isShouldReject());

    if (result.isShouldReject()) {
      log.info("phiguard.api.query rejected entities={}", result.getEntities().size());
      return ResponseEntity.unprocessableEntity().body(body.build());
    }

    try {
      GroundedResponse answer = answer(result, req.getThreadId(), settings);
      if (answer != null) {
        body.response(answer)
            .sourcesMarkdown(CitationFormatUtils.toMarkdown(answer.getCitations()));
      }
      return ResponseEntity.ok(body.build());

    } catch (GroundingException ex) {
      // detection result stays valid; return it alongside the agent failure
      return ResponseEntity.status(statusFor(ex)).body(body.error(ex.getMessage()).build());
    }
  }

  // ------------------------------------------------------------
  // /phiguard/threads/{threadId}
  // ------------------------------------------------------------
  @DeleteMapping(path = "/threads/{threadId}")
  public ResponseEntity<Void> resetThread(@PathVariable("threadId") @NotBlank String threadId) {
    gateway.resetConversation(threadId);
    return ResponseEntity.noContent().build();
  }

  private GroundedResponse answer(DetectionResult result, String threadId, PolicySettings s) {
    if (s.isEnableGrounding()) {
      return gateway.ground(result, threadId, s);
    }
    DirectAnswerService direct = directAnswerService.getIfAvailable();
    return direct == null ? null : direct.answer(result);
  }

  private PolicySettings settingsFor(QueryRequest req) {
    return gateway
        .defaults()
        .withOverrides(req.getMode(), req.getConfidenceThreshold(), req.getEnableGrounding());
  }

  private DetectResponse detectResponse(DetectionResult result) {
    Map<String, Integer> counts = result.getEntities().countByCategory();
    return DetectResponse.builder()
        .result(result)
        .entitySummary(counts)
        .entitySummaryText(CitationFormatUtils.formatEntitySummary(counts))
        .highlightedText(gateway.highlight(result))
        .build();
  }

  private static HttpStatus statusFor(GroundingException ex) {
    if (ex instanceof GroundingTimeoutException) return HttpStatus.GATEWAY_TIMEOUT;
    if (ex instanceof ThreadBusyException) return HttpStatus.CONFLICT;
    return HttpStatus.BAD_GATEWAY;
  }

  @Data
  public static class QueryRequest {
    @NotBlank private String query;

    /** Optional per-request policy overrides. */
    private String mode;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidenceThreshold;

    private Boolean enableGrounding;

    /** Thread to continue; omitted for a new conversation. */
    private String threadId;
  }

  @Data
  @Builder
  public static class DetectResponse {
    private DetectionResult result;
    private Map<String, Integer> entitySummary;
    private String entitySummaryText;
    private String highlightedText;
  }

  @Data
  @Builder
  public static class QueryResponse {
    private DetectResponse detection;
    private boolean rejected;
    private GroundedResponse response;
    private String sourcesMarkdown;
    private String error;
  }
}
