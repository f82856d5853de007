package com.cario.phiguard.app.service;

import com.cario.phiguard.app.exception.ConfigurationException;
import com.cario.phiguard.app.exception.ConfigurationException.Reason;
import com.cario.phiguard.app.exception.ServiceException;
import com.cario.phiguard.app.model.DomainFilter;
import com.cario.phiguard.app.model.EntityCategory;
import com.cario.phiguard.app.model.PiiEntity;
import com.cario.phiguard.app.util.WebClientErrorUtils;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * {@link EntityDetector} backed by the Azure AI Language {@code :analyze-text} REST API
 * (PiiEntityRecognition task).
 *
 * <p>Offsets are requested as UTF-16 code units so they index directly into Java strings.
 */
@Log4j2
public class AzureLanguageEntityDetector implements EntityDetector {

  static final String SERVICE = "language";

  private final WebClient webClient;
  private final String apiVersion;
  private final Duration timeout;
  private final Set<DomainFilter> supportedDomains;

  /**
   * @param webClient client with base URL and subscription key header already applied
   */
  public AzureLanguageEntityDetector(
      WebClient webClient, String apiVersion, Duration timeout, Set<DomainFilter> supported) {
    this.webClient = webClient;
    this.apiVersion = apiVersion;
    this.timeout = timeout;
    this.supportedDomains =
        supported.isEmpty() ? EnumSet.noneOf(DomainFilter.class) : EnumSet.copyOf(supported);
  }

  @Override
  public List<PiiEntity> detect(String text, DomainFilter domainFilter, String language) {
    if (!supportedDomains.contains(domainFilter)) {
      throw new ConfigurationException(
          Reason.UNSUPPORTED_DOMAIN,
          "Domain filter " + domainFilter + " is not supported by the configured endpoint");
    }
    if (text.isEmpty()) {
      return List.of();
    }

    long t0 = System.nanoTime();
    JsonNode response = call(requestBody(text, domainFilter, language));
    List<PiiEntity> entities = parse(response, text);

    log.debug(
        "phiguard.detect.remote domain={} length={} candidates={} durationMs={}",
        domainFilter,
        text.length(),
        entities.size(),
        (System.nanoTime() - t0) / 1_000_000);
    return entities;
  }

  private Map<String, Object> requestBody(String text, DomainFilter domain, String language) {
    Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put("modelVersion", "latest");
    parameters.put("domain", domain.wireValue());
    parameters.put("stringIndexType", "Utf16CodeUnit");

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("id", "1");
    document.put("language", language);
    document.put("text", text);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("kind", "PiiEntityRecognition");
    body.put("parameters", parameters);
    body.put("analysisInput", Map.of("documents", List.of(document)));
    return body;
  }

  private JsonNode call(Map<String, Object> body) {
    try {
      JsonNode node =
          webClient
              .post()
              .uri(
                  b ->
                      b.path("/language/:analyze-text")
                          .queryParam("api-version", apiVersion)
                          .build())
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(body)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(timeout)
              .block();
      if (node == null) {
        throw new ServiceException(SERVICE, 200, false, "Empty response from detection service");
      }
      return node;
    } catch (RuntimeException e) {
      if (WebClientErrorUtils.statusOf(e) == 400) {
        String detail = WebClientErrorUtils.responseBody(e);
        Reason reason =
            detail.contains("omain") ? Reason.UNSUPPORTED_DOMAIN : Reason.REQUEST_REJECTED;
        throw new ConfigurationException(
            reason, "Detection endpoint rejected the request: " + abbreviate(detail), e);
      }
      throw WebClientErrorUtils.toServiceException(SERVICE, e);
    }
  }

  List<PiiEntity> parse(JsonNode response, String text) {
    JsonNode results = response.path("results");
    JsonNode errors = results.path("errors");
    if (errors.isArray() && !errors.isEmpty()) {
      JsonNode error = errors.get(0).path("error");
      String code = error.path("code").asText("");
      String message = error.path("message").asText("");
      log.error("phiguard.detect.error code={} message={}", code, message);
      if (code.contains("Domain") || message.contains("domain")) {
        throw new ConfigurationException(
            Reason.UNSUPPORTED_DOMAIN, "Detection rejected domain filter: " + message);
      }
      throw new ServiceException(SERVICE, 200, false, "PII detection failed: " + code);
    }

    JsonNode documents = results.path("documents");
    if (!documents.isArray() || documents.isEmpty()) {
      throw new ServiceException(SERVICE, 200, false, "Detection response has no document result");
    }

    List<PiiEntity> entities = new ArrayList<>();
    for (JsonNode e : documents.get(0).path("entities")) {
      entities.add(toEntity(e, text));
    }
    return entities;
  }

  private PiiEntity toEntity(JsonNode e, String text) {
    int offset = e.path("offset").asInt(-1);
    int length = e.path("length").asInt(-1);
    if (offset < 0 || length < 1 || offset + length > text.length()) {
      throw new ServiceException(
          SERVICE,
          200,
          false,
          "Detection returned span outside text: offset=" + offset + " length=" + length);
    }
    String subcategory = e.hasNonNull("subcategory") ? e.get("subcategory").asText() : null;
    try {
      return new PiiEntity(
          EntityCategory.of(e.path("category").asText("")),
          subcategory,
          text.substring(offset, offset + length),
          offset,
          length,
          e.path("confidenceScore").asDouble(-1));
    } catch (IllegalArgumentException ex) {
      throw new ServiceException(SERVICE, 200, false, "Malformed entity in detection response", ex);
    }
  }

  private static String abbreviate(String s) {
    return s.length() <= 300 ? s : s.substring(0, 300) + "...";
  }
}
