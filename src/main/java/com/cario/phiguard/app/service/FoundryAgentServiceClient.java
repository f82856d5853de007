package com.cario.phiguard.app.service;

import com.cario.phiguard.app.exception.ServiceException;
import com.cario.phiguard.app.model.AgentAnswer;
import com.cario.phiguard.app.model.AgentDefinition;
import com.cario.phiguard.app.model.AgentRun;
import com.cario.phiguard.app.model.RunStatus;
import com.cario.phiguard.app.model.UrlAnnotation;
import com.cario.phiguard.app.util.WebClientErrorUtils;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

/**
 * {@link AgentServiceClient} for the Azure AI Foundry Agents REST API.
 *
 * <p>The web client must carry the project endpoint as base URL and the authorization header.
 */
@Log4j2
public class FoundryAgentServiceClient implements AgentServiceClient {

  static final String SERVICE = "agents";

  private final WebClient webClient;
  private final String apiVersion;
  private final Duration requestTimeout;

  public FoundryAgentServiceClient(WebClient webClient, String apiVersion, Duration timeout) {
    this.webClient = webClient;
    this.apiVersion = apiVersion;
    this.requestTimeout = timeout;
  }

  @Override
  public String createAgent(AgentDefinition definition) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", definition.getModel());
    body.put("name", definition.getName());
    if (definition.getInstructions() != null) {
      body.put("instructions", definition.getInstructions());
    }
    if (definition.isGroundingEnabled()) {
      Map<String, Object> bing = new LinkedHashMap<>();
      if (definition.getGroundingConnectionId() != null) {
        bing.put(
            "search_configurations",
            List.of(Map.of("connection_id", definition.getGroundingConnectionId())));
      }
      body.put("tools", List.of(Map.of("type", "bing_grounding", "bing_grounding", bing)));
    }
    return requireId(post(b -> b.path("/assistants").build(), body), "agent");
  }

  @Override
  public String getAgent(String agentId) {
    return requireId(get(b -> b.path("/assistants/{id}").build(agentId)), "agent");
  }

  @Override
  public void deleteAgent(String agentId) {
    delete(b -> b.path("/assistants/{id}").build(agentId));
  }

  @Override
  public String createThread() {
    return requireId(post(b -> b.path("/threads").build(), Map.of()), "thread");
  }

  @Override
  public void getThread(String threadId) {
    requireId(get(b -> b.path("/threads/{id}").build(threadId)), "thread");
  }

  @Override
  public void deleteThread(String threadId) {
    delete(b -> b.path("/threads/{id}").build(threadId));
  }

  @Override
  public String createMessage(String threadId, String text) {
    Map<String, Object> body = Map.of("role", "user", "content", text);
    return requireId(post(b -> b.path("/threads/{id}/messages").build(threadId), body), "message");
  }

  @Override
  public AgentRun createRun(String threadId, String agentId) {
    Map<String, Object> body = Map.of("assistant_id", agentId);
    return toRun(post(b -> b.path("/threads/{id}/runs").build(threadId), body), threadId);
  }

  @Override
  public AgentRun getRun(String threadId, String runId) {
    return toRun(get(b -> b.path("/threads/{id}/runs/{run}").build(threadId, runId)), threadId);
  }

  @Override
  public AgentRun cancelRun(String threadId, String runId) {
    return toRun(
        post(b -> b.path("/threads/{id}/runs/{run}/cancel").build(threadId, runId), Map.of()),
        threadId);
  }

  @Override
  public Optional<AgentAnswer> latestAssistantMessage(String threadId, String runId) {
    JsonNode page =
        get(
            b ->
                b.path("/threads/{id}/messages")
                    .queryParam("order", "desc")
                    .queryParam("run_id", runId)
                    .build(threadId));
    for (JsonNode message : page.path("data")) {
      if ("assistant".equals(message.path("role").asText())) {
        return Optional.of(toAnswer(message));
      }
    }
    return Optional.empty();
  }

  // -------------------
  // Mapping
  // -------------------

  static AgentRun toRun(JsonNode node, String threadId) {
    String id = node.path("id").asText(null);
    String status = node.path("status").asText(null);
    if (id == null || status == null) {
      throw new ServiceException(SERVICE, 200, false, "Run response is missing id or status");
    }
    RunStatus parsed;
    try {
      parsed = RunStatus.fromWire(status);
    } catch (IllegalArgumentException e) {
      throw new ServiceException(SERVICE, 200, false, "Unknown run status '" + status + "'", e);
    }
    JsonNode lastError = node.path("last_error");
    return AgentRun.builder()
        .id(id)
        .threadId(node.path("thread_id").asText(threadId))
        .status(parsed)
        .lastErrorCode(lastError.isObject() ? lastError.path("code").asText(null) : null)
        .lastErrorMessage(lastError.isObject() ? lastError.path("message").asText(null) : null)
        .build();
  }

  static AgentAnswer toAnswer(JsonNode message) {
    StringBuilder text = new StringBuilder();
    AgentAnswer.AgentAnswerBuilder answer =
        AgentAnswer.builder().messageId(message.path("id").asText());
    for (JsonNode part : message.path("content")) {
      if (!"text".equals(part.path("type").asText())) continue;
      JsonNode textNode = part.path("text");
      // annotation indices are relative to their own part; shift them onto the joined text
      int base = text.length();
      text.append(textNode.path("value").asText(""));
      for (JsonNode a : textNode.path("annotations")) {
        JsonNode citation = a.path("url_citation");
        int start = a.path("start_index").asInt(-1);
        int end = a.path("end_index").asInt(-1);
        answer.annotation(
            UrlAnnotation.builder()
                .marker(a.path("text").asText(""))
                .url(citation.isObject() ? citation.path("url").asText(null) : null)
                .title(citation.isObject() ? citation.path("title").asText(null) : null)
                .startIndex(start < 0 ? -1 : base + start)
                .endIndex(end < 0 ? -1 : base + end)
                .build());
      }
    }
    return answer.text(text.toString()).build();
  }

  private static String requireId(JsonNode node, String what) {
    String id = node.path("id").asText(null);
    if (id == null || id.isBlank()) {
      throw new ServiceException(SERVICE, 200, false, "Response for " + what + " carries no id");
    }
    return id;
  }

  // -------------------
  // HTTP
  // -------------------

  private JsonNode get(Function<UriBuilder, URI> uri) {
    return exchange(webClient.get().uri(withVersion(uri)).retrieve().bodyToMono(JsonNode.class));
  }

  private JsonNode post(Function<UriBuilder, URI> uri, Object body) {
    return exchange(
        webClient
            .post()
            .uri(withVersion(uri))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class));
  }

  private void delete(Function<UriBuilder, URI> uri) {
    try {
      webClient
          .delete()
          .uri(withVersion(uri))
          .retrieve()
          .toBodilessEntity()
          .timeout(requestTimeout)
          .block();
    } catch (RuntimeException e) {
      throw WebClientErrorUtils.toServiceException(SERVICE, e);
    }
  }

  private Function<UriBuilder, URI> withVersion(Function<UriBuilder, URI> uri) {
    return b -> uri.apply(b.queryParam("api-version", apiVersion));
  }

  private JsonNode exchange(Mono<JsonNode> call) {
    try {
      JsonNode node = call.timeout(requestTimeout).block();
      if (node == null) {
        throw new ServiceException(SERVICE, 200, false, "Empty response from agent service");
      }
      return node;
    } catch (RuntimeException e) {
      log.warn("phiguard.agents.call.failed error={}", e.toString());
      throw WebClientErrorUtils.toServiceException(SERVICE, e);
    }
  }
}
