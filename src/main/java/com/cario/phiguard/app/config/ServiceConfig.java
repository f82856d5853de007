package com.cario.phiguard.app.config;

import com.cario.phiguard.app.exception.ConfigurationException;
import com.cario.phiguard.app.exception.ConfigurationException.Reason;
import com.cario.phiguard.app.model.AgentDefinition;
import com.cario.phiguard.app.model.DomainFilter;
import com.cario.phiguard.app.model.PolicySettings;
import com.cario.phiguard.app.service.*;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

@Log4j2
@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final PhiGuardProperties props;

  // -------------------
  // Policy
  // -------------------

  /** Validated once at startup; a bad policy block stops the application. */
  @Bean
  public PolicySettings policySettings() {
    PolicySettings settings = props.toPolicySettings();
    log.info(
        "phiguard.policy mode={} threshold={} domain={} language={} grounding={}",
        settings.getMode(),
        settings.getConfidenceThreshold(),
        settings.getDomainFilter(),
        settings.getLanguage(),
        settings.isEnableGrounding());
    return settings;
  }

  // -------------------
  // Detection
  // -------------------

  @Bean
  public EntityDetector entityDetector(WebClient.Builder builder) {
    PhiGuardProperties.Detection d = props.getDetection();
    require(d.getEndpoint(), Reason.MISSING_ENDPOINT, "phiguard.detection.endpoint");
    require(d.getApiKey(), Reason.MISSING_CREDENTIALS, "phiguard.detection.api-key");
    requirePositive(d.getTimeout(), "phiguard.detection.timeout");

    WebClient client =
        builder
            .clone()
            .baseUrl(stripSlash(d.getEndpoint()))
            .defaultHeader("Ocp-Apim-Subscription-Key", d.getApiKey())
            .build();
    return new AzureLanguageEntityDetector(
        client, d.getApiVersion(), d.getTimeout(), supportedDomains(d));
  }

  @Bean
  public PiiDetectionService piiDetectionService(EntityDetector entityDetector) {
    return new PiiDetectionService(
        entityDetector, new SpanResolver(), new RedactionRenderer(), new PolicyDecisionEngine());
  }

  // -------------------
  // Grounded agent
  // -------------------

  @Bean
  public AgentServiceClient agentServiceClient(WebClient.Builder builder) {
    PhiGuardProperties.Agent a = props.getAgent();
    require(a.getEndpoint(), Reason.MISSING_ENDPOINT, "phiguard.agent.endpoint");
    require(a.getBearerToken(), Reason.MISSING_CREDENTIALS, "phiguard.agent.bearer-token");
    requirePositive(a.getRequestTimeout(), "phiguard.agent.request-timeout");

    WebClient client =
        builder
            .clone()
            .baseUrl(stripSlash(a.getEndpoint()))
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + a.getBearerToken())
            .build();
    return new FoundryAgentServiceClient(client, a.getApiVersion(), a.getRequestTimeout());
  }

  @Bean
  public AgentContext agentContext(
      AgentServiceClient agentServiceClient, PolicySettings policySettings) {
    PhiGuardProperties.Agent a = props.getAgent();
    boolean grounding = policySettings.isEnableGrounding();
    if (grounding && (a.getBingConnectionId() == null || a.getBingConnectionId().isBlank())) {
      log.warn("phiguard.agent grounding enabled but no bing-connection-id configured");
    }
    AgentDefinition definition =
        AgentDefinition.builder()
            .name(a.getName())
            .model(a.getModel())
            .instructions(a.getInstructions())
            .groundingEnabled(grounding)
            .groundingConnectionId(blankToNull(a.getBingConnectionId()))
            .build();
    return new AgentContext(agentServiceClient, definition, a.getExistingAgentId());
  }

  @Bean
  public GroundedConversationOrchestrator groundedConversationOrchestrator(
      AgentServiceClient agentServiceClient, AgentContext agentContext) {
    PhiGuardProperties.Agent a = props.getAgent();
    requirePositive(a.getRunTimeout(), "phiguard.agent.run-timeout");
    requirePositive(a.getPollInterval(), "phiguard.agent.poll-interval");
    return new GroundedConversationOrchestrator(
        agentServiceClient,
        agentContext,
        new ThreadRunGuard(),
        new CitationExtractor(),
        a.getRunTimeout(),
        a.getPollInterval(),
        a.getSearchHint());
  }

  @Bean
  public PrivacyGateway privacyGateway(
      PiiDetectionService piiDetectionService,
      GroundedConversationOrchestrator orchestrator,
      PolicySettings policySettings) {
    return new PrivacyGateway(piiDetectionService, orchestrator, policySettings);
  }

  @Bean
  public AgentShutdownHook agentShutdownHook(AgentContext agentContext) {
    return new AgentShutdownHook(agentContext, props.getAgent().isDeleteAgentOnShutdown());
  }

  // -------------------
  // Helpers
  // -------------------

  private static Set<DomainFilter> supportedDomains(PhiGuardProperties.Detection d) {
    Set<DomainFilter> domains = EnumSet.noneOf(DomainFilter.class);
    for (String value : d.getSupportedDomains()) {
      DomainFilter f = DomainFilter.parse(value);
      if (f == null) {
        throw new ConfigurationException(
            Reason.UNSUPPORTED_DOMAIN, "Unknown domain in supported-domains: '" + value + "'");
      }
      domains.add(f);
    }
    return domains;
  }

  private static void require(String value, Reason reason, String property) {
    if (value == null || value.isBlank()) {
      throw new ConfigurationException(reason, property + " must be set");
    }
  }

  private static void requirePositive(Duration d, String property) {
    if (d == null || d.isNegative() || d.isZero()) {
      throw new ConfigurationException(Reason.INVALID_TIMEOUT, property + " must be positive");
    }
  }

  private static String stripSlash(String url) {
    String u = url.trim();
    return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s.trim();
  }
}
