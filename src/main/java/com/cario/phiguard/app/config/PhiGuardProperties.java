package com.cario.phiguard.app.config;

import com.cario.phiguard.app.model.PolicySettings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Raw {@code phiguard.*} settings bound from {@code application.yaml}.
 *
 * <p>The policy block is not used directly: {@link #toPolicySettings()} validates it once into an
 * immutable {@link PolicySettings} snapshot.
 */
@Data
@ConfigurationProperties(prefix = "phiguard")
public class PhiGuardProperties {

  private Policy policy = new Policy();
  private Detection detection = new Detection();
  private Agent agent = new Agent();
  private Direct direct = new Direct();

  public PolicySettings toPolicySettings() {
    return PolicySettings.of(
        policy.getMode(),
        policy.getConfidenceThreshold(),
        policy.getDomainFilter(),
        policy.getLanguage(),
        policy.isEnableGrounding());
  }

  @Data
  public static class Policy {
    /** redact | reject */
    private String mode = "redact";

    private double confidenceThreshold = 0.8;

    /** general | healthcare */
    private String domainFilter = "healthcare";

    private String language = "en";
    private boolean enableGrounding = true;
  }

  @Data
  public static class Detection {
    /** Azure AI Language endpoint, e.g. https://my-language.cognitiveservices.azure.com */
    private String endpoint;

    private String apiKey;
    private String apiVersion = "2023-04-01";
    private Duration timeout = Duration.ofSeconds(15);

    /** Domains the configured endpoint accepts. */
    private List<String> supportedDomains = new ArrayList<>(List.of("general", "healthcare"));
  }

  @Data
  public static class Agent {
    /** Foundry project endpoint, e.g. https://x.services.ai.azure.com/api/projects/demo */
    private String endpoint;

    /** Entra ID bearer token for the project. */
    private String bearerToken;

    private String apiVersion = "v1";

    /** When set, this agent is looked up instead of creating one. */
    private String existingAgentId;

    private String name = "HealthcareAssistant";
    private String model = "gpt-4o";

    /** Agent system instructions; set in application.yaml. */
    private String instructions;

    private String bingConnectionId;

    /** Appended to every submitted message; empty to disable. */
    private String searchHint =
        "Please search the web for current information to provide an accurate, up-to-date"
            + " response.";

    private Duration runTimeout = Duration.ofSeconds(60);
    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration requestTimeout = Duration.ofSeconds(30);
    private boolean deleteAgentOnShutdown = false;
  }

  @Data
  public static class Direct {
    /** Answer without grounding through the chat model when grounding is switched off. */
    private boolean enabled = false;

    /** System prompt for the chat model; set in application.yaml. */
    private String systemPrompt;
  }
}
