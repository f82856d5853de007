package com.cario.phiguard.app.config;

import com.cario.phiguard.app.service.DirectAnswerService;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chat model wiring for the ungrounded answer path.
 *
 * <p>Spring AI autoconfigures the {@link OpenAiChatModel} from {@code spring.ai.openai.*} in
 * application.yaml. The {@link DirectAnswerService} only exists when {@code
 * phiguard.direct.enabled=true}.
 */
@Configuration
public class ChatGptConfig {

  @Bean
  public ChatClient.Builder chatClientBuilder(OpenAiChatModel openAiChatModel) {
    return ChatClient.builder(openAiChatModel);
  }

  @Bean
  @ConditionalOnProperty(prefix = "phiguard.direct", name = "enabled", havingValue = "true")
  public DirectAnswerService directAnswerService(
      ChatClient.Builder chatClientBuilder, PhiGuardProperties props) {
    String systemPrompt = props.getDirect().getSystemPrompt();
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      chatClientBuilder = chatClientBuilder.defaultSystem(systemPrompt);
    }
    return new DirectAnswerService(chatClientBuilder.build());
  }
}
