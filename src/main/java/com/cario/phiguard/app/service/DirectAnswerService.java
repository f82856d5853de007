package com.cario.phiguard.app.service;

import com.cario.phiguard.app.exception.GroundingException;
import com.cario.phiguard.app.exception.QueryRejectedException;
import com.cario.phiguard.app.model.DetectionResult;
import com.cario.phiguard.app.model.GroundedResponse;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Answers an approved query straight from the chat model, without web grounding.
 *
 * <p>Used when grounding is switched off. The response never carries citations.
 */
@Log4j2
public class DirectAnswerService {

  private final ChatClient chat;

  public DirectAnswerService(ChatClient chat) {
    this.chat = chat;
  }

  public GroundedResponse answer(DetectionResult result) {
    if (result.isShouldReject()) {
      throw new QueryRejectedException(result.getEntities().size());
    }
    String text = result.forwardableText();
    long t0 = System.nanoTime();
    String content;
    try {
      content = chat.prompt().user(text).call().content();
    } catch (RuntimeException e) {
      log.error("phiguard.direct.failed error={}", e.toString());
      throw new GroundingException("Chat model call failed: " + e.getMessage(), null, null, e);
    }
    if (content == null || content.isBlank()) {
      throw new GroundingException("Chat model returned an empty answer", null, null);
    }
    log.info(
        "phiguard.direct.done length={} answerLength={} durationMs={}",
        text.length(),
        content.length(),
        (System.nanoTime() - t0) / 1_000_000);
    return GroundedResponse.builder().answerText(content).groundingUsed(false).build();
  }
}
