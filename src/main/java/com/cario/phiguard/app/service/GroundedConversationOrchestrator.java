package com.cario.phiguard.app.service;

import com.cario.phiguard.app.exception.GroundingException;
import com.cario.phiguard.app.exception.GroundingTimeoutException;
import com.cario.phiguard.app.exception.ServiceException;
import com.cario.phiguard.app.model.AgentAnswer;
import com.cario.phiguard.app.model.AgentRun;
import com.cario.phiguard.app.model.Conversation;
import com.cario.phiguard.app.model.ConversationState;
import com.cario.phiguard.app.model.ExtractedAnswer;
import com.cario.phiguard.app.model.GroundedResponse;
import com.cario.phiguard.app.model.RunStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;

/**
 * Drives one grounded exchange with the hosted agent.
 *
 * <pre>
 *   IDLE -> AGENT_READY -> THREAD_OPEN -> MESSAGE_SUBMITTED -> RUNNING -> COMPLETED
 *                                                     (any step) -> FAILED
 * </pre>
 *
 * <p>The agent comes from the shared {@link AgentContext}. A new thread is opened per call unless
 * the caller continues an existing one. The run is polled until it is terminal or the run timeout
 * elapses; a timed out run is cancelled and reported as {@link GroundingTimeoutException}. Every
 * failure after the detection stage surfaces as a {@link GroundingException}.
 *
 * <p>This class only ever sees text the privacy gate already approved.
 */
@Log4j2
public class GroundedConversationOrchestrator {

  private final AgentServiceClient client;
  private final AgentContext agentContext;
  private final ThreadRunGuard threadGuard;
  private final CitationExtractor citationExtractor;
  private final Duration runTimeout;
  private final Duration pollInterval;
  private final String searchHint;

  public GroundedConversationOrchestrator(
      AgentServiceClient client,
      AgentContext agentContext,
      ThreadRunGuard threadGuard,
      CitationExtractor citationExtractor,
      Duration runTimeout,
      Duration pollInterval,
      String searchHint) {
    this.client = Objects.requireNonNull(client);
    this.agentContext = Objects.requireNonNull(agentContext);
    this.threadGuard = Objects.requireNonNull(threadGuard);
    this.citationExtractor = Objects.requireNonNull(citationExtractor);
    this.runTimeout = Objects.requireNonNull(runTimeout);
    this.pollInterval = Objects.requireNonNull(pollInterval);
    this.searchHint = searchHint == null ? "" : searchHint.trim();
  }

  /**
   * Submits approved text and waits for the grounded answer.
   *
   * @param approvedText text cleared by the privacy gate
   * @param threadId existing thread to continue, or null for a new conversation
   */
  public GroundedResponse ground(String approvedText, String threadId) {
    Objects.requireNonNull(approvedText, "approvedText");
    Exchange x = new Exchange(UUID.randomUUID().toString());
    log.info(
        "phiguard.ground.start id={} length={} continueThread={}",
        x.id,
        approvedText.length(),
        threadId != null);

    String agentId;
    try {
      agentId = agentContext.getOrCreateAgent();
    } catch (ServiceException e) {
      throw x.fail(
          new GroundingException("Agent is unavailable: " + e.getMessage(), null, null, e));
    }
    x.moveTo(ConversationState.AGENT_READY);

    Conversation conversation;
    try {
      conversation = open(agentId, threadId);
    } catch (ServiceException e) {
      String msg =
          threadId != null && e.getStatusCode() == 404
              ? "Thread " + threadId + " does not exist"
              : "Could not open thread: " + e.getMessage();
      throw x.fail(new GroundingException(msg, threadId, null, e));
    }

    String thread = conversation.getThreadId();
    try {
      threadGuard.acquire(thread);
    } catch (GroundingException e) {
      throw x.fail(e);
    }
    try {
      x.moveTo(ConversationState.THREAD_OPEN);
      return submitAndAwait(x, conversation, approvedText);
    } finally {
      threadGuard.release(thread);
    }
  }

  /** Deletes a thread so the conversation starts fresh next time. */
  public void resetConversation(String threadId) {
    threadGuard.acquire(threadId);
    try {
      client.deleteThread(threadId);
      log.info("phiguard.thread.deleted threadId={}", threadId);
    } finally {
      threadGuard.release(threadId);
    }
  }

  private Conversation open(String agentId, String threadId) {
    if (threadId != null) {
      client.getThread(threadId);
      return new Conversation(agentId, threadId, Instant.now());
    }
    String created = client.createThread();
    log.debug("phiguard.thread.created threadId={}", created);
    return new Conversation(agentId, created, Instant.now());
  }

  private GroundedResponse submitAndAwait(Exchange x, Conversation c, String approvedText) {
    String thread = c.getThreadId();
    String runId = null;
    try {
      client.createMessage(thread, compose(approvedText));
      x.moveTo(ConversationState.MESSAGE_SUBMITTED);

      AgentRun run = startRun(c);
      runId = run.getId();
      x.moveTo(ConversationState.RUNNING);

      run = awaitTerminal(run);
      if (run.getStatus() != RunStatus.COMPLETED) {
        throw new GroundingException(
            "Agent run ended "
                + run.getStatus()
                + (run.getLastErrorCode() == null ? "" : " [" + run.getLastErrorCode() + "]")
                + (run.getLastErrorMessage() == null ? "" : ": " + run.getLastErrorMessage()),
            thread,
            runId);
      }

      final String completedRunId = runId;
      AgentAnswer answer =
          client
              .latestAssistantMessage(thread, runId)
              .orElseThrow(
                  () ->
                      new GroundingException(
                          "Run completed without an assistant message", thread, completedRunId));
      ExtractedAnswer extracted;
      try {
        extracted = citationExtractor.extract(answer);
      } catch (RuntimeException e) {
        throw new GroundingException(
            "Could not read agent answer: " + e.getMessage(), thread, completedRunId, e);
      }
      x.moveTo(ConversationState.COMPLETED);

      log.info(
          "phiguard.ground.done id={} threadId={} runId={} citations={} groundingUsed={}"
              + " durationMs={}",
          x.id,
          thread,
          runId,
          extracted.getCitations().size(),
          extracted.isGroundingUsed(),
          x.elapsedMs());

      return GroundedResponse.builder()
          .answerText(extracted.getAnswerText())
          .citations(extracted.getCitations())
          .threadId(thread)
          .runId(runId)
          .groundingUsed(extracted.isGroundingUsed())
          .build();

    } catch (GroundingException e) {
      throw x.fail(e);
    } catch (ServiceException e) {
      throw x.fail(
          new GroundingException("Agent service call failed: " + e.getMessage(), thread, runId, e));
    }
  }

  private AgentRun startRun(Conversation c) {
    try {
      return client.createRun(c.getThreadId(), c.getAgentId());
    } catch (ServiceException e) {
      if (e.getStatusCode() == 404) {
        // agent vanished on the service side; resolve it again on the next call
        agentContext.clear();
      }
      throw e;
    }
  }

  private AgentRun awaitTerminal(AgentRun run) {
    long deadline = System.nanoTime() + runTimeout.toNanos();
    while (!run.getStatus().isTerminal()) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        cancelAfterTimeout(run);
        throw new GroundingTimeoutException(run.getThreadId(), run.getId(), runTimeout);
      }
      try {
        Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelAfterTimeout(run);
        throw new GroundingException(
            "Interrupted while waiting for agent run", run.getThreadId(), run.getId(), e);
      }
      run = client.getRun(run.getThreadId(), run.getId());
      if (run.getStatus() == RunStatus.REQUIRES_ACTION) {
        log.debug("phiguard.run.tools runId={}", run.getId());
      }
    }
    return run;
  }

  private void cancelAfterTimeout(AgentRun run) {
    try {
      client.cancelRun(run.getThreadId(), run.getId());
    } catch (ServiceException e) {
      log.warn(
          "phiguard.run.cancel.failed threadId={} runId={} error={}",
          run.getThreadId(),
          run.getId(),
          e.getMessage());
    }
  }

  private String compose(String approvedText) {
    return searchHint.isEmpty() ? approvedText : approvedText + "\n\n" + searchHint;
  }

  /** State of one exchange; transitions are checked and logged. */
  private static final class Exchange {
    final String id;
    final long t0 = System.nanoTime();
    ConversationState state = ConversationState.IDLE;

    Exchange(String id) {
      this.id = id;
    }

    void moveTo(ConversationState next) {
      if (!state.canMoveTo(next)) {
        throw new IllegalStateException("Illegal transition " + state + " -> " + next);
      }
      log.debug("phiguard.ground.state id={} {} -> {}", id, state, next);
      state = next;
    }

    GroundingException fail(GroundingException e) {
      log.error(
          "phiguard.ground.failed id={} state={} threadId={} runId={} durationMs={} error={}",
          id,
          state,
          e.getThreadId(),
          e.getRunId(),
          elapsedMs(),
          e.getMessage());
      state = ConversationState.FAILED;
      return e;
    }

    long elapsedMs() {
      return (System.nanoTime() - t0) / 1_000_000;
    }
  }
}
