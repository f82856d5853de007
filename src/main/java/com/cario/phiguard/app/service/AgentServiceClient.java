package com.cario.phiguard.app.service;

import com.cario.phiguard.app.model.AgentAnswer;
import com.cario.phiguard.app.model.AgentDefinition;
import com.cario.phiguard.app.model.AgentRun;
import java.util.Optional;

/**
 * Boundary to the externally hosted agent service (agents, threads, messages and runs).
 *
 * <p>All methods block and fail with {@link com.cario.phiguard.app.exception.ServiceException}.
 */
public interface AgentServiceClient {

  /** Creates an agent and returns its id. */
  String createAgent(AgentDefinition definition);

  /** Looks up an existing agent and returns its id. */
  String getAgent(String agentId);

  void deleteAgent(String agentId);

  String createThread();

  /** Verifies the thread exists. */
  void getThread(String threadId);

  void deleteThread(String threadId);

  /** Appends a user message to the thread and returns the message id. */
  String createMessage(String threadId, String text);

  AgentRun createRun(String threadId, String agentId);

  AgentRun getRun(String threadId, String runId);

  AgentRun cancelRun(String threadId, String runId);

  /** Most recent assistant message produced by the given run, if any. */
  Optional<AgentAnswer> latestAssistantMessage(String threadId, String runId);
}
