package com.cario.phiguard.app.service;

import com.cario.phiguard.app.model.AgentDefinition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.log4j.Log4j2;

/**
 * Process-wide holder of the reusable agent handle.
 *
 * <p>Built once at startup and passed to the orchestrator. The agent id is a lazily initialized
 * field: the first caller creates (or looks up) the agent while holding the lock, every later or
 * concurrent caller observes the stored id. Exactly one creation call is made per process unless
 * the agent is explicitly forgotten via {@link #clear()}.
 */
@Log4j2
public class AgentContext {

  private final AgentServiceClient client;
  private final AgentDefinition definition;
  private final String existingAgentId;

  private final ReentrantLock lock = new ReentrantLock();
  private volatile String agentId;

  /**
   * @param existingAgentId agent to look up instead of creating one; may be null
   */
  public AgentContext(
      AgentServiceClient client, AgentDefinition definition, String existingAgentId) {
    this.client = client;
    this.definition = definition;
    this.existingAgentId =
        existingAgentId == null || existingAgentId.isBlank() ? null : existingAgentId.trim();
  }

  public String getOrCreateAgent() {
    String id = agentId;
    if (id != null) {
      return id;
    }
    lock.lock();
    try {
      if (agentId == null) {
        if (existingAgentId != null) {
          agentId = client.getAgent(existingAgentId);
          log.info("phiguard.agent.attached agentId={}", agentId);
        } else {
          agentId = client.createAgent(definition);
          log.info(
              "phiguard.agent.created agentId={} name={} model={} grounding={}",
              agentId,
              definition.getName(),
              definition.getModel(),
              definition.isGroundingEnabled());
        }
      }
      return agentId;
    } finally {
      lock.unlock();
    }
  }

  /** The agent id if one has been resolved, otherwise null. */
  public String currentAgentId() {
    return agentId;
  }

  /**
   * Deletes the agent this context created. Agents attached by id are left alone and only
   * forgotten.
   */
  public void deleteAgent() {
    lock.lock();
    try {
      if (agentId == null) return;
      if (existingAgentId == null) {
        client.deleteAgent(agentId);
        log.info("phiguard.agent.deleted agentId={}", agentId);
      }
      agentId = null;
    } finally {
      lock.unlock();
    }
  }

  /** Forgets the cached agent so the next call resolves it again. */
  public void clear() {
    lock.lock();
    try {
      agentId = null;
    } finally {
      lock.unlock();
    }
  }
}
