package com.cario.phiguard.app.config;

import com.cario.phiguard.app.exception.ServiceException;
import com.cario.phiguard.app.service.AgentContext;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.DisposableBean;

/** Removes the agent this process created when the application stops, if configured to. */
@Log4j2
public class AgentShutdownHook implements DisposableBean {

  private final AgentContext agentContext;
  private final boolean enabled;

  public AgentShutdownHook(AgentContext agentContext, boolean enabled) {
    this.agentContext = agentContext;
    this.enabled = enabled;
  }

  @Override
  public void destroy() {
    if (!enabled || agentContext.currentAgentId() == null) {
      return;
    }
    try {
      agentContext.deleteAgent();
    } catch (ServiceException e) {
      log.warn("phiguard.agent.delete.failed error={}", e.getMessage());
    }
  }
}
