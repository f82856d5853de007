package com.cario.phiguard.app.config;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.cario.phiguard.app.exception.ServiceException;
import com.cario.phiguard.app.model.AgentDefinition;
import com.cario.phiguard.app.service.AgentContext;
import com.cario.phiguard.app.service.AgentServiceClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AgentShutdownHookTest {

  private AgentServiceClient client;
  private AgentContext context;

  @BeforeEach
  void setUp() {
    client = mock(AgentServiceClient.class);
    when(client.createAgent(any())).thenReturn("asst_1");
    context =
        new AgentContext(
            client, AgentDefinition.builder().name("a").model("m").build(), null);
  }

  @Test
  void deletesCreatedAgentWhenEnabled() {
    context.getOrCreateAgent();
    new AgentShutdownHook(context, true).destroy();
    verify(client).deleteAgent("asst_1");
  }

  @Test
  void leavesAgentWhenDisabled() {
    context.getOrCreateAgent();
    new AgentShutdownHook(context, false).destroy();
    verify(client, never()).deleteAgent(any());
  }

  @Test
  void nothingToDeleteBeforeFirstUse() {
    new AgentShutdownHook(context, true).destroy();
    verify(client, never()).deleteAgent(any());
  }

  @Test
  void deleteFailureDoesNotPropagate() {
    context.getOrCreateAgent();
    doThrow(new ServiceException("agents", 500, true, "boom")).when(client).deleteAgent("asst_1");
    new AgentShutdownHook(context, true).destroy();
    verify(client).deleteAgent("asst_1");
  }
}
