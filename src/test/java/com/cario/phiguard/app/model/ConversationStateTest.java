package com.cario.phiguard.app.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ConversationStateTest {

  @Test
  void followsTheHappyPathInOrder() {
    assertTrue(ConversationState.IDLE.canMoveTo(ConversationState.AGENT_READY));
    assertTrue(ConversationState.AGENT_READY.canMoveTo(ConversationState.THREAD_OPEN));
    assertTrue(ConversationState.THREAD_OPEN.canMoveTo(ConversationState.MESSAGE_SUBMITTED));
    assertTrue(ConversationState.MESSAGE_SUBMITTED.canMoveTo(ConversationState.RUNNING));
    assertTrue(ConversationState.RUNNING.canMoveTo(ConversationState.COMPLETED));
  }

  @Test
  void cannotSkipStepsOrLeaveTerminalStates() {
    assertFalse(ConversationState.IDLE.canMoveTo(ConversationState.RUNNING));
    assertFalse(ConversationState.THREAD_OPEN.canMoveTo(ConversationState.COMPLETED));
    assertFalse(ConversationState.COMPLETED.canMoveTo(ConversationState.FAILED));
    assertFalse(ConversationState.FAILED.canMoveTo(ConversationState.IDLE));
  }

  @Test
  void anyActiveStateMayFail() {
    for (ConversationState s : ConversationState.values()) {
      assertEquals(!s.isTerminal(), s.canMoveTo(ConversationState.FAILED), s.name());
    }
  }

  @Test
  void runStatusTerminality() {
    assertFalse(RunStatus.fromWire("in_progress").isTerminal());
    assertFalse(RunStatus.fromWire("requires_action").isTerminal());
    assertTrue(RunStatus.fromWire("completed").isTerminal());
    assertTrue(RunStatus.fromWire("expired").isTerminal());
  }
}
