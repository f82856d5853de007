package com.cario.phiguard.app.model;

/** Lifecycle of a single grounded exchange. */
public enum ConversationState {
  IDLE,
  AGENT_READY,
  THREAD_OPEN,
  MESSAGE_SUBMITTED,
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** Whether moving from this state to {@code next} is a legal step. */
  public boolean canMoveTo(ConversationState next) {
    if (next == FAILED) {
      return !isTerminal();
    }
    return switch (this) {
      case IDLE -> next == AGENT_READY;
      case AGENT_READY -> next == THREAD_OPEN;
      case THREAD_OPEN -> next == MESSAGE_SUBMITTED;
      case MESSAGE_SUBMITTED -> next == RUNNING;
      case RUNNING -> next == COMPLETED;
      case COMPLETED, FAILED -> false;
    };
  }
}
