package com.cario.phiguard.app.exception;

/** A run is already in flight on the thread; messages on one thread are never interleaved. */
public class ThreadBusyException extends GroundingException {

  public ThreadBusyException(String threadId) {
    super("Thread " + threadId + " already has a run in progress", threadId, null);
  }
}
