package com.cario.phiguard.app.service;

import com.cario.phiguard.app.exception.ThreadBusyException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Tracks threads with a run in flight; a thread holds at most one run at a time. */
public class ThreadRunGuard {

  private final Set<String> busy = ConcurrentHashMap.newKeySet();

  /**
   * Claims the thread for a run.
   *
   * @throws ThreadBusyException if another run on the thread has not been released yet
   */
  public void acquire(String threadId) {
    if (!busy.add(threadId)) {
      throw new ThreadBusyException(threadId);
    }
  }

  public void release(String threadId) {
    busy.remove(threadId);
  }
}
