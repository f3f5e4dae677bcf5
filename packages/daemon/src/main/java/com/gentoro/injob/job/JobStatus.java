package com.gentoro.injob.job;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Execution history of a single job. Written by concurrent executions and read by reporting, so
 * every accessor synchronizes on the instance.
 */
public final class JobStatus {
  public static final int DEFAULT_HISTORY = 10;

  private final int historyLimit;
  private final Deque<JobLog> logs = new ArrayDeque<>();
  private long execNum;
  private int running;

  public JobStatus() {
    this(DEFAULT_HISTORY);
  }

  public JobStatus(int historyLimit) {
    if (historyLimit < 1) {
      throw new IllegalArgumentException("historyLimit must be >= 1");
    }
    this.historyLimit = historyLimit;
  }

  /** Marks the start of an execution and returns its sequence number (1-based). */
  public synchronized long begin() {
    running++;
    return ++execNum;
  }

  /** Records a finished execution, evicting the oldest log once the limit is reached. */
  public synchronized void finish(JobLog log) {
    if (running > 0) running--;
    if (logs.size() == historyLimit) {
      logs.removeFirst();
    }
    logs.addLast(log);
  }

  public synchronized long execNum() {
    return execNum;
  }

  /** Number of executions currently in flight. */
  public synchronized int running() {
    return running;
  }

  public synchronized Optional<JobLog> lastLog() {
    return Optional.ofNullable(logs.peekLast());
  }

  /** Retained logs, oldest first. */
  public synchronized List<JobLog> logs() {
    return List.copyOf(new ArrayList<>(logs));
  }
}
