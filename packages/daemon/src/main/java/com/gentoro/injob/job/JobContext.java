package com.gentoro.injob.job;

import com.gentoro.injob.daemon.Daemon;
import java.util.Optional;

/**
 * Context passed to {@link Job#run(JobContext)}. Gives the running job access to the daemon's
 * conditions so that one job can gate another. The daemon is referenced, not owned.
 */
public final class JobContext {
  private final Daemon daemon;
  private final String jobName;
  private final long execNum;

  public JobContext(Daemon daemon, String jobName, long execNum) {
    this.daemon = daemon;
    this.jobName = jobName;
    this.execNum = execNum;
  }

  public String jobName() {
    return jobName;
  }

  /** Sequence number of this execution, starting at 1. */
  public long execNum() {
    return execNum;
  }

  /** Asserts a condition as true now. */
  public void assertCondition(String name) {
    daemon.assertCondition(name);
  }

  /** Asserts a condition with an explicit timestamp in epoch milliseconds. */
  public void assertCondition(String name, long atMillis) {
    daemon.assertCondition(name, atMillis);
  }

  public void clearCondition(String name) {
    daemon.clearCondition(name);
  }

  /** Last time the condition was asserted, in epoch milliseconds. */
  public Optional<Long> conditionTime(String name) {
    return daemon.conditionTime(name);
  }

  /**
   * Whether the daemon has been asked to stop. Executions are never cancelled; long-running jobs
   * may check this to finish early.
   */
  public boolean isStopping() {
    return daemon.isStopping();
  }
}
