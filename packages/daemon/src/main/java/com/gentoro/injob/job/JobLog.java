package com.gentoro.injob.job;

/**
 * Immutable record of one finished execution.
 *
 * @param created epoch millis when the execution started
 * @param updated epoch millis when the execution finished
 * @param status terminal status
 * @param message failure message, empty on success
 */
public record JobLog(long created, long updated, ExecStatus status, String message) {
  public JobLog {
    if (status == null) status = ExecStatus.OK;
    if (message == null) message = "";
  }

  public long durationMillis() {
    return updated - created;
  }
}
