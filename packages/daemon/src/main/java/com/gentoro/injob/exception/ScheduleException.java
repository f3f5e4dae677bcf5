package com.gentoro.injob.exception;

/** Recurrence pattern could not be parsed, or a job has nothing to schedule it with. */
public class ScheduleException extends InJobException {
  public ScheduleException(String message) {
    super(InJobErrorCode.SCHEDULE_ERROR, message);
  }

  public ScheduleException(String message, Throwable cause) {
    super(InJobErrorCode.SCHEDULE_ERROR, message, cause);
  }
}
