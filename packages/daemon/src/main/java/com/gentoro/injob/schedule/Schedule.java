package com.gentoro.injob.schedule;

/** Recurrence state of a job. Implementations must be safe to call from the tick thread. */
public interface Schedule {

  /** Whether the tick described by {@code time} matches this recurrence. */
  boolean hit(ScheduleTime time);

  /**
   * Epoch milliseconds of the next predicted match after now, or {@code 0} when unknown. Used only
   * for reporting.
   */
  long nextTime();
}
