package com.gentoro.injob.schedule;

import java.time.Clock;
import java.time.ZoneId;

/** Factory methods for the common recurrence patterns. */
public final class Schedules {
  private Schedules() {}

  /** Matches every tick. */
  public static Schedule everySecond() {
    return cron("* * * * * *");
  }

  /** Cron schedule evaluated in the system zone. */
  public static Schedule cron(String expression) {
    return CronSchedule.parse(expression, ZoneId.systemDefault(), Clock.systemUTC());
  }

  public static Schedule cron(String expression, ZoneId zone) {
    return CronSchedule.parse(expression, zone, Clock.systemUTC());
  }
}
