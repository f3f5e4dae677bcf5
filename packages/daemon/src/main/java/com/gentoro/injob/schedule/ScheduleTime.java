package com.gentoro.injob.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Normalized representation of a tick, broken into the calendar fields a recurrence pattern
 * matches against. Day of week follows cron numbering: Sunday is 0.
 */
public record ScheduleTime(
    long epochSecond, int second, int minute, int hour, int dayOfMonth, int month, int dayOfWeek) {

  public static ScheduleTime of(Instant instant, ZoneId zone) {
    Objects.requireNonNull(instant, "instant");
    Objects.requireNonNull(zone, "zone");
    ZonedDateTime t = instant.atZone(zone);
    return new ScheduleTime(
        instant.getEpochSecond(),
        t.getSecond(),
        t.getMinute(),
        t.getHour(),
        t.getDayOfMonth(),
        t.getMonthValue(),
        t.getDayOfWeek().getValue() % 7);
  }
}
