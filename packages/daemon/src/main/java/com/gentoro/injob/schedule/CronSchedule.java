package com.gentoro.injob.schedule;

import com.gentoro.injob.exception.ScheduleException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.BitSet;
import java.util.Locale;
import java.util.Objects;

/**
 * Six-field cron recurrence: {@code second minute hour day-of-month month day-of-week}.
 *
 * <p>Each field accepts {@code *}, single values, comma separated lists, ranges ({@code 1-5}) and
 * steps ({@code *}{@code /15}, {@code 10-40/10}). Day of week is 0-7 with both 0 and 7 meaning
 * Sunday. When both day-of-month and day-of-week are restricted a day matches if either does; a
 * field starting with {@code *} counts as unrestricted.
 */
public final class CronSchedule implements Schedule {
  private static final int MAX_SEARCH_DAYS = 366;

  private final String expression;
  private final ZoneId zone;
  private final Clock clock;
  private final Field seconds;
  private final Field minutes;
  private final Field hours;
  private final Field days;
  private final Field months;
  private final Field dows;

  private CronSchedule(String expression, ZoneId zone, Clock clock, Field[] fields) {
    this.expression = expression;
    this.zone = zone;
    this.clock = clock;
    this.seconds = fields[0];
    this.minutes = fields[1];
    this.hours = fields[2];
    this.days = fields[3];
    this.months = fields[4];
    this.dows = fields[5];
  }

  public static CronSchedule parse(String expression, ZoneId zone, Clock clock) {
    Objects.requireNonNull(zone, "zone");
    Objects.requireNonNull(clock, "clock");
    if (expression == null || expression.isBlank()) {
      throw new ScheduleException("cron expression is empty");
    }
    String[] parts = expression.trim().split("\\s+");
    if (parts.length != 6) {
      throw new ScheduleException(
          "cron must have 6 fields (second minute hour day month weekday): " + expression);
    }
    try {
      Field[] fields = {
        Field.parse(parts[0], 0, 59),
        Field.parse(parts[1], 0, 59),
        Field.parse(parts[2], 0, 23),
        Field.parse(parts[3], 1, 31),
        Field.parse(parts[4], 1, 12),
        Field.parse(parts[5], 0, 7)
      };
      return new CronSchedule(expression.trim(), zone, clock, fields);
    } catch (NumberFormatException e) {
      throw new ScheduleException("invalid number in cron expression: " + expression, e);
    }
  }

  public String expression() {
    return expression;
  }

  @Override
  public boolean hit(ScheduleTime time) {
    return seconds.matches(time.second())
        && minutes.matches(time.minute())
        && hours.matches(time.hour())
        && months.matches(time.month())
        && dayMatches(time.dayOfMonth(), time.dayOfWeek());
  }

  @Override
  public long nextTime() {
    Instant next = next(clock.instant());
    return next == null ? 0L : next.toEpochMilli();
  }

  /** First matching second strictly after {@code after}, or {@code null} within a year. */
  Instant next(Instant after) {
    ZonedDateTime start = after.atZone(zone).withNano(0).plusSeconds(1);
    LocalDate day = start.toLocalDate();
    for (int d = 0; d <= MAX_SEARCH_DAYS; d++, day = day.plusDays(1)) {
      if (!months.matches(day.getMonthValue())
          || !dayMatches(day.getDayOfMonth(), day.getDayOfWeek().getValue() % 7)) {
        continue;
      }
      LocalTime from = d == 0 ? start.toLocalTime() : LocalTime.MIDNIGHT;
      for (int h = hours.nextSetBit(from.getHour()); h >= 0; h = hours.nextSetBit(h + 1)) {
        boolean sameHour = h == from.getHour() && d == 0;
        int m0 = sameHour ? from.getMinute() : 0;
        for (int m = minutes.nextSetBit(m0); m >= 0; m = minutes.nextSetBit(m + 1)) {
          int s0 = sameHour && m == from.getMinute() ? from.getSecond() : 0;
          int s = seconds.nextSetBit(s0);
          if (s < 0) continue;
          ZonedDateTime candidate = LocalDateTime.of(day, LocalTime.of(h, m, s)).atZone(zone);
          // A local time inside a DST gap shifts forward and may land before the start.
          if (!candidate.isBefore(start)) {
            return candidate.toInstant();
          }
        }
      }
    }
    return null;
  }

  private boolean dayMatches(int dayOfMonth, int dayOfWeek) {
    if (days.wildcard || dows.wildcard) {
      return days.matches(dayOfMonth) && dows.matches(dayOfWeek);
    }
    return days.matches(dayOfMonth) || dows.matches(dayOfWeek);
  }

  @Override
  public String toString() {
    return "cron(" + expression + ")";
  }

  private static final class Field {
    final boolean wildcard;
    final BitSet values;

    private Field(boolean wildcard, BitSet values) {
      this.wildcard = wildcard;
      this.values = values;
    }

    static Field parse(String token, int min, int max) {
      token = token.toLowerCase(Locale.ROOT);
      BitSet vals = new BitSet(max + 1);
      if ("*".equals(token)) {
        vals.set(min, max + 1);
        if (max == 7) vals.clear(7);
        return new Field(true, vals);
      }
      for (String part : token.split(",")) {
        parsePart(part, min, max, vals);
      }
      if (vals.isEmpty()) {
        throw new ScheduleException("cron field matches nothing: " + token);
      }
      // "*/n" still counts as unrestricted for the day-of-month / day-of-week rule.
      return new Field(token.startsWith("*"), vals);
    }

    private static void parsePart(String part, int min, int max, BitSet out) {
      String[] stepSplit = part.split("/", -1);
      if (stepSplit.length > 2) {
        throw new ScheduleException("invalid cron step: " + part);
      }
      String range = stepSplit[0];
      int step = stepSplit.length > 1 ? Integer.parseInt(stepSplit[1]) : 1;
      if (step <= 0) {
        throw new ScheduleException("cron step must be positive: " + part);
      }
      int start;
      int end;
      if ("*".equals(range)) {
        start = min;
        end = max;
      } else if (range.contains("-")) {
        String[] bounds = range.split("-", -1);
        if (bounds.length != 2) {
          throw new ScheduleException("invalid cron range: " + part);
        }
        start = Integer.parseInt(bounds[0]);
        end = Integer.parseInt(bounds[1]);
      } else {
        start = Integer.parseInt(range);
        end = stepSplit.length > 1 ? max : start;
      }
      if (start < min || end > max || start > end) {
        throw new ScheduleException(
            "cron value out of range [" + min + "-" + max + "]: " + part);
      }
      for (long v = start; v <= end; v += step) {
        out.set(max == 7 && v == 7 ? 0 : (int) v);
      }
    }

    boolean matches(int value) {
      return values.get(value);
    }

    int nextSetBit(int from) {
      return values.nextSetBit(from);
    }
  }
}
