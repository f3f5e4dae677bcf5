package com.gentoro.injob.schedule;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.injob.exception.ScheduleException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CronScheduleTest {
  // Monday
  private static final Instant NOW = Instant.parse("2024-05-06T10:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private static CronSchedule cron(String expr) {
    return CronSchedule.parse(expr, ZoneOffset.UTC, CLOCK);
  }

  private static ScheduleTime at(String iso) {
    return ScheduleTime.of(Instant.parse(iso), ZoneOffset.UTC);
  }

  @Test
  void wildcardHitsEveryTick() {
    CronSchedule every = cron("* * * * * *");
    assertTrue(every.hit(at("2024-05-06T10:00:00Z")));
    assertTrue(every.hit(at("2024-12-31T23:59:59Z")));
    assertEquals(NOW.plusSeconds(1).toEpochMilli(), every.nextTime());
  }

  @Test
  void stepsAndLists() {
    CronSchedule quarter = cron("0 */15 * * * *");
    assertTrue(quarter.hit(at("2024-05-06T10:15:00Z")));
    assertTrue(quarter.hit(at("2024-05-06T10:45:00Z")));
    assertFalse(quarter.hit(at("2024-05-06T10:15:01Z")));
    assertFalse(quarter.hit(at("2024-05-06T10:20:00Z")));

    CronSchedule list = cron("10,20-22 * * * * *");
    assertTrue(list.hit(at("2024-05-06T10:00:10Z")));
    assertTrue(list.hit(at("2024-05-06T10:00:21Z")));
    assertFalse(list.hit(at("2024-05-06T10:00:23Z")));

    CronSchedule offset = cron("5/20 * * * * *");
    assertTrue(offset.hit(at("2024-05-06T10:00:45Z")));
    assertFalse(offset.hit(at("2024-05-06T10:00:40Z")));
  }

  @Test
  void nextTimeIsLaterSameDay() {
    assertEquals(
        Instant.parse("2024-05-06T12:00:30Z").toEpochMilli(), cron("30 0 12 * * *").nextTime());
  }

  @Test
  @DisplayName("Next time is strictly after now")
  void nextTimeSkipsCurrentSecond() {
    assertEquals(
        Instant.parse("2024-05-07T10:00:00Z").toEpochMilli(), cron("0 0 10 * * *").nextTime());
  }

  @Test
  void nextCarriesOverMinuteAndHour() {
    Instant next = cron("0 * * * * *").next(Instant.parse("2024-05-06T10:59:59Z"));
    assertEquals(Instant.parse("2024-05-06T11:00:00Z"), next);
  }

  @Test
  void sundayIsZeroOrSeven() {
    Instant expected = Instant.parse("2024-05-12T09:00:00Z");
    assertEquals(expected.toEpochMilli(), cron("0 0 9 * * 0").nextTime());
    assertEquals(expected.toEpochMilli(), cron("0 0 9 * * 7").nextTime());
    assertTrue(cron("0 0 9 * * 7").hit(at("2024-05-12T09:00:00Z")));
  }

  @Test
  @DisplayName("Restricted day-of-month and day-of-week match if either does")
  void dayOfMonthOrDayOfWeek() {
    CronSchedule firstOrMonday = cron("0 0 0 1 * 1");
    assertEquals(
        Instant.parse("2024-05-13T00:00:00Z").toEpochMilli(), firstOrMonday.nextTime());
    assertTrue(firstOrMonday.hit(at("2024-06-01T00:00:00Z")));
    assertFalse(firstOrMonday.hit(at("2024-05-14T00:00:00Z")));
  }

  @Test
  void evaluatedInScheduleZone() {
    ZoneId zone = ZoneId.of("Europe/Paris");
    CronSchedule paris = CronSchedule.parse("0 0 9 * * *", zone, CLOCK);
    assertTrue(paris.hit(ScheduleTime.of(Instant.parse("2024-05-06T07:00:00Z"), zone)));
    assertEquals(Instant.parse("2024-05-07T07:00:00Z").toEpochMilli(), paris.nextTime());
  }

  @Test
  void stepLargerThanRangeKeepsOnlyStart() {
    CronSchedule huge = cron("1/2147483647 * * * * *");
    assertTrue(huge.hit(at("2024-05-06T10:00:01Z")));
    assertFalse(huge.hit(at("2024-05-06T10:00:02Z")));
  }

  @Test
  @DisplayName("A stepped wildcard day field combines with the other day field by AND")
  void steppedDayWildcard() {
    CronSchedule oddMondays = cron("0 0 0 */2 * 1");
    assertTrue(oddMondays.hit(at("2024-05-13T00:00:00Z")));
    assertFalse(oddMondays.hit(at("2024-05-06T00:00:00Z")), "even day");
    assertFalse(oddMondays.hit(at("2024-05-07T00:00:00Z")), "Tuesday");
    assertEquals(Instant.parse("2024-05-13T00:00:00Z").toEpochMilli(), oddMondays.nextTime());

    CronSchedule everyDay = cron("0 0 0 */1 * *");
    assertTrue(everyDay.hit(at("2024-05-07T00:00:00Z")));
  }

  @Test
  void impossibleDateHasNoNextTime() {
    CronSchedule feb30 = cron("0 0 0 30 2 *");
    assertEquals(0L, feb30.nextTime());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {"", "* * *", "* * * * *", "61 * * * * *", "a * * * * *", "*/0 * * * * *",
        "5-1 * * * * *", "* * * 0 * *", "* * * * 13 *", "* * * * * 8", "1-2-3 * * * * *"})
  void rejectsInvalidExpressions(String expr) {
    assertThrows(ScheduleException.class, () -> cron(expr));
  }

  @Test
  void exposesExpression() {
    CronSchedule schedule = cron("  0 0 12 * * *  ");
    assertEquals("0 0 12 * * *", schedule.expression());
    assertEquals("cron(0 0 12 * * *)", schedule.toString());
  }
}
