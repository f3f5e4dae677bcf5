package com.gentoro.injob.schedule;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class ScheduleTimeTest {

  @Test
  void splitsInstantIntoCalendarFields() {
    ScheduleTime t = ScheduleTime.of(Instant.parse("2024-05-12T23:30:15Z"), ZoneOffset.UTC);

    assertEquals(15, t.second());
    assertEquals(30, t.minute());
    assertEquals(23, t.hour());
    assertEquals(12, t.dayOfMonth());
    assertEquals(5, t.month());
    assertEquals(0, t.dayOfWeek());
  }

  @Test
  void fieldsFollowTheZone() {
    ScheduleTime t =
        ScheduleTime.of(Instant.parse("2024-05-12T23:30:15Z"), ZoneId.of("Asia/Tokyo"));

    assertEquals(8, t.hour());
    assertEquals(13, t.dayOfMonth());
    assertEquals(1, t.dayOfWeek());
    assertEquals(Instant.parse("2024-05-12T23:30:15Z").getEpochSecond(), t.epochSecond());
  }
}
