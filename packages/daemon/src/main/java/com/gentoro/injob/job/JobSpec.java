package com.gentoro.injob.job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Static description of a job: its unique name, the conditions it waits for and, optionally, the
 * cron expression its schedule is built from.
 *
 * <p>Conditions map a condition name to a validity window in milliseconds. {@link #NEVER_EXPIRES}
 * means the condition only has to be present. Declaration order is preserved and is the order in
 * which the daemon checks them.
 *
 * @param name unique job name, used to deduplicate registrations
 * @param conditions condition name to threshold in milliseconds
 * @param schedule cron expression, may be {@code null} when a schedule is supplied at commit
 */
public record JobSpec(String name, Map<String, Long> conditions, String schedule) {
  public static final long NEVER_EXPIRES = -1L;

  public JobSpec {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Job name must not be blank");
    }
    LinkedHashMap<String, Long> copy = new LinkedHashMap<>();
    if (conditions != null) {
      conditions.forEach(
          (k, v) -> {
            Objects.requireNonNull(k, "condition name");
            Objects.requireNonNull(v, "condition threshold");
            if (v < 0 && v != NEVER_EXPIRES) {
              throw new IllegalArgumentException(
                  "Invalid threshold %d for condition '%s'".formatted(v, k));
            }
            copy.put(k, v);
          });
    }
    conditions = Collections.unmodifiableMap(copy);
    schedule = schedule == null || schedule.isBlank() ? null : schedule.trim();
  }

  public static JobSpec of(String name) {
    return new JobSpec(name, Map.of(), null);
  }

  public static JobSpec of(String name, String schedule) {
    return new JobSpec(name, Map.of(), schedule);
  }

  /** Returns a copy with one more condition appended. */
  public JobSpec withCondition(String condition, long thresholdMillis) {
    LinkedHashMap<String, Long> next = new LinkedHashMap<>(conditions);
    next.put(condition, thresholdMillis);
    return new JobSpec(name, next, schedule);
  }

  /** Returns a copy with a presence-only condition appended. */
  public JobSpec withCondition(String condition) {
    return withCondition(condition, NEVER_EXPIRES);
  }

  public JobSpec withSchedule(String cron) {
    return new JobSpec(name, conditions, cron);
  }
}
