package com.gentoro.injob.job;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JobSpecTest {

  @Test
  void conditionsKeepDeclarationOrder() {
    JobSpec spec =
        JobSpec.of("ordered").withCondition("z", 10).withCondition("a").withCondition("m", 0);

    assertEquals(List.of("z", "a", "m"), List.copyOf(spec.conditions().keySet()));
    assertEquals(JobSpec.NEVER_EXPIRES, spec.conditions().get("a"));
  }

  @Test
  void conditionsAreImmutable() {
    JobSpec spec = JobSpec.of("fixed").withCondition("c", 5);
    assertThrows(UnsupportedOperationException.class, () -> spec.conditions().put("d", 1L));
  }

  @Test
  void rejectsBlankNameAndNegativeThresholds() {
    assertThrows(IllegalArgumentException.class, () -> JobSpec.of(" "));
    assertThrows(IllegalArgumentException.class, () -> JobSpec.of(null));
    assertThrows(IllegalArgumentException.class, () -> JobSpec.of("x").withCondition("c", -2));
  }

  @Test
  void blankScheduleIsTreatedAsAbsent() {
    assertNull(new JobSpec("x", Map.of(), "  ").schedule());
    assertEquals("0 * * * * *", JobSpec.of("x").withSchedule(" 0 * * * * * ").schedule());
  }
}
