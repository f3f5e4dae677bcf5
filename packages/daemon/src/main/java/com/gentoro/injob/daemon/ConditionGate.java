package com.gentoro.injob.daemon;

import com.gentoro.injob.job.JobSpec;
import java.util.Map;

/**
 * Decides whether a job's declared conditions currently allow it to run.
 *
 * <p>All declared conditions must hold, checked in declaration order. A condition holds when it
 * has been asserted and either never expires or was asserted no more than its threshold ago.
 */
public final class ConditionGate {
  private final ConditionRegistry registry;

  public ConditionGate(ConditionRegistry registry) {
    this.registry = registry;
  }

  public boolean allows(Map<String, Long> required, long nowMillis) {
    if (required == null || required.isEmpty()) {
      return true;
    }
    return registry.read(
        conditions -> {
          for (Map.Entry<String, Long> req : required.entrySet()) {
            Long asserted = conditions.get(req.getKey());
            if (asserted == null || !valid(asserted, req.getValue(), nowMillis)) {
              return false;
            }
          }
          return true;
        });
  }

  static boolean valid(long assertedMillis, long thresholdMillis, long nowMillis) {
    if (thresholdMillis == JobSpec.NEVER_EXPIRES || assertedMillis >= nowMillis) {
      return true;
    }
    // Negative only when the real distance exceeds Long.MAX_VALUE.
    long elapsed = nowMillis - assertedMillis;
    return elapsed >= 0 && elapsed <= thresholdMillis;
  }
}
