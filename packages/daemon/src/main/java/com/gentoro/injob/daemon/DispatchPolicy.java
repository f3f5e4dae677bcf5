package com.gentoro.injob.daemon;

import com.gentoro.injob.exception.ConfigException;
import java.util.Locale;

/** What to do when a job's tick matches while a previous execution is still running. */
public enum DispatchPolicy {
  /** Always dispatch; executions of the same job may overlap. */
  ALLOW_OVERLAP,
  /** Skip the dispatch while an execution of the same job is in flight. */
  SKIP_IF_RUNNING;

  /** Parses {@code allow-overlap} / {@code skip-if-running} (case and separator insensitive). */
  public static DispatchPolicy parse(String value) {
    if (value == null || value.isBlank()) {
      return ALLOW_OVERLAP;
    }
    String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return DispatchPolicy.valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Unknown dispatch policy: " + value, e);
    }
  }
}
