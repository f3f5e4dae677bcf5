package com.gentoro.injob.exception;

/** Coarse classification attached to every {@link InJobException}. */
public enum InJobErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  SCHEDULE_ERROR,
  EXECUTION_ERROR,
  NETWORK_ERROR
}
