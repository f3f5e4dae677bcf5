package com.gentoro.injob.job;

/** Terminal state of one job execution. */
public enum ExecStatus {
  /** Execution returned normally. */
  OK,
  /** Execution threw; see the log message. */
  ERROR
}
