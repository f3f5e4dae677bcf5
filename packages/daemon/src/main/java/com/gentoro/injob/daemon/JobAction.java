package com.gentoro.injob.daemon;

/** Desired run state of a job entry. */
public enum JobAction {
  START,
  STOP
}
