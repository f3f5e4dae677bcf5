package com.gentoro.injob.daemon;

import java.util.List;

/** Snapshot of every started job's last outcome and next run, in registration order. */
public record DaemonBriefReport(List<Entry> jobs) {
  public DaemonBriefReport {
    jobs = jobs == null ? List.of() : List.copyOf(jobs);
  }

  public record Entry(String name, String message) {}
}
