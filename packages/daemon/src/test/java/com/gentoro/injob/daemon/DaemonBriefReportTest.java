package com.gentoro.injob.daemon;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.injob.job.ExecStatus;
import com.gentoro.injob.job.JobLog;
import com.gentoro.injob.job.JobSpec;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DaemonBriefReportTest {
  private static final long LAST = Instant.parse("2024-05-06T09:59:58.250Z").toEpochMilli();

  private Daemon daemon;

  @BeforeEach
  void setUp() {
    daemon = new Daemon(TestJobs.utcSettings(), TestJobs.fixedClock());
  }

  @AfterEach
  void tearDown() {
    daemon.close();
  }

  private static void record(JobEntry entry, long durationMs, ExecStatus status, String message) {
    entry.status().begin();
    entry.status().finish(new JobLog(LAST, LAST + durationMs, status, message));
  }

  @Test
  void neverExecutedJobReportsNextRun() {
    daemon.commit(TestJobs.noop(JobSpec.of("noon", "0 0 12 * * *")));

    DaemonBriefReport report = daemon.briefReport();

    assertEquals(
        List.of(new DaemonBriefReport.Entry("noon", "exec 0 times, next 2024-05-06 12:00:00")),
        report.jobs());
  }

  @Test
  void successfulExecution() {
    JobEntry entry = daemon.commit(TestJobs.noop(JobSpec.of("noon", "0 0 12 * * *")));
    record(entry, 1500, ExecStatus.OK, "");

    assertEquals(
        "exec 1 times, last at 2024-05-06 09:59:58.250 in 1500 ms, status ok,"
            + " next 2024-05-06 12:00:00",
        daemon.briefReport().jobs().get(0).message());
  }

  @Test
  void failedExecutionCarriesMessage() {
    JobEntry entry = daemon.commit(TestJobs.noop(JobSpec.of("noon", "0 0 12 * * *")));
    record(entry, 5, ExecStatus.OK, "");
    record(entry, 10, ExecStatus.ERROR, "boom");

    assertEquals(
        "exec 2 times, last at 2024-05-06 09:59:58.250 in 10 ms, status err: boom,"
            + " next 2024-05-06 12:00:00",
        daemon.briefReport().jobs().get(0).message());
  }

  @Test
  void scheduleWithoutNextTimeOmitsNextClause() {
    JobEntry entry = daemon.commit(TestJobs.noop("custom"), TestJobs.always());
    record(entry, 0, ExecStatus.ERROR, "");

    assertEquals(
        "exec 1 times, last at 2024-05-06 09:59:58.250 in 0 ms, status err",
        daemon.briefReport().jobs().get(0).message());
  }

  @Test
  void stoppedJobsAreExcludedAndOrderIsKept() {
    daemon.commit(TestJobs.noop("b"), TestJobs.always());
    daemon.commit(TestJobs.noop("stopped"), TestJobs.always());
    daemon.commit(TestJobs.noop("a"), TestJobs.always());
    daemon.stopJob("stopped");

    List<String> names =
        daemon.briefReport().jobs().stream().map(DaemonBriefReport.Entry::name).toList();

    assertEquals(List.of("b", "a"), names);
  }
}
