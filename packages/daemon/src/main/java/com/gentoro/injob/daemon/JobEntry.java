package com.gentoro.injob.daemon;

import com.gentoro.injob.exception.ExceptionUtil;
import com.gentoro.injob.exception.ScheduleException;
import com.gentoro.injob.job.ExecStatus;
import com.gentoro.injob.job.Job;
import com.gentoro.injob.job.JobContext;
import com.gentoro.injob.job.JobLog;
import com.gentoro.injob.job.JobSpec;
import com.gentoro.injob.job.JobStatus;
import com.gentoro.injob.schedule.CronSchedule;
import com.gentoro.injob.schedule.Schedule;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * A job registered with the daemon: the job itself, its desired action, its recurrence state and
 * its execution history.
 *
 * <p>{@code action} and {@code schedule} are replaced by re-commits on the daemon's job-list lock
 * while the tick thread and reporting read them, hence {@code volatile}. {@link JobStatus} guards
 * itself.
 */
public final class JobEntry {
  private static final Logger log =
      com.gentoro.injob.logging.LoggingService.getLogger(JobEntry.class);

  private final Job job;
  private final JobStatus status;
  private volatile JobAction action = JobAction.START;
  private volatile Schedule schedule;

  public JobEntry(Job job) {
    this(job, null);
  }

  public JobEntry(Job job, Schedule schedule) {
    this(job, schedule, new JobStatus());
  }

  JobEntry(Job job, Schedule schedule, JobStatus status) {
    this.job = Objects.requireNonNull(job, "job");
    Objects.requireNonNull(job.spec(), "job spec");
    this.schedule = schedule;
    this.status = status;
  }

  public String name() {
    return job.spec().name();
  }

  public JobSpec spec() {
    return job.spec();
  }

  public Job job() {
    return job;
  }

  public JobAction action() {
    return action;
  }

  void action(JobAction action) {
    this.action = action;
  }

  /** Current recurrence state, {@code null} until the first commit. */
  public Schedule schedule() {
    return schedule;
  }

  void schedule(Schedule schedule) {
    this.schedule = schedule;
  }

  public JobStatus status() {
    return status;
  }

  /**
   * Finalizes the entry's own state. Builds the schedule from the spec's cron expression when none
   * has been assigned. Safe to call repeatedly.
   *
   * @throws ScheduleException if there is neither a schedule nor an expression to build one from
   */
  public JobEntry commit() {
    return commit(ZoneId.systemDefault(), Clock.systemUTC());
  }

  JobEntry commit(ZoneId zone, Clock clock) {
    if (schedule == null) {
      String expr = job.spec().schedule();
      if (expr == null) {
        ScheduleException ex = new ScheduleException("Job '%s' has no schedule".formatted(name()));
        ex.withContext("job", name());
        throw ex;
      }
      schedule = CronSchedule.parse(expr, zone, clock);
    }
    return this;
  }

  /**
   * Runs the job once on the calling thread and records the outcome. Exceptions thrown by the job
   * are recorded, not rethrown.
   */
  void exec(Daemon daemon) {
    Clock clock = daemon.clock();
    long seq = status.begin();
    long created = clock.millis();
    // Stays ERROR if the job escapes with an Error.
    ExecStatus result = ExecStatus.ERROR;
    String message = "Execution aborted";
    try {
      job.run(new JobContext(daemon, name(), seq));
      result = ExecStatus.OK;
      message = "";
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      message = "Interrupted";
    } catch (Exception e) {
      message = ExceptionUtil.extractErrorMessage(e);
      log.warn("Job {} execution #{} failed: {}", name(), seq, message, e);
    } finally {
      status.finish(new JobLog(created, clock.millis(), result, message));
    }
    log.debug("Job {} execution #{} finished with {}", name(), seq, result);
  }

  @Override
  public String toString() {
    return "JobEntry[" + name() + ", " + action + "]";
  }
}
