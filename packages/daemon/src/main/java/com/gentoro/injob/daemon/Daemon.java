package com.gentoro.injob.daemon;

import com.gentoro.injob.job.ExecStatus;
import com.gentoro.injob.job.Job;
import com.gentoro.injob.job.JobLog;
import com.gentoro.injob.job.JobStatus;
import com.gentoro.injob.schedule.Schedule;
import com.gentoro.injob.schedule.ScheduleTime;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * In-process periodic job scheduler.
 *
 * <p>Wakes once per tick, and for every started job whose conditions hold and whose schedule hits
 * the tick, hands one execution to the {@link JobDispatcher} without waiting for it.
 *
 * <p>Two locks are used and never held together: {@code jobsLock} guards the job list and the
 * running state, the {@link ConditionRegistry} guards conditions. A tick therefore sees each
 * container consistently, but not both at the same instant.
 */
public final class Daemon implements AutoCloseable {
  private static final Logger log =
      com.gentoro.injob.logging.LoggingService.getLogger(Daemon.class);

  private static final DateTimeFormatter LAST_AT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
  private static final DateTimeFormatter NEXT_AT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final DaemonSettings settings;
  private final Clock clock;
  private final JobDispatcher dispatcher;
  private final ConditionRegistry conditions = new ConditionRegistry();
  private final ConditionGate gate = new ConditionGate(conditions);

  private final Object jobsLock = new Object();
  private final List<JobEntry> jobs = new ArrayList<>();
  private boolean running;
  // Stop requested while no loop was running; consumed by the next start.
  private boolean stopPending;
  private CountDownLatch stopSignal;
  private CountDownLatch exited;

  public Daemon() {
    this(DaemonSettings.defaults());
  }

  public Daemon(DaemonSettings settings) {
    this(settings, Clock.systemUTC());
  }

  public Daemon(DaemonSettings settings, Clock clock) {
    this(settings, clock, new JobDispatcher(settings.dispatchPolicy()));
  }

  Daemon(DaemonSettings settings, Clock clock, JobDispatcher dispatcher) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
  }

  public DaemonSettings settings() {
    return settings;
  }

  public Clock clock() {
    return clock;
  }

  // --------------------------------------------------------------------
  // Registration
  // --------------------------------------------------------------------

  /**
   * Registers a job or updates the entry already registered under the same name.
   *
   * <p>When an entry with the candidate's name exists it is set back to {@link JobAction#START},
   * takes over the candidate's schedule if the candidate has one, is committed and returned; the
   * candidate itself is discarded. Otherwise the candidate is committed and appended.
   *
   * @return the canonical entry for the job name
   */
  public JobEntry commit(JobEntry candidate) {
    Objects.requireNonNull(candidate, "candidate");
    synchronized (jobsLock) {
      for (JobEntry existing : jobs) {
        if (existing.name().equals(candidate.name())) {
          existing.action(JobAction.START);
          Schedule replacement = candidate.schedule();
          if (replacement != null) {
            existing.schedule(replacement);
          }
          log.debug("Job {} re-committed", existing.name());
          return existing.commit(settings.zone(), clock);
        }
      }
      candidate.commit(settings.zone(), clock);
      jobs.add(candidate);
      log.info("Job {} registered with {}", candidate.name(), candidate.schedule());
      return candidate;
    }
  }

  /** Registers a job whose schedule comes from its spec. */
  public JobEntry commit(Job job) {
    return commit(job, null);
  }

  public JobEntry commit(Job job, Schedule schedule) {
    return commit(new JobEntry(job, schedule, new JobStatus(settings.statusHistory())));
  }

  /**
   * Marks a job as stopped; the loop skips it until it is committed again.
   *
   * @return {@code false} if no job has that name
   */
  public boolean stopJob(String name) {
    synchronized (jobsLock) {
      for (JobEntry entry : jobs) {
        if (entry.name().equals(name)) {
          entry.action(JobAction.STOP);
          log.info("Job {} stopped", name);
          return true;
        }
      }
    }
    return false;
  }

  public Optional<JobEntry> job(String name) {
    synchronized (jobsLock) {
      return jobs.stream().filter(e -> e.name().equals(name)).findFirst();
    }
  }

  /** Registered entries in registration order. */
  public List<JobEntry> jobs() {
    synchronized (jobsLock) {
      return List.copyOf(jobs);
    }
  }

  // --------------------------------------------------------------------
  // Conditions
  // --------------------------------------------------------------------

  public void assertCondition(String name) {
    assertCondition(name, clock.millis());
  }

  public void assertCondition(String name, long atMillis) {
    conditions.set(name, atMillis);
    log.debug("Condition {} asserted at {}", name, atMillis);
  }

  public boolean clearCondition(String name) {
    boolean removed = conditions.remove(name);
    if (removed) log.debug("Condition {} cleared", name);
    return removed;
  }

  public Optional<Long> conditionTime(String name) {
    return conditions.get(name);
  }

  public Map<String, Long> conditions() {
    return conditions.snapshot();
  }

  /** Whether the job's declared conditions hold at {@code nowMillis}. */
  public boolean conditionsAllow(JobEntry entry, long nowMillis) {
    return gate.allows(entry.spec().conditions(), nowMillis);
  }

  // --------------------------------------------------------------------
  // Loop
  // --------------------------------------------------------------------

  /** Runs the tick loop on the calling thread until {@link #stop()}. No-op if already running. */
  public void start() {
    LoopHandle handle = begin();
    if (handle != null) {
      runLoop(handle);
    }
  }

  /** Runs the tick loop on a dedicated thread. No-op if already running. */
  public void startInBackground() {
    LoopHandle handle = begin();
    if (handle != null) {
      Thread t = new Thread(() -> runLoop(handle), "injob-daemon");
      t.setDaemon(true);
      t.start();
    }
  }

  /**
   * Signals the loop to exit and waits up to the configured grace period for it to do so. In-flight
   * executions are neither awaited nor cancelled. A stop issued while no loop is running makes the
   * next {@link #start()} or {@link #startInBackground()} return without ticking.
   */
  public void stop() {
    CountDownLatch signal;
    CountDownLatch done;
    synchronized (jobsLock) {
      if (!running) {
        stopPending = true;
        return;
      }
      signal = stopSignal;
      done = exited;
    }
    signal.countDown();
    try {
      if (!done.await(settings.stopGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Daemon loop did not exit within {} ms", settings.stopGrace().toMillis());
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  public boolean isRunning() {
    synchronized (jobsLock) {
      return running;
    }
  }

  /** Whether a stop has been requested for the current or last run of the loop. */
  public boolean isStopping() {
    synchronized (jobsLock) {
      return stopSignal != null && stopSignal.getCount() == 0;
    }
  }

  /**
   * Evaluates one tick: dispatches every started job whose conditions hold and whose schedule hits
   * {@code at}. Returns once dispatches are issued, not when they complete.
   *
   * @return number of executions dispatched
   */
  public int tick(Instant at) {
    List<JobEntry> snapshot = jobs();
    ScheduleTime st = ScheduleTime.of(at, settings.zone());
    long nowMillis = at.toEpochMilli();
    int dispatched = 0;
    for (JobEntry entry : snapshot) {
      if (entry.action() != JobAction.START) {
        continue;
      }
      try {
        if (!conditionsAllow(entry, nowMillis)) {
          continue;
        }
        Schedule schedule = entry.schedule();
        if (schedule == null || !schedule.hit(st)) {
          continue;
        }
      } catch (RuntimeException e) {
        log.warn("Job {} could not be evaluated: {}", entry.name(), e.toString(), e);
        continue;
      }
      if (dispatcher.dispatch(entry, this)) {
        dispatched++;
      }
    }
    return dispatched;
  }

  private LoopHandle begin() {
    synchronized (jobsLock) {
      if (running) {
        return null;
      }
      if (stopPending) {
        stopPending = false;
        log.debug("Stop requested before start, not entering the loop");
        return null;
      }
      running = true;
      stopSignal = new CountDownLatch(1);
      exited = new CountDownLatch(1);
      return new LoopHandle(stopSignal, exited);
    }
  }

  private void runLoop(LoopHandle handle) {
    long interval = settings.tickInterval().toMillis();
    log.info("Daemon started, tick every {} ms", interval);
    long lastTick = Long.MIN_VALUE;
    try {
      while (true) {
        long now = clock.millis();
        long next = Math.floorDiv(now, interval) * interval + interval;
        if (lastTick != Long.MIN_VALUE && next <= lastTick) {
          next = lastTick + interval;
        }
        if (handle.stopSignal.await(Math.max(0, next - now), TimeUnit.MILLISECONDS)) {
          break;
        }
        lastTick = next;
        try {
          tick(Instant.ofEpochMilli(next));
        } catch (RuntimeException e) {
          log.error("Tick at {} failed", next, e);
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Daemon loop interrupted");
    } finally {
      synchronized (jobsLock) {
        running = false;
      }
      handle.exited.countDown();
      log.info("Daemon stopped");
    }
  }

  /** Stops the loop and releases the dispatcher. Running executions finish on their own. */
  @Override
  public void close() {
    stop();
    dispatcher.shutdown();
  }

  // --------------------------------------------------------------------
  // Reporting
  // --------------------------------------------------------------------

  /** Outcome summary of every started job, in registration order. */
  public DaemonBriefReport briefReport() {
    List<DaemonBriefReport.Entry> out = new ArrayList<>();
    synchronized (jobsLock) {
      for (JobEntry entry : jobs) {
        if (entry.action() != JobAction.START) {
          continue;
        }
        out.add(new DaemonBriefReport.Entry(entry.name(), describe(entry)));
      }
    }
    return new DaemonBriefReport(out);
  }

  private String describe(JobEntry entry) {
    JobStatus status = entry.status();
    StringBuilder sb = new StringBuilder();
    sb.append("exec ").append(status.execNum()).append(" times");
    Optional<JobLog> last = status.lastLog();
    if (last.isPresent()) {
      JobLog l = last.get();
      sb.append(", last at ")
          .append(LAST_AT.format(Instant.ofEpochMilli(l.created()).atZone(settings.zone())))
          .append(" in ")
          .append(l.durationMillis())
          .append(" ms");
      if (l.status() == ExecStatus.OK) {
        sb.append(", status ok");
      } else {
        sb.append(", status err");
        if (!l.message().isEmpty()) {
          sb.append(": ").append(l.message());
        }
      }
    }
    Schedule schedule = entry.schedule();
    long next = schedule == null ? 0 : schedule.nextTime();
    if (next > 0) {
      sb.append(", next ")
          .append(NEXT_AT.format(Instant.ofEpochMilli(next).atZone(settings.zone())));
    }
    return sb.toString();
  }

  private record LoopHandle(CountDownLatch stopSignal, CountDownLatch exited) {}
}
