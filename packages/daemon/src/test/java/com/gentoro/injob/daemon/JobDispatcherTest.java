package com.gentoro.injob.daemon;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.injob.exception.ConfigException;
import com.gentoro.injob.job.Job;
import com.gentoro.injob.job.JobSpec;
import com.gentoro.injob.schedule.Schedules;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JobDispatcherTest {
  private static final Duration WAIT = Duration.ofSeconds(5);

  private static Job blocking(String name, CountDownLatch release) {
    return Job.of(JobSpec.of(name), ctx -> release.await(5, TimeUnit.SECONDS));
  }

  @Test
  @DisplayName("Overlapping executions of the same job are allowed by default")
  void overlapAllowedByDefault() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    try (Daemon daemon = new Daemon(TestJobs.utcSettings(), TestJobs.fixedClock())) {
      JobEntry entry = daemon.commit(blocking("slow", release), Schedules.everySecond());

      assertEquals(1, daemon.tick(TestJobs.T0));
      assertEquals(1, daemon.tick(TestJobs.T0.plusSeconds(1)));

      TestJobs.await(() -> entry.status().running() == 2, WAIT, "two in flight");
      release.countDown();
      TestJobs.await(() -> entry.status().logs().size() == 2, WAIT, "both finished");
    }
  }

  @Test
  @DisplayName("SKIP_IF_RUNNING drops dispatches while an execution is in flight")
  void skipIfRunning() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    DaemonSettings settings =
        TestJobs.utcSettings().withDispatchPolicy(DispatchPolicy.SKIP_IF_RUNNING);
    JobDispatcher dispatcher = new JobDispatcher(settings.dispatchPolicy());
    try (Daemon daemon = new Daemon(settings, TestJobs.fixedClock(), dispatcher)) {
      JobEntry entry = daemon.commit(blocking("slow", release), Schedules.everySecond());

      assertEquals(1, daemon.tick(TestJobs.T0));
      assertEquals(1, dispatcher.inFlight("slow"));
      assertEquals(0, daemon.tick(TestJobs.T0.plusSeconds(1)));

      release.countDown();
      TestJobs.await(() -> dispatcher.inFlight("slow") == 0, WAIT, "slot released");
      assertEquals(1, daemon.tick(TestJobs.T0.plusSeconds(2)));
      TestJobs.await(() -> entry.status().logs().size() == 2, WAIT, "second run");
      assertEquals(2, entry.status().execNum());
    }
  }

  @Test
  void rejectedDispatchReleasesSlot() {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    executor.shutdown();
    JobDispatcher dispatcher = new JobDispatcher(DispatchPolicy.SKIP_IF_RUNNING, executor);
    try (Daemon daemon = new Daemon(TestJobs.utcSettings(), TestJobs.fixedClock(), dispatcher)) {
      daemon.commit(TestJobs.noop("late"), Schedules.everySecond());

      assertEquals(0, daemon.tick(Instant.EPOCH));
      assertEquals(0, dispatcher.inFlight("late"));
    }
  }

  @Test
  void closeDrainsWithoutInterrupting() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    JobDispatcher dispatcher = new JobDispatcher(DispatchPolicy.ALLOW_OVERLAP);
    Daemon daemon = new Daemon(TestJobs.utcSettings(), TestJobs.fixedClock(), dispatcher);
    JobEntry entry = daemon.commit(blocking("slow", release), Schedules.everySecond());
    daemon.tick(TestJobs.T0);
    TestJobs.await(() -> entry.status().running() == 1, WAIT, "started");

    daemon.close();
    release.countDown();

    assertTrue(dispatcher.awaitTermination(5, TimeUnit.SECONDS));
    assertEquals("", entry.status().lastLog().orElseThrow().message());
  }

  @Test
  void parsesPolicyNames() {
    assertEquals(DispatchPolicy.ALLOW_OVERLAP, DispatchPolicy.parse(null));
    assertEquals(DispatchPolicy.ALLOW_OVERLAP, DispatchPolicy.parse(" "));
    assertEquals(DispatchPolicy.SKIP_IF_RUNNING, DispatchPolicy.parse("skip-if-running"));
    assertThrows(ConfigException.class, () -> DispatchPolicy.parse("queue"));
  }
}
