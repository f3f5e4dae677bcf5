package com.gentoro.injob.daemon;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Issues job executions into an unbounded thread pool and tracks how many executions of each job
 * are in flight. Whether a job may overlap with itself is decided by the {@link DispatchPolicy}.
 */
public final class JobDispatcher {
  private static final Logger log =
      com.gentoro.injob.logging.LoggingService.getLogger(JobDispatcher.class);

  private final DispatchPolicy policy;
  private final ExecutorService executor;
  private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();

  public JobDispatcher(DispatchPolicy policy) {
    this(policy, Executors.newCachedThreadPool(threadFactory()));
  }

  JobDispatcher(DispatchPolicy policy, ExecutorService executor) {
    this.policy = policy == null ? DispatchPolicy.ALLOW_OVERLAP : policy;
    this.executor = executor;
  }

  public DispatchPolicy policy() {
    return policy;
  }

  /**
   * Launches one execution of {@code entry} and returns without waiting for it.
   *
   * @return {@code false} if the dispatch was skipped by policy or rejected by the executor
   */
  public boolean dispatch(JobEntry entry, Daemon daemon) {
    String name = entry.name();
    if (!acquire(name)) {
      log.debug("Job {} still running, skipping dispatch", name);
      return false;
    }
    try {
      executor.execute(
          () -> {
            try {
              entry.exec(daemon);
            } finally {
              release(name);
            }
          });
      return true;
    } catch (RejectedExecutionException e) {
      release(name);
      log.warn("Executor rejected job {}", name, e);
      return false;
    }
  }

  /** Number of executions of the named job currently in flight. */
  public int inFlight(String name) {
    AtomicInteger n = inFlight.get(name);
    return n == null ? 0 : n.get();
  }

  /** Stops accepting work. Running executions are left to finish; nothing is interrupted. */
  public void shutdown() {
    executor.shutdown();
  }

  /** Waits for in-flight executions after {@link #shutdown()}. */
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return executor.awaitTermination(timeout, unit);
  }

  private boolean acquire(String name) {
    AtomicInteger counter = inFlight.computeIfAbsent(name, k -> new AtomicInteger());
    if (policy == DispatchPolicy.ALLOW_OVERLAP) {
      counter.incrementAndGet();
      return true;
    }
    return counter.compareAndSet(0, 1);
  }

  private void release(String name) {
    AtomicInteger counter = inFlight.get(name);
    if (counter != null) {
      counter.updateAndGet(n -> n > 0 ? n - 1 : 0);
    }
  }

  private static ThreadFactory threadFactory() {
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "injob-exec-" + seq.incrementAndGet());
      t.setDaemon(true);
      t.setUncaughtExceptionHandler(
          (th, e) -> log.error("Uncaught error in {}: {}", th.getName(), e.toString(), e));
      return t;
    };
  }
}
