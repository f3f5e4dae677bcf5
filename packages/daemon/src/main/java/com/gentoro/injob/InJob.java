package com.gentoro.injob;

import com.gentoro.injob.daemon.Daemon;
import com.gentoro.injob.daemon.DaemonSettings;
import com.gentoro.injob.exception.ExceptionUtil;
import com.gentoro.injob.exception.ExecutionException;
import com.gentoro.injob.exception.StateException;
import com.gentoro.injob.http.EmbeddedJettyServer;
import com.gentoro.injob.job.Job;
import com.gentoro.injob.job.spi.JobProvider;
import com.gentoro.injob.management.ManagementServer;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application holder for a standalone daemon: loads configuration, applies logging levels, builds
 * the {@link Daemon}, commits jobs contributed by {@link JobProvider}s, exposes the management
 * endpoints and starts the tick loop.
 */
public class InJob {

  private static final org.slf4j.Logger log =
      com.gentoro.injob.logging.LoggingService.getLogger(InJob.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private Daemon daemon;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public InJob(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    com.gentoro.injob.logging.LoggingService.applyConfiguration(configuration());

    this.daemon = new Daemon(DaemonSettings.fromConfiguration(configuration()));
    int committed = commitProvidedJobs();
    log.info("{} job(s) committed from providers", committed);

    if (configuration().getBoolean("http.management.enabled", true)) {
      this.httpServer = new EmbeddedJettyServer(this);
      httpServer.prepare();
      try {
        new ManagementServer(this).register();
        // Start Jetty (non-blocking)
        httpServer.start();
      } catch (Exception e) {
        shutdown();
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ExecutionException("Could not start http server", ex));
      }
    }

    daemon.startInBackground();
  }

  private int commitProvidedJobs() {
    int committed = 0;
    for (JobProvider provider : ServiceLoader.load(JobProvider.class)) {
      if (!provider.isAvailable(this)) {
        log.info("Job provider {} is not available, skipping", provider.id());
        continue;
      }
      List<Job> jobs;
      try {
        jobs = provider.jobs(this);
      } catch (Exception e) {
        log.error("Job provider {} failed to supply jobs", provider.id(), e);
        continue;
      }
      if (jobs == null) continue;
      for (Job job : jobs) {
        try {
          daemon.commit(job);
          committed++;
        } catch (Exception e) {
          log.error(
              "Could not commit job from provider {}: {}",
              provider.id(),
              ExceptionUtil.extractErrorMessage(e));
        }
      }
    }
    return committed;
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    // Register a JVM shutdown hook once
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "injob-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down");
      try {
        closeQuietly(httpServer);
        closeQuietly(daemon);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Error while closing {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("InJob not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public Daemon daemon() {
    if (daemon == null) {
      throw new StateException("InJob not initialized. Call initialize() first.");
    }
    return daemon;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
