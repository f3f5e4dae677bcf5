package com.gentoro.injob.daemon;

import com.gentoro.injob.exception.ConfigException;
import com.gentoro.injob.job.JobStatus;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Tunables of the daemon, read from the {@code daemon} section of the application configuration.
 *
 * @param tickInterval time between ticks; ticks land on multiples of it since the epoch
 * @param stopGrace how long {@link Daemon#stop()} waits for the loop to acknowledge
 * @param dispatchPolicy overlap handling for executions of the same job
 * @param zone zone in which schedules and report timestamps are evaluated
 * @param statusHistory number of execution logs retained per job
 */
public record DaemonSettings(
    Duration tickInterval,
    Duration stopGrace,
    DispatchPolicy dispatchPolicy,
    ZoneId zone,
    int statusHistory) {

  public static final long DEFAULT_TICK_MS = 1000;
  public static final long DEFAULT_STOP_GRACE_MS = 200;

  public DaemonSettings {
    Objects.requireNonNull(tickInterval, "tickInterval");
    Objects.requireNonNull(stopGrace, "stopGrace");
    Objects.requireNonNull(dispatchPolicy, "dispatchPolicy");
    Objects.requireNonNull(zone, "zone");
    if (tickInterval.toMillis() <= 0) {
      throw new ConfigException("daemon.tick-interval-ms must be positive");
    }
    if (stopGrace.isNegative()) {
      throw new ConfigException("daemon.stop-grace-ms must not be negative");
    }
    if (statusHistory < 1) {
      throw new ConfigException("daemon.status-history must be >= 1");
    }
  }

  public static DaemonSettings defaults() {
    return new DaemonSettings(
        Duration.ofMillis(DEFAULT_TICK_MS),
        Duration.ofMillis(DEFAULT_STOP_GRACE_MS),
        DispatchPolicy.ALLOW_OVERLAP,
        ZoneId.systemDefault(),
        JobStatus.DEFAULT_HISTORY);
  }

  public static DaemonSettings fromConfiguration(Configuration cfg) {
    if (cfg == null) {
      return defaults();
    }
    long tickMs;
    long graceMs;
    int history;
    try {
      tickMs = cfg.getLong("daemon.tick-interval-ms", DEFAULT_TICK_MS);
      graceMs = cfg.getLong("daemon.stop-grace-ms", DEFAULT_STOP_GRACE_MS);
      history = cfg.getInt("daemon.status-history", JobStatus.DEFAULT_HISTORY);
    } catch (RuntimeException e) {
      throw new ConfigException("Failed to resolve daemon configuration", e);
    }
    DispatchPolicy policy = DispatchPolicy.parse(cfg.getString("daemon.dispatch-policy", null));
    return new DaemonSettings(
        Duration.ofMillis(tickMs),
        Duration.ofMillis(graceMs),
        policy,
        resolveZone(cfg.getString("daemon.zone", "system")),
        history);
  }

  private static ZoneId resolveZone(String value) {
    if (value == null || value.isBlank() || "system".equalsIgnoreCase(value.trim())) {
      return ZoneId.systemDefault();
    }
    try {
      return ZoneId.of(value.trim());
    } catch (DateTimeException e) {
      throw new ConfigException("Invalid daemon.zone: " + value, e);
    }
  }

  public DaemonSettings withDispatchPolicy(DispatchPolicy policy) {
    return new DaemonSettings(tickInterval, stopGrace, policy, zone, statusHistory);
  }

  public DaemonSettings withZone(ZoneId zone) {
    return new DaemonSettings(tickInterval, stopGrace, dispatchPolicy, zone, statusHistory);
  }

  public DaemonSettings withTickInterval(Duration tickInterval) {
    return new DaemonSettings(tickInterval, stopGrace, dispatchPolicy, zone, statusHistory);
  }
}
