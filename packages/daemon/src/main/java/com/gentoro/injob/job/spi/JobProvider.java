package com.gentoro.injob.job.spi;

import com.gentoro.injob.InJob;
import com.gentoro.injob.job.Job;
import java.util.List;

/**
 * Service Provider Interface for contributing jobs to a standalone daemon.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.injob.job.spi.JobProvider
 */
public interface JobProvider {
  /** Unique provider id, used in logs. */
  String id();

  /** Whether the provider can contribute jobs in the current runtime. */
  default boolean isAvailable(InJob inJob) {
    return true;
  }

  /** Jobs to commit to the daemon at startup. */
  List<Job> jobs(InJob inJob);
}
