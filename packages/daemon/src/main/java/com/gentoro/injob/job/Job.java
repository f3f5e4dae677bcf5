package com.gentoro.injob.job;

/** SPI implemented by the unit of work the daemon schedules. */
public interface Job {

  JobSpec spec();

  /**
   * Executes one run of the job. Returning normally records {@link ExecStatus#OK}; any exception
   * is recorded as {@link ExecStatus#ERROR} with its message. The daemon does not retry.
   */
  void run(JobContext ctx) throws Exception;

  /** Convenience factory for lambda-backed jobs. */
  static Job of(JobSpec spec, Task task) {
    return new Job() {
      @Override
      public JobSpec spec() {
        return spec;
      }

      @Override
      public void run(JobContext ctx) throws Exception {
        task.run(ctx);
      }

      @Override
      public String toString() {
        return "Job[" + spec.name() + "]";
      }
    };
  }

  @FunctionalInterface
  interface Task {
    void run(JobContext ctx) throws Exception;
  }
}
