package ca.gc.cra.uvcalc.config;

import ca.gc.cra.uvcalc.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Worker pool sizing and time budgets of the job scheduler.
 * <p><strong>Why:</strong> Jobs mostly wait on solver subprocesses, so the pool oversubscribes the CPUs slightly but
 * stays under a hard cap to avoid overloading the solver host.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param maxThreads hard cap on worker threads
 * @param threadSurplus threads added on top of the available processor count
 * @param jobTimeout maximum wait for each section job
 * @param initTimeout maximum wait for each calculation input initialization
 * @since 0.1.0
 */
public record SchedulerSettings(int maxThreads, int threadSurplus, Duration jobTimeout, Duration initTimeout) {

  public SchedulerSettings {
    Numbers.requireRange("maxThreads", maxThreads, 1, 1024);
    Numbers.requireRange("threadSurplus", threadSurplus, 0, 1024);
    Objects.requireNonNull(jobTimeout, "jobTimeout");
    Objects.requireNonNull(initTimeout, "initTimeout");
    if (jobTimeout.isNegative() || jobTimeout.isZero()) {
      throw new IllegalArgumentException("jobTimeout must be positive");
    }
    if (initTimeout.isNegative() || initTimeout.isZero()) {
      throw new IllegalArgumentException("initTimeout must be positive");
    }
  }

  public static SchedulerSettings defaults() {
    return new SchedulerSettings(20, 4, Duration.ofSeconds(40), Duration.ofSeconds(30));
  }

  public static SchedulerSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SchedulerSettings d = defaults();
    return new SchedulerSettings(
        ConfigValues.integer(options, "scheduler.maxThreads", d.maxThreads()),
        ConfigValues.integer(options, "scheduler.threadSurplus", d.threadSurplus()),
        ConfigValues.seconds(options, "scheduler.jobTimeoutSeconds", d.jobTimeout()),
        ConfigValues.seconds(options, "scheduler.initTimeoutSeconds", d.initTimeout()));
  }

  /**
   * @param availableProcessors processors reported by the runtime
   * @return {@code min(maxThreads, availableProcessors + threadSurplus)}
   */
  public int poolSize(int availableProcessors) {
    return Math.max(1, Math.min(maxThreads, availableProcessors + threadSurplus));
  }
}
