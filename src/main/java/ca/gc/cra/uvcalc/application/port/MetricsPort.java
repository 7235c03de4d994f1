package ca.gc.cra.uvcalc.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the calculation core.
 * <p><strong>Why:</strong> Lets the scheduler and solver adapter count jobs and time solver calls without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} discards everything.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for job submissions, completions and failures.</li>
 *   <li>Record numeric observations such as job and solver latency.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from worker threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code scheduler.jobs.completed},
 * {@code solver.latencyMillis}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code scheduler.jobs.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, units defined by the key suffix
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
