package ca.gc.cra.uvcalc.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps.
 * <p><strong>Why:</strong> The scheduler reports batch durations and job latencies; tests inject a fixed clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * @return milliseconds since the epoch
   */
  long nowMillis();

  /** Default clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
