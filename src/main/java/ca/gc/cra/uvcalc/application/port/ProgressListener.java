package ca.gc.cra.uvcalc.application.port;

import java.time.Duration;

/**
 * Receives batch progress from the job scheduler.
 *
 * <p>Call order per phase: {@link #init(int, String)} once, {@link #progress()} once per completed job,
 * {@link #finish(Duration)} once. Calls may arrive from worker threads.</p>
 *
 * @since 0.1.0
 */
public interface ProgressListener {
  void init(int total, String legend);

  void progress();

  void finish(Duration elapsed);

  /** Listener that ignores every callback. */
  ProgressListener NONE = new ProgressListener() {
    @Override public void init(int total, String legend) {}

    @Override public void progress() {}

    @Override public void finish(Duration elapsed) {}
  };
}
