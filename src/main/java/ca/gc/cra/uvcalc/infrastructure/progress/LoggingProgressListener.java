package ca.gc.cra.uvcalc.infrastructure.progress;

import ca.gc.cra.uvcalc.application.port.ProgressListener;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProgressListener} that reports completion at INFO whenever another tenth of the work is done.
 *
 * <p>Thread-safe: {@link #progress()} is called from worker threads.</p>
 *
 * @since 0.1.0
 */
public final class LoggingProgressListener implements ProgressListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);
  private static final int STEP_PERCENT = 10;

  private final AtomicInteger done = new AtomicInteger();
  private final AtomicInteger lastReported = new AtomicInteger();
  private volatile int total;
  private volatile String legend = "";

  @Override
  public void init(int total, String legend) {
    this.total = Math.max(0, total);
    this.legend = legend == null ? "" : legend;
    done.set(0);
    lastReported.set(0);
    log.info("{} ({} jobs)", this.legend, this.total);
  }

  @Override
  public void progress() {
    int current = done.incrementAndGet();
    int expected = total;
    if (expected == 0) {
      return;
    }
    int percent = (int) ((long) current * 100 / expected);
    int bucket = percent / STEP_PERCENT * STEP_PERCENT;
    int previous = lastReported.get();
    if (bucket > previous && lastReported.compareAndSet(previous, bucket)) {
      log.info("{} {}% ({}/{})", legend, bucket, current, expected);
    }
  }

  @Override
  public void finish(Duration elapsed) {
    log.info("Finished {} of {} jobs in {} ms", done.get(), total, elapsed.toMillis());
  }

  /** Number of {@link #progress()} calls since the last {@link #init(int, String)}. */
  public int completed() {
    return done.get();
  }
}
