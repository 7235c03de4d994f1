package ca.gc.cra.uvcalc.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the bounded worker pools used by the calculation scheduler.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor whose surplus tasks wait in an unbounded FIFO queue.
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix; {@code uvcalc-worker} when blank
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newCalculationPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "uvcalc-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Stops accepting work, interrupts running tasks and waits briefly for the workers to exit.
   *
   * @param executor pool to stop
   * @param grace maximum time to wait for termination
   * @return {@code true} if every worker exited in time
   */
  public static boolean shutdownNow(ExecutorService executor, Duration grace) {
    Objects.requireNonNull(executor, "executor");
    executor.shutdownNow();
    try {
      boolean terminated = executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        log.warn("Worker pool did not terminate within {} ms", grace.toMillis());
      }
      return terminated;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
