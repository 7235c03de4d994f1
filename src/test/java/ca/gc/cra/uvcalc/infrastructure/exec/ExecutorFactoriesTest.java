package ca.gc.cra.uvcalc.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void namesDaemonWorkersWithPrefix() throws Exception {
    ExecutorService pool = ExecutorFactories.newCalculationPool(2, "uvcalc-test", null);
    try {
      Thread worker = pool.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
      assertTrue(worker.getName().startsWith("uvcalc-test-"));
      assertTrue(worker.isDaemon());
    } finally {
      ExecutorFactories.shutdownNow(pool, Duration.ofSeconds(5));
    }
  }

  @Test
  void blankPrefixUsesDefault() throws Exception {
    ExecutorService pool = ExecutorFactories.newCalculationPool(1, " ", null);
    try {
      assertTrue(pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS)
          .startsWith("uvcalc-worker-"));
    } finally {
      ExecutorFactories.shutdownNow(pool, Duration.ofSeconds(5));
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newCalculationPool(0, "x", null));
  }

  @Test
  void shutdownNowInterruptsRunningWork() throws Exception {
    ExecutorService pool = ExecutorFactories.newCalculationPool(1, "uvcalc-test", null);
    CountDownLatch started = new CountDownLatch(1);
    AtomicBoolean interrupted = new AtomicBoolean();
    pool.submit(() -> {
      started.countDown();
      try {
        Thread.sleep(10_000);
      } catch (InterruptedException ex) {
        interrupted.set(true);
      }
    });
    assertTrue(started.await(5, TimeUnit.SECONDS));

    assertTrue(ExecutorFactories.shutdownNow(pool, Duration.ofSeconds(5)));
    assertTrue(interrupted.get());
    assertEquals(true, pool.isTerminated());
  }
}
