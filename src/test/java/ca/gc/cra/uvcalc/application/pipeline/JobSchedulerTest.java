package ca.gc.cra.uvcalc.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.uvcalc.application.input.CalculationInput;
import ca.gc.cra.uvcalc.application.port.ClockPort;
import ca.gc.cra.uvcalc.application.port.ProgressListener;
import ca.gc.cra.uvcalc.application.port.RadiativeTransferPort;
import ca.gc.cra.uvcalc.config.CalculationSettings;
import ca.gc.cra.uvcalc.config.SchedulerSettings;
import ca.gc.cra.uvcalc.domain.ancillary.OzoneSeries;
import ca.gc.cra.uvcalc.domain.error.BatchExecutionException;
import ca.gc.cra.uvcalc.domain.error.ExecutionTimeoutException;
import ca.gc.cra.uvcalc.domain.error.SolverException;
import ca.gc.cra.uvcalc.domain.measurement.Section;
import ca.gc.cra.uvcalc.domain.solver.SolverDirective;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class JobSchedulerTest {
  private static final CalculationSettings SETTINGS = PipelineFixtures.settings(true, 0, 0);
  private static final SchedulerSettings FAST =
      new SchedulerSettings(4, 2, Duration.ofSeconds(10), Duration.ofSeconds(10));

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final RecordingProgress progress = new RecordingProgress();

  @Test
  void emptyBatchReturnsNoResults() throws Exception {
    JobScheduler scheduler = new JobScheduler(FAST, PipelineFixtures.constantSolver(30, 1, 1, 2), metrics, ClockPort.SYSTEM);

    List<Result> results = scheduler.schedule(List.of(), progress);

    assertTrue(results.isEmpty());
    assertEquals(List.of("0:Calculating..."), progress.inits);
    assertEquals(1, progress.finished.get());
  }

  @Test
  void inputsWithoutSectionsProduceNoJobs() throws Exception {
    CalculationInput empty = PipelineFixtures.input(List.of(), SETTINGS).build();
    JobScheduler scheduler = new JobScheduler(FAST, PipelineFixtures.constantSolver(30, 1, 1, 2), metrics, ClockPort.SYSTEM);

    List<Result> results = scheduler.schedule(List.of(empty), progress);

    assertTrue(results.isEmpty());
    assertEquals(List.of("1:Collecting data for 1 day...", "0:Calculating..."), progress.inits);
    assertEquals(0, metrics.count("scheduler.jobs.submitted"));
  }

  @Test
  void resultsFollowInputThenSectionOrder() throws Exception {
    CalculationInput first = PipelineFixtures.input(sections(2), SETTINGS).build();
    CalculationInput second = PipelineFixtures.input(sections(3), SETTINGS).build();
    RadiativeTransferPort jittery = request -> {
      sleep(ThreadLocalRandom.current().nextInt(1, 30));
      return PipelineFixtures.constantSolver(30, 1, 1, 2).solve(request);
    };
    JobScheduler scheduler = new JobScheduler(FAST, jittery, metrics, ClockPort.SYSTEM);

    List<Result> results = scheduler.schedule(List.of(first, second), progress);

    assertEquals(5, results.size());
    int[] expectedIndices = {0, 1, 0, 1, 2};
    for (int i = 0; i < results.size(); i++) {
      assertEquals(expectedIndices[i], results.get(i).index());
      assertSame(i < 2 ? first : second, results.get(i).input());
    }
    assertEquals(List.of("2:Collecting data for 2 days...",
        "5:Calculating irradiance for 5 sections in 2 inputs..."), progress.inits);
    assertEquals(7, progress.ticks.get());
    assertEquals(1, progress.finished.get());
    assertEquals(5, metrics.count("scheduler.jobs.submitted"));
    assertEquals(5, metrics.count("scheduler.jobs.completed"));
    assertEquals(5, metrics.observed("scheduler.job.latencyMillis").size());
  }

  @Test
  void failingJobFailsWholeBatch() {
    CalculationInput input = PipelineFixtures.input(sections(4), SETTINGS).build();
    RadiativeTransferPort solver = request -> {
      if ("600.0".equals(request.values(SolverDirective.WAVELENGTH).get(0))) {
        throw new SolverException("solver exited with status 1");
      }
      return PipelineFixtures.constantSolver(30, 1, 1, 2).solve(request);
    };
    JobScheduler scheduler = new JobScheduler(FAST, solver, metrics, ClockPort.SYSTEM);

    BatchExecutionException ex = assertThrows(BatchExecutionException.class,
        () -> scheduler.schedule(List.of(input), progress));

    assertInstanceOf(SolverException.class, ex.getCause());
    assertTrue(metrics.count("scheduler.jobs.failed") >= 1);
    assertEquals(0, progress.finished.get());
  }

  @Test
  void slowJobRaisesSingleTimeout() {
    SchedulerSettings tight = new SchedulerSettings(4, 2, Duration.ofMillis(200), Duration.ofSeconds(10));
    CalculationInput input = PipelineFixtures.input(sections(3), SETTINGS).build();
    AtomicInteger interrupted = new AtomicInteger();
    RadiativeTransferPort hanging = request -> {
      try {
        Thread.sleep(10_000);
      } catch (InterruptedException e) {
        interrupted.incrementAndGet();
        Thread.currentThread().interrupt();
        throw new SolverException("interrupted", e);
      }
      return PipelineFixtures.constantSolver(30, 1, 1, 2).solve(request);
    };
    JobScheduler scheduler = new JobScheduler(tight, hanging, metrics, ClockPort.SYSTEM);

    long start = System.nanoTime();
    assertThrows(ExecutionTimeoutException.class, () -> scheduler.schedule(List.of(input), progress));

    assertTrue(System.nanoTime() - start < Duration.ofSeconds(8).toNanos(), "timeout should cancel the batch");
    assertEquals(1, metrics.count("scheduler.batch.timeout"));
  }

  @Test
  void initializationFailureFailsBatch() {
    CalculationInput broken = CalculationInput.builder("033", PipelineFixtures.DAY, SETTINGS)
        .uv(sink -> {
          throw new IOException("disk gone");
        })
        .ozone(sink -> OzoneSeries.empty())
        .calibration(sink -> PipelineFixtures.flatCalibration(1))
        .arf(sink -> Optional.empty())
        .build();
    JobScheduler scheduler = new JobScheduler(FAST, PipelineFixtures.constantSolver(30, 1, 1, 2), metrics, ClockPort.SYSTEM);

    BatchExecutionException ex = assertThrows(BatchExecutionException.class,
        () -> scheduler.schedule(List.of(broken), progress));

    assertInstanceOf(UncheckedIOException.class, ex.getCause());
    assertEquals(0, metrics.count("scheduler.jobs.submitted"));
  }

  private static List<Section> sections(int count) {
    List<Section> sections = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      double start = 300 * (i + 1);
      sections.add(PipelineFixtures.section(PipelineFixtures.header(0, 0, 20),
          new double[] {start, start + 1, start + 2}, new double[] {10, 20, 30}));
    }
    return sections;
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SolverException("interrupted", e);
    }
  }

  private static final class RecordingProgress implements ProgressListener {
    final List<String> inits = Collections.synchronizedList(new ArrayList<>());
    final AtomicInteger ticks = new AtomicInteger();
    final AtomicInteger finished = new AtomicInteger();

    @Override
    public void init(int total, String legend) {
      inits.add(total + ":" + legend);
    }

    @Override
    public void progress() {
      ticks.incrementAndGet();
    }

    @Override
    public void finish(Duration elapsed) {
      finished.incrementAndGet();
    }
  }
}
