package ca.gc.cra.uvcalc.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.uvcalc.application.input.CalculationInput;
import ca.gc.cra.uvcalc.application.port.RadiativeTransferPort;
import ca.gc.cra.uvcalc.domain.error.SolverException;
import ca.gc.cra.uvcalc.domain.measurement.Section;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class CalculationJobTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void setsAndRestoresDiagnosticContext() throws Exception {
    AtomicReference<String> seenInput = new AtomicReference<>();
    AtomicReference<String> seenSection = new AtomicReference<>();
    RadiativeTransferPort solver = request -> {
      seenInput.set(MDC.get(CalculationJob.MDC_INPUT));
      seenSection.set(MDC.get(CalculationJob.MDC_SECTION));
      return PipelineFixtures.constantSolver(30, 1, 1, 2).solve(request);
    };
    CalculationJob job = new CalculationJob(new CorrectionPipeline(input(), solver), 1);
    long[] now = {1_000};
    MDC.put(CalculationJob.MDC_INPUT, "outer");

    Result result = job.asCallable(metrics, () -> now[0] += 25).call();

    assertEquals(1, result.index());
    assertEquals("CalculationInput[brewer=033, date=2019-06-20]", seenInput.get());
    assertEquals("1", seenSection.get());
    assertEquals("outer", MDC.get(CalculationJob.MDC_INPUT));
    assertNull(MDC.get(CalculationJob.MDC_SECTION));
    assertEquals(1, metrics.count("scheduler.jobs.completed"));
    assertEquals(List.of(25L), metrics.observed("scheduler.job.latencyMillis"));
  }

  @Test
  void countsFailures() {
    RadiativeTransferPort failing = request -> {
      throw new SolverException("boom");
    };
    CalculationJob job = new CalculationJob(new CorrectionPipeline(input(), failing), 0);

    assertThrows(SolverException.class, () -> job.asCallable(metrics, () -> 0L).call());

    assertEquals(1, metrics.count("scheduler.jobs.failed"));
    assertEquals(0, metrics.count("scheduler.jobs.completed"));
    assertNull(MDC.get(CalculationJob.MDC_INPUT));
  }

  @Test
  void rejectsNegativeIndex() {
    CorrectionPipeline pipeline = new CorrectionPipeline(input(), PipelineFixtures.constantSolver(30, 1, 1, 2));
    assertThrows(IllegalArgumentException.class, () -> new CalculationJob(pipeline, -1));
  }

  private static CalculationInput input() {
    Section a = PipelineFixtures.section(PipelineFixtures.header(0, 0, 20),
        new double[] {300, 301}, new double[] {10, 20});
    Section b = PipelineFixtures.section(PipelineFixtures.header(0, 0, 20),
        new double[] {310, 311}, new double[] {10, 20});
    return PipelineFixtures.input(List.of(a, b), PipelineFixtures.settings(true, 0, 0)).build();
  }
}
