package ca.gc.cra.uvcalc.application.pipeline;

import ca.gc.cra.uvcalc.application.port.ClockPort;
import ca.gc.cra.uvcalc.application.port.MetricsPort;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.MDC;

/**
 * Correction of one section, run once on a worker thread.
 *
 * <p>While running, the MDC carries {@value #MDC_INPUT} and {@value #MDC_SECTION}; previous values are restored
 * afterwards.</p>
 *
 * @param pipeline pipeline of the owning input
 * @param index section index within the input
 * @since 0.1.0
 */
public record CalculationJob(CorrectionPipeline pipeline, int index) {
  static final String MDC_INPUT = "uvcalc.input";
  static final String MDC_SECTION = "uvcalc.section";

  public CalculationJob {
    Objects.requireNonNull(pipeline, "pipeline");
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0");
    }
  }

  /** Runs the pipeline directly on the calling thread. */
  public Result run() {
    return pipeline.calculate(index);
  }

  Callable<Result> asCallable(MetricsPort metrics, ClockPort clock) {
    return () -> {
      String previousInput = MDC.get(MDC_INPUT);
      String previousSection = MDC.get(MDC_SECTION);
      long start = clock.nowMillis();
      try {
        MDC.put(MDC_INPUT, pipeline.input().toString());
        MDC.put(MDC_SECTION, Integer.toString(index));
        Result result = run();
        metrics.increment("scheduler.jobs.completed");
        return result;
      } catch (RuntimeException ex) {
        metrics.increment("scheduler.jobs.failed");
        throw ex;
      } finally {
        metrics.observe("scheduler.job.latencyMillis", clock.nowMillis() - start);
        restore(MDC_INPUT, previousInput);
        restore(MDC_SECTION, previousSection);
      }
    };
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
