package ca.gc.cra.uvcalc.application.pipeline;

import ca.gc.cra.uvcalc.application.input.CalculationInput;
import ca.gc.cra.uvcalc.application.port.ClockPort;
import ca.gc.cra.uvcalc.application.port.MetricsPort;
import ca.gc.cra.uvcalc.application.port.ProgressListener;
import ca.gc.cra.uvcalc.application.port.RadiativeTransferPort;
import ca.gc.cra.uvcalc.config.SchedulerSettings;
import ca.gc.cra.uvcalc.domain.error.BatchExecutionException;
import ca.gc.cra.uvcalc.domain.error.ExecutionTimeoutException;
import ca.gc.cra.uvcalc.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the correction of every section of a batch of inputs on a bounded worker pool.
 * <p><strong>Phases:</strong>
 * <ol>
 *   <li>Initialize every input in parallel, each bounded by the init timeout.</li>
 *   <li>Submit one {@link CalculationJob} per section and collect the results in submission order, each bounded
 *   by the job timeout.</li>
 * </ol>
 * <p><strong>Failure model:</strong> all-or-nothing. The first failure or timeout cancels every outstanding job
 * and surfaces as a single {@link BatchExecutionException} (or {@link ExecutionTimeoutException}); results already
 * computed are discarded. Nothing is retried.</p>
 * <p><strong>Thread-safety:</strong> A scheduler may run several batches sequentially; each batch gets its own
 * pool of {@code min(maxThreads, processors + threadSurplus)} threads.</p>
 * <p><strong>Observability:</strong> Emits {@code scheduler.jobs.submitted}, {@code scheduler.jobs.completed},
 * {@code scheduler.jobs.failed}, {@code scheduler.batch.timeout} and {@code scheduler.job.latencyMillis}.</p>
 *
 * @since 0.1.0
 */
public final class JobScheduler {
  private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

  private final SchedulerSettings settings;
  private final RadiativeTransferPort solver;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final int poolSize;

  public JobScheduler(
      SchedulerSettings settings, RadiativeTransferPort solver, MetricsPort metrics, ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.solver = Objects.requireNonNull(solver, "solver");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.poolSize = settings.poolSize(Runtime.getRuntime().availableProcessors());
  }

  /**
   * Corrects every section of {@code inputs}.
   *
   * @param inputs inputs in caller order
   * @param progress receives the init and calculation phases
   * @return results ordered by input, then by section
   * @throws ExecutionTimeoutException when an initialization or a job exceeds its timeout
   * @throws BatchExecutionException when any initialization or job fails
   */
  public List<Result> schedule(List<CalculationInput> inputs, ProgressListener progress)
      throws BatchExecutionException {
    Objects.requireNonNull(inputs, "inputs");
    Objects.requireNonNull(progress, "progress");
    long start = clock.nowMillis();
    if (inputs.isEmpty()) {
      return handleEmpty(progress);
    }

    ExecutorService executor = ExecutorFactories.newCalculationPool(poolSize, "uvcalc-worker",
        (thread, ex) -> log.error("Uncaught exception in {}", thread.getName(), ex));
    try {
      List<CalculationJob> jobs = initialize(inputs, executor, progress);
      if (jobs.isEmpty()) {
        return handleEmpty(progress);
      }
      long validInputs = inputs.stream().filter(input -> !input.sections().isEmpty()).count();
      log.info("Starting calculation of {} sections in {} inputs", jobs.size(), validInputs);
      progress.init(jobs.size(), "Calculating irradiance for " + plural(jobs.size(), "section")
          + " in " + plural((int) validInputs, "input") + "...");

      List<Future<Result>> futures = new ArrayList<>(jobs.size());
      for (CalculationJob job : jobs) {
        futures.add(executor.submit(job.asCallable(metrics, clock)));
        metrics.increment("scheduler.jobs.submitted");
      }
      List<Result> results = new ArrayList<>(jobs.size());
      for (int i = 0; i < futures.size(); i++) {
        CalculationJob job = jobs.get(i);
        results.add(await(futures, i, settings.jobTimeout(),
            "section " + job.index() + " of " + job.pipeline().input()));
        progress.progress();
      }

      Duration elapsed = Duration.ofMillis(clock.nowMillis() - start);
      progress.finish(elapsed);
      log.info("Finished calculation batch of {} sections in {} ms", results.size(), elapsed.toMillis());
      return results;
    } finally {
      ExecutorFactories.shutdownNow(executor, SHUTDOWN_GRACE);
    }
  }

  private List<CalculationJob> initialize(
      List<CalculationInput> inputs, ExecutorService executor, ProgressListener progress)
      throws BatchExecutionException {
    progress.init(inputs.size(), "Collecting data for " + plural(inputs.size(), "day") + "...");
    List<Future<Void>> futures = new ArrayList<>(inputs.size());
    for (CalculationInput input : inputs) {
      futures.add(executor.submit(() -> {
        input.initialize();
        return null;
      }));
    }
    List<CalculationJob> jobs = new ArrayList<>();
    for (int i = 0; i < inputs.size(); i++) {
      CalculationInput input = inputs.get(i);
      await(futures, i, settings.initTimeout(), "initialization of " + input);
      CorrectionPipeline pipeline = new CorrectionPipeline(input, solver);
      int sections = input.sections().size();
      for (int index = 0; index < sections; index++) {
        jobs.add(new CalculationJob(pipeline, index));
      }
      progress.progress();
      log.debug("Created {} jobs for {}", sections, input);
    }
    return jobs;
  }

  private <T> T await(List<? extends Future<T>> futures, int position, Duration timeout, String what)
      throws BatchExecutionException {
    try {
      return futures.get(position).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      cancelAll(futures);
      metrics.increment("scheduler.batch.timeout");
      log.error("Timed out after {} ms waiting for {}; cancelled remaining work", timeout.toMillis(), what);
      throw new ExecutionTimeoutException(
          "One of the jobs took too long to complete (" + what + ", timeout " + timeout.toMillis() + " ms)", ex);
    } catch (ExecutionException ex) {
      cancelAll(futures);
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      log.info("Exception caught in worker ({}), cancelling all remaining tasks", what);
      throw new BatchExecutionException("Failed " + what + ": " + cause.getMessage(), cause);
    } catch (InterruptedException ex) {
      cancelAll(futures);
      Thread.currentThread().interrupt();
      throw new BatchExecutionException("Interrupted while waiting for " + what, ex);
    }
  }

  private static void cancelAll(List<? extends Future<?>> futures) {
    for (Future<?> future : futures) {
      future.cancel(true);
    }
  }

  private static List<Result> handleEmpty(ProgressListener progress) {
    progress.init(0, "Calculating...");
    progress.finish(Duration.ZERO);
    log.warn("No input found for the given parameters");
    return List.of();
  }

  private static String plural(int count, String noun) {
    return count + " " + noun + (count == 1 ? "" : "s");
  }
}
