package ca.gc.cra.uvcalc.infrastructure.solver;

import ca.gc.cra.uvcalc.application.port.MetricsPort;
import ca.gc.cra.uvcalc.application.port.RadiativeTransferPort;
import ca.gc.cra.uvcalc.config.SolverSettings;
import ca.gc.cra.uvcalc.domain.error.SolverException;
import ca.gc.cra.uvcalc.domain.solver.SolverRequest;
import ca.gc.cra.uvcalc.domain.solver.SolverResult;
import ca.gc.cra.uvcalc.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RadiativeTransferPort} backed by the libRadtran {@code uvspec} executable.
 * <p><strong>Why:</strong> Direct, diffuse and global irradiances for the cosine correction are computed by an
 * external program that reads its configuration on standard input and prints one row per wavelength.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write the fixed preamble, the request directives and the {@code output_user} line to a uniquely named
 *   input file in the work directory.</li>
 *   <li>Run the configured command with that file as standard input and capture standard output and error to
 *   sibling files.</li>
 *   <li>Delete the three files after a successful run; keep them after a failure so the run can be
 *   reproduced.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each call uses its own files and process; instances are shareable.</p>
 * <p><strong>Observability:</strong> Emits {@code solver.invocations}, {@code solver.failures} and
 * {@code solver.latencyMillis}.</p>
 *
 * @since 0.1.0
 */
public final class LibradtranProcessClient implements RadiativeTransferPort {
  private static final Logger log = LoggerFactory.getLogger(LibradtranProcessClient.class);
  private static final int STDERR_EXCERPT_CHARS = 1_000;

  private final SolverSettings settings;
  private final MetricsPort metrics;

  public LibradtranProcessClient(SolverSettings settings, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public SolverResult solve(SolverRequest request) {
    Objects.requireNonNull(request, "request");
    metrics.increment("solver.invocations");
    long start = System.nanoTime();
    String id = "input_" + UUID.randomUUID();
    Path input = settings.workDirectory().resolve(id + ".in");
    Path stdout = settings.workDirectory().resolve(id + ".out");
    Path stderr = settings.workDirectory().resolve(id + ".err");
    boolean success = false;
    try {
      Files.createDirectories(settings.workDirectory());
      Files.write(input, inputLines(request), StandardCharsets.UTF_8);

      Process process = new ProcessBuilder(settings.command())
          .redirectInput(input.toFile())
          .redirectOutput(stdout.toFile())
          .redirectError(stderr.toFile())
          .start();
      int exit;
      try {
        exit = process.waitFor();
      } catch (InterruptedException ex) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        throw new SolverException("Interrupted while waiting for the solver (input " + input + ")", ex);
      }
      if (exit != 0) {
        throw new SolverException("Solver exited with status " + exit + ". See input file '" + input
            + "' for details. stderr: " + stderrExcerpt(stderr));
      }
      SolverResult result = SolverResult.parse(request.outputs(), Files.readString(stdout, StandardCharsets.UTF_8));
      success = true;
      return result;
    } catch (IOException ex) {
      throw new SolverException("Unable to run solver " + settings.command() + " (input " + input + ")", ex);
    } finally {
      long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
      metrics.observe("solver.latencyMillis", elapsedMillis);
      if (success) {
        deleteQuietly(input);
        deleteQuietly(stdout);
        deleteQuietly(stderr);
        log.debug("Solver finished in {} ms", elapsedMillis);
      } else {
        metrics.increment("solver.failures");
        log.warn("Solver run failed after {} ms; keeping {} for inspection", elapsedMillis, input);
      }
    }
  }

  List<String> inputLines(SolverRequest request) {
    String data = settings.dataPath();
    List<String> lines = new ArrayList<>();
    lines.add("data_files_path " + data);
    lines.add("atmosphere_file " + data + "atmmod/afglus.dat");
    lines.add("source solar " + data + "solar_flux/atlas_plus_modtran");
    lines.add("aerosol_default");
    lines.add("rte_solver disort");
    lines.add("number_of_streams  8");
    lines.add("quiet");
    lines.addAll(request.directiveLines());
    lines.add(request.outputLine());
    return lines;
  }

  private static String stderrExcerpt(Path stderr) {
    try {
      return Logs.truncate(Files.readString(stderr, StandardCharsets.UTF_8).strip(), STDERR_EXCERPT_CHARS);
    } catch (IOException ex) {
      return "<unreadable: " + ex.getMessage() + ">";
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.debug("Unable to delete solver file {}", file, ex);
    }
  }
}
