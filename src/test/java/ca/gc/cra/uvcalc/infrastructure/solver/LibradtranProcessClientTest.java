package ca.gc.cra.uvcalc.infrastructure.solver;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.uvcalc.application.port.MetricsPort;
import ca.gc.cra.uvcalc.config.SolverSettings;
import ca.gc.cra.uvcalc.domain.error.SolverException;
import ca.gc.cra.uvcalc.domain.solver.SolverDirective;
import ca.gc.cra.uvcalc.domain.solver.SolverRequest;
import ca.gc.cra.uvcalc.domain.solver.SolverResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class LibradtranProcessClientTest {
  private static final SolverRequest REQUEST = SolverRequest.builder()
      .put(SolverDirective.WAVELENGTH, 290.0, 295.0)
      .put(SolverDirective.SZA, 35.5)
      .outputs("lambda", "edir")
      .build();

  @TempDir
  Path workDir;

  private final Map<String, Integer> counters = new ConcurrentHashMap<>();
  private final MetricsPort metrics = new MetricsPort() {
    @Override
    public void increment(String key) {
      counters.merge(key, 1, Integer::sum);
    }

    @Override
    public void observe(String key, long value) {
      counters.merge(key + ".observed", 1, Integer::sum);
    }
  };

  @Test
  void parsesStdoutAndDeletesWorkFiles() throws IOException {
    SolverResult result = client("printf '290 1.5\\n\\n295 2.5\\n'").solve(REQUEST);

    assertEquals(2, result.rowCount());
    assertArrayEquals(new double[] {290, 295}, result.column("lambda"), 1e-12);
    assertArrayEquals(new double[] {1.5, 2.5}, result.column("edir"), 1e-12);
    assertTrue(files().isEmpty());
    assertEquals(1, counters.get("solver.invocations"));
    assertEquals(1, counters.get("solver.latencyMillis.observed"));
    assertNull(counters.get("solver.failures"));
  }

  @Test
  void feedsInputFileOnStandardInput() throws IOException {
    SolverResult result = client("grep -c . | awk '{print $1, 0}'").solve(REQUEST);

    // preamble (7 lines) + wavelength + sza + output_user
    assertEquals(10, result.column("lambda")[0], 1e-12);
  }

  @Test
  void nonZeroExitKeepsFilesAndReportsStderr() throws IOException {
    SolverException ex = assertThrows(SolverException.class,
        () -> client("echo 'no such atmosphere' >&2; exit 3").solve(REQUEST));

    assertTrue(ex.getMessage().contains("status 3"));
    assertTrue(ex.getMessage().contains("no such atmosphere"));
    List<String> kept = files();
    assertEquals(3, kept.size());
    assertTrue(kept.stream().anyMatch(name -> name.endsWith(".in")));
    assertEquals(1, counters.get("solver.failures"));
  }

  @Test
  void wrongColumnCountIsSolverError() throws IOException {
    assertThrows(SolverException.class, () -> client("echo '290 1 2'").solve(REQUEST));
    assertEquals(3, files().size());
  }

  @Test
  void missingExecutableIsSolverError() {
    LibradtranProcessClient client = new LibradtranProcessClient(
        new SolverSettings(List.of(workDir.resolve("missing-uvspec").toString()), workDir, "/data"), metrics);

    SolverException ex = assertThrows(SolverException.class, () -> client.solve(REQUEST));
    assertInstanceOf(IOException.class, ex.getCause());
  }

  @Test
  void writesPreambleBeforeDirectives() {
    List<String> lines = client("true").inputLines(REQUEST);

    assertEquals(List.of(
        "data_files_path /data/",
        "atmosphere_file /data/atmmod/afglus.dat",
        "source solar /data/solar_flux/atlas_plus_modtran",
        "aerosol_default",
        "rte_solver disort",
        "number_of_streams  8",
        "quiet",
        "wavelength 290.0 295.0",
        "sza 35.5",
        "output_user lambda edir"), lines);
  }

  private LibradtranProcessClient client(String script) {
    return new LibradtranProcessClient(new SolverSettings(List.of("sh", "-c", script), workDir, "/data"), metrics);
  }

  private List<String> files() throws IOException {
    try (Stream<Path> list = Files.list(workDir)) {
      return list.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
    }
  }
}
