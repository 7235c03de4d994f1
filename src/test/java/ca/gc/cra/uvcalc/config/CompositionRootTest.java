package ca.gc.cra.uvcalc.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.uvcalc.application.input.CalculationInput;
import ca.gc.cra.uvcalc.application.pipeline.Result;
import ca.gc.cra.uvcalc.application.port.ProgressListener;
import ca.gc.cra.uvcalc.application.port.RadiativeTransferPort;
import ca.gc.cra.uvcalc.domain.ancillary.StraylightCorrection;
import ca.gc.cra.uvcalc.domain.error.DataSourceException;
import ca.gc.cra.uvcalc.domain.solver.SolverDirective;
import ca.gc.cra.uvcalc.domain.solver.SolverResult;
import ca.gc.cra.uvcalc.infrastructure.file.InstrumentFileIndex.DailyFiles;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  private static final List<String> FIXTURES =
      List.of("UV17119.033", "UVR17319.033", "arf_033.dat", "B17119.033", "par_19.033");

  /** Answers every request with constant irradiances, one row per spline step. */
  private static final RadiativeTransferPort SOLVER = request -> {
    List<String> spline = request.values(SolverDirective.SPLINE);
    double first = Double.parseDouble(spline.get(0));
    double last = Double.parseDouble(spline.get(1));
    double step = Double.parseDouble(spline.get(2));
    int rows = (int) Math.round((last - first) / step) + 1;
    Map<String, double[]> columns = new LinkedHashMap<>();
    columns.put("sza", filled(rows, 40));
    columns.put("edir", filled(rows, 0.6));
    columns.put("edn", filled(rows, 0.4));
    columns.put("eglo", filled(rows, 1.0));
    return new SolverResult(columns);
  };

  @Test
  void wiresFileSourcesForDiscoveredDays(@TempDir Path dir) throws Exception {
    copyFixtures(dir);

    try (CompositionRoot root = new CompositionRoot(ConfigLoader.load(null, Map.of()))) {
      List<CalculationInput> inputs = root.calculationInputs(dir);

      assertEquals(1, inputs.size());
      CalculationInput input = inputs.get(0);
      input.initialize();
      assertEquals("033", input.brewerId());
      assertEquals(LocalDate.of(2019, 6, 20), input.date());
      assertEquals(2, input.sections().size());
      assertEquals(Optional.of("mkiii"), input.brewerType());
      assertEquals(StraylightCorrection.NOT_APPLIED, input.straylightCorrection());
      assertEquals(4, input.calibration().size());
      assertTrue(input.arf().isPresent());
      assertTrue(input.warnings().stream().anyMatch(w -> w.contains("0.1147")));
    }
  }

  @Test
  void schedulesEverySectionOfTheFixtureDay(@TempDir Path dir) throws Exception {
    copyFixtures(dir);

    try (CompositionRoot root = new CompositionRoot(ConfigLoader.load(null, Map.of()))) {
      assertSame(root.metrics(), root.metrics());
      List<Result> results = root.jobScheduler(SOLVER).schedule(root.calculationInputs(dir), ProgressListener.NONE);

      assertEquals(2, results.size());
      assertEquals(0, results.get(0).index());
      assertEquals(1, results.get(1).index());
      assertEquals(3, results.get(0).spectrum().size());
      assertEquals(2, results.get(1).spectrum().size());
    }
  }

  @Test
  void missingCalibrationFailsWhenLoaded(@TempDir Path dir) throws Exception {
    Path uv = Files.copy(fixture("UV17119.033"), dir.resolve("UV17119.033"));
    DailyFiles files = new DailyFiles("033", LocalDate.of(2019, 6, 20), uv,
        Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    try (CompositionRoot root = new CompositionRoot(ConfigLoader.load(null, Map.of()))) {
      CalculationInput input = root.calculationInput(files);
      assertEquals(2, input.sections().size());
      assertThrows(DataSourceException.class, input::calibration);
    }
  }

  private static void copyFixtures(Path dir) throws IOException, URISyntaxException {
    for (String name : FIXTURES) {
      Files.copy(fixture(name), dir.resolve(name));
    }
  }

  private static Path fixture(String name) throws URISyntaxException {
    return Path.of(CompositionRootTest.class.getResource("/fixtures/" + name).toURI());
  }

  private static double[] filled(int rows, double value) {
    double[] out = new double[rows];
    Arrays.fill(out, value);
    return out;
  }
}
