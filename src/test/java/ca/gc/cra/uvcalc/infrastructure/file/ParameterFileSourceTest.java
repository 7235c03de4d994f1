package ca.gc.cra.uvcalc.infrastructure.file;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.uvcalc.domain.ancillary.Angstrom;
import ca.gc.cra.uvcalc.domain.ancillary.ParameterSeries;
import ca.gc.cra.uvcalc.domain.error.FormatException;
import ca.gc.cra.uvcalc.domain.warning.WarningBuffer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParameterFileSourceTest {
  private final WarningBuffer warnings = new WarningBuffer();

  @Test
  void forwardFillsEmptyFields() throws IOException {
    ParameterSeries series = new ParameterFileSource(Optional.of(FileFixtures.fixture("par_19.033")))
        .fetch(warnings);

    assertEquals(3, series.days().size());
    assertEquals(0.05, series.days().get(1).albedo(), 1e-12);
    assertEquals(new Angstrom(1.2, 0.08), series.days().get(1).aerosol());
    assertEquals(OptionalDouble.of(0.95), series.cloudCover(171));
    assertEquals(OptionalDouble.empty(), series.cloudCover(170));
    assertEquals(OptionalDouble.empty(), series.cloudCover(175));
    assertEquals(0.05, series.interpolateAlbedo(175, 0.1), 1e-12);
    assertEquals(0.07, series.interpolateAlbedo(185, 0.1), 1e-12);
    assertEquals(new Angstrom(1.4, 0.12), series.interpolateAerosol(180, new Angstrom(0, 0)));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void firstLineMustDefineAlbedo(@TempDir Path dir) throws IOException {
    Path file = Files.writeString(dir.resolve("par_19.033"), "170;;1.2;0.08;\n");

    FormatException ex = assertThrows(FormatException.class,
        () -> new ParameterFileSource(Optional.of(file)).fetch(warnings));
    assertTrue(ex.getMessage().contains("albedo must be defined"));
  }

  @Test
  void firstLineMustDefineAerosol(@TempDir Path dir) throws IOException {
    Path file = Files.writeString(dir.resolve("par_19.033"), "170;0.05;1.2;;\n");

    FormatException ex = assertThrows(FormatException.class,
        () -> new ParameterFileSource(Optional.of(file)).fetch(warnings));
    assertTrue(ex.getMessage().contains("aerosol must be defined"));
  }

  @Test
  void rejectsWrongFieldCount(@TempDir Path dir) throws IOException {
    Path file = Files.writeString(dir.resolve("par_19.033"), "170;0.05;1.2;0.08\n");

    assertThrows(FormatException.class, () -> new ParameterFileSource(Optional.of(file)).fetch(warnings));
  }

  @Test
  void rejectsNonNumericDay(@TempDir Path dir) throws IOException {
    Path file = Files.writeString(dir.resolve("par_19.033"), "day;0.05;1.2;0.08;\n");

    assertThrows(FormatException.class, () -> new ParameterFileSource(Optional.of(file)).fetch(warnings));
  }

  @Test
  void missingFileWarnsAndYieldsEmpty() throws IOException {
    assertTrue(new ParameterFileSource(Optional.empty()).fetch(warnings).isEmpty());
    assertEquals(List.of(ParameterFileSource.MISSING_WARNING), warnings.messages());
  }

  @Test
  void fileWithoutDataLinesWarnsAndYieldsEmpty(@TempDir Path dir) throws IOException {
    Path file = Files.writeString(dir.resolve("par_19.033"), "\n  \n");

    ParameterSeries series = new ParameterFileSource(Optional.of(file)).fetch(warnings);

    assertTrue(series.isEmpty());
    assertEquals(0.04, series.interpolateAlbedo(171, 0.04), 1e-12);
    assertEquals(List.of(ParameterFileSource.emptyFileWarning("par_19.033")), warnings.messages());
  }
}
