package ca.gc.cra.uvcalc.infrastructure.file;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.uvcalc.infrastructure.file.InstrumentFileIndex.DailyFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InstrumentFileIndexTest {

  @Test
  void groupsFilesOfOneDay(@TempDir Path dir) throws IOException {
    FileFixtures.copy(dir, FileFixtures.ALL);
    Files.writeString(dir.resolve("notes.txt"), "ignored");

    InstrumentFileIndex index = InstrumentFileIndex.scan(dir);

    assertEquals(List.of("033"), index.brewerIds());
    List<DailyFiles> days = index.dailyFiles("033");
    assertEquals(1, days.size());
    DailyFiles day = days.get(0);
    assertEquals(LocalDate.of(2019, 6, 20), day.date());
    assertEquals(dir.resolve("UV17119.033"), day.uvFile());
    assertEquals(Optional.of(dir.resolve("B17119.033")), day.bFile());
    assertEquals(Optional.of(dir.resolve("UVR17319.033")), day.calibrationFile());
    assertEquals(Optional.of(dir.resolve("arf_033.dat")), day.arfFile());
    assertEquals(Optional.of(dir.resolve("par_19.033")), day.parameterFile());
  }

  @Test
  void leavesAncillaryFilesOptional(@TempDir Path dir) throws IOException {
    FileFixtures.copy(dir, List.of("UV17119.033", "UVR17319.033"));
    Files.createDirectories(dir.resolve("later"));
    Files.copy(FileFixtures.fixture("UV17119.033"), dir.resolve("later").resolve("UV17219.033"));

    List<DailyFiles> days = InstrumentFileIndex.scan(dir).allDailyFiles();

    assertEquals(2, days.size());
    assertEquals(LocalDate.of(2019, 6, 21), days.get(1).date());
    assertTrue(days.get(0).bFile().isEmpty());
    assertTrue(days.get(0).arfFile().isEmpty());
    assertTrue(days.get(0).parameterFile().isEmpty());
  }

  @Test
  void skipsInstrumentsWithoutCalibrationOrMeasurements(@TempDir Path dir) throws IOException {
    FileFixtures.copy(dir, FileFixtures.ALL);
    Files.copy(FileFixtures.fixture("UV17119.033"), dir.resolve("UV17119.099"));
    Files.copy(FileFixtures.fixture("UVR17319.033"), dir.resolve("UVR17319.101"));

    InstrumentFileIndex index = InstrumentFileIndex.scan(dir);

    assertEquals(List.of("033"), index.brewerIds());
    assertTrue(index.dailyFiles("099").isEmpty());
  }

  @Test
  void convertsDayOfYearInLeapYear() {
    assertEquals(LocalDate.of(2020, 2, 29), InstrumentFileIndex.toDate(60, 20));
  }
}
