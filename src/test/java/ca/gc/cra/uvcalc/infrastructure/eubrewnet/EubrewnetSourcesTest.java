package ca.gc.cra.uvcalc.infrastructure.eubrewnet;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.uvcalc.domain.ancillary.Calibration;
import ca.gc.cra.uvcalc.domain.ancillary.OzoneSeries;
import ca.gc.cra.uvcalc.domain.error.DataSourceException;
import ca.gc.cra.uvcalc.domain.measurement.RawSample;
import ca.gc.cra.uvcalc.domain.measurement.Section;
import ca.gc.cra.uvcalc.domain.warning.WarningBuffer;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EubrewnetSourcesTest {
  private static final LocalDate DAY = LocalDate.of(2019, 6, 20);
  private static final String HEADER =
      "[\"x\", \"y\", 0.2294, 2.9e-8, 1, \"2019-06-20\", \"Arosa\", 46.78, -9.68, 23, 820, 10]";

  private FakeEubrewnetServer server;

  @BeforeEach
  void start() throws IOException {
    server = new FakeEubrewnetServer();
  }

  @AfterEach
  void stop() {
    server.close();
  }

  @Test
  void fetchesEveryScanTypeAndMergesDuplicates() throws IOException {
    server.reply("/getdataold/getUVAvailableScanTypes", 200, "[\"ux\"]");
    server.reply("/getdataold/getUV", 200, "[" + HEADER + ", [600, 601, 602], [2900, 2950, 2900],"
        + " [0, 10, 0], [100, 200, 300]]");

    List<Section> sections = new EubrewnetUvSource(server.client(), "033", DAY).fetch(WarningSink.IGNORE);

    assertEquals(1, sections.size());
    Section section = sections.get(0);
    assertEquals("ux", section.header().typeCode());
    assertEquals(0.2294, section.header().integrationTime(), 1e-12);
    assertEquals(DAY, section.header().date());
    assertEquals(List.of(new RawSample(601, 290, 0, 200), new RawSample(601, 295, 10, 200)), section.samples());
    assertEquals("scantype=ux&brewerid=033&date=2019-06-20", server.requests().get(1).rawQuery());
  }

  @Test
  void rejectsIncompleteUvGroups() {
    assertThrows(IllegalArgumentException.class,
        () -> EubrewnetUvSource.toSections("ux", List.of(List.of(), List.of()), "label"));
  }

  @Test
  void unexpectedUvPayloadIsDataSourceError() {
    server.reply("/getdataold/getUVAvailableScanTypes", 200, "[\"ux\"]");
    server.reply("/getdataold/getUV", 200, "[[\"x\"], [600], [2900], [0], [100]]");

    DataSourceException ex = assertThrows(DataSourceException.class,
        () -> new EubrewnetUvSource(server.client(), "033", DAY).fetch(WarningSink.IGNORE));
    assertNotNull(ex.getCause());
  }

  @Test
  void readsCalibrationColumns() throws IOException {
    server.reply("/getdataold/getUVR", 200, "[[\"header\"], [2900, 3000], [0.05, 0.08]]");

    Calibration calibration = new EubrewnetCalibrationSource(server.client(), "033", DAY).fetch(WarningSink.IGNORE);

    assertArrayEquals(new double[] {290, 300}, calibration.wavelengths(), 1e-12);
    assertArrayEquals(new double[] {0.05, 0.08}, calibration.values(), 1e-12);
  }

  @Test
  void readsOzoneRowsAfterHeader() throws IOException {
    String header = "[\"id\", \"date\", \"c2\", \"c3\", \"c4\", \"c5\", \"c6\", \"c7\", \"c8\", \"o3\"]";
    String row1 = "[1, \"20190620T083000Z\", 0, 0, 0, 0, 0, 0, 0, 310.5]";
    String row2 = "[2, \"20190620T120030Z\", 0, 0, 0, 0, 0, 0, 0, \"320.0\"]";
    server.reply("/data/get/O3L1_5", 200, "[" + header + ", " + row1 + ", " + row2 + "]");

    OzoneSeries ozone = new EubrewnetOzoneSource(server.client(), "033", DAY).fetch(WarningSink.IGNORE);

    assertEquals(2, ozone.size());
    assertEquals(310.5, ozone.interpolate(500, 0), 1e-12);
    assertEquals(320.0, ozone.interpolate(720.5, 0), 1e-12);
    assertNotNull(server.requests().get(0).authorization());
  }

  @Test
  void headerOnlyOzoneIsEmptyAndWarns() throws IOException {
    server.reply("/data/get/O3L1_5", 200, "[[\"id\"]]");
    WarningBuffer warnings = new WarningBuffer();

    assertTrue(new EubrewnetOzoneSource(server.client(), "033", DAY).fetch(warnings).isEmpty());
    assertEquals(List.of(EubrewnetOzoneSource.noOzoneWarning("033", DAY)), warnings.messages());
  }

  @Test
  void malformedOzoneTimestampIsDataSourceError() {
    server.reply("/data/get/O3L1_5", 200, "[[\"id\"], [1, \"yesterday\", 0, 0, 0, 0, 0, 0, 0, 300]]");

    assertThrows(DataSourceException.class,
        () -> new EubrewnetOzoneSource(server.client(), "033", DAY).fetch(WarningSink.IGNORE));
  }
}
