package ca.gc.cra.uvcalc.domain.ancillary;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class AncillarySeriesTest {

  @Test
  void calibrationSortsPointsAndInterpolatesLinearly() {
    Calibration calibration = new Calibration(new double[] {300, 290}, new double[] {0.08, 0.05});

    assertArrayEquals(new double[] {290, 300}, calibration.wavelengths(), 1e-12);
    assertEquals(0.065, calibration.interpolate(295), 1e-12);
    assertFalse(calibration.isEmpty());
    assertTrue(new Calibration(new double[] {290}, new double[] {1}).isEmpty());
  }

  @Test
  void emptyOzoneUsesDefault() {
    assertEquals(300, OzoneSeries.empty().interpolate(600, 300), 1e-12);
    assertThrows(IllegalArgumentException.class, () -> new OzoneSeries(new double[] {1}, new double[0]));
  }

  @Test
  void ozoneUsesNearestRecord() {
    OzoneSeries ozone = new OzoneSeries(new double[] {720, 510}, new double[] {320, 310});
    assertEquals(310, ozone.interpolate(600, 0), 1e-12);
    assertEquals(320, ozone.interpolate(640, 0), 1e-12);
  }

  @Test
  void parametersHoldPreviousDayAndDefaultWhenEmpty() {
    ParameterSeries series = new ParameterSeries(List.of(
        new DayParameters(180, 0.07, new Angstrom(1.4, 0.12), OptionalDouble.empty()),
        new DayParameters(170, 0.05, new Angstrom(1.2, 0.08), OptionalDouble.of(0.3))));

    assertEquals(170, series.days().get(0).day());
    assertEquals(0.05, series.interpolateAlbedo(100, 0.1), 1e-12);
    assertEquals(new Angstrom(1.2, 0.08), series.interpolateAerosol(179, new Angstrom(0, 0)));
    assertEquals(OptionalDouble.of(0.3), series.cloudCover(170));
    assertEquals(0.1, ParameterSeries.empty().interpolateAlbedo(170, 0.1), 1e-12);
    assertEquals(new Angstrom(1, 2), ParameterSeries.empty().interpolateAerosol(170, new Angstrom(1, 2)));
  }

  @Test
  void ozoneResolvesToNearestMeasurementTakingEarlierOnTies() {
    OzoneSeries ozone = new OzoneSeries(new double[] {10, 12, 14}, new double[] {300, 320, 350});

    assertEquals(300, ozone.interpolate(10, 0), 1e-12);
    assertEquals(300, ozone.interpolate(11, 0), 1e-12);
    assertEquals(320, ozone.interpolate(11.0001, 0), 1e-12);
    assertEquals(350, ozone.interpolate(100, 0), 1e-12);
  }

  @Test
  void albedoCarriesPreviousDayForward() {
    ParameterSeries series = new ParameterSeries(List.of(
        day(10, 0.1), day(12, 0.3), day(14, 0.5)));

    assertEquals(0.1, series.interpolateAlbedo(9, 0), 1e-12);
    assertEquals(0.1, series.interpolateAlbedo(11, 0), 1e-12);
    assertEquals(0.3, series.interpolateAlbedo(13, 0), 1e-12);
    assertEquals(0.5, series.interpolateAlbedo(100, 0), 1e-12);
  }

  @Test
  void singleMeasurementAnswersEveryQuery() {
    OzoneSeries ozone = new OzoneSeries(new double[] {600}, new double[] {315});
    ParameterSeries parameters = new ParameterSeries(List.of(day(170, 0.06)));

    for (double time : new double[] {0, 599.9, 600, 1439}) {
      assertEquals(315, ozone.interpolate(time, 300), 1e-12);
    }
    for (int d : new int[] {1, 169, 170, 366}) {
      assertEquals(0.06, parameters.interpolateAlbedo(d, 0.04), 1e-12);
      assertEquals(new Angstrom(1.2, 0.08), parameters.interpolateAerosol(d, new Angstrom(1.3, 0.1)));
    }
  }

  @Test
  void instrumentModelsMapStraylightCorrection() {
    assertEquals(StraylightCorrection.APPLIED, InstrumentModels.straylightFor(Optional.of(" MKIV ")));
    assertEquals(StraylightCorrection.NOT_APPLIED, InstrumentModels.straylightFor(Optional.of("mkiii")));
    assertEquals(StraylightCorrection.UNDEFINED, InstrumentModels.straylightFor(Optional.of("mkv")));
    assertEquals(StraylightCorrection.UNDEFINED, InstrumentModels.straylightFor(Optional.empty()));
    assertEquals(StraylightCorrection.NOT_APPLIED,
        InstrumentModels.resolve(Optional.empty(), StraylightCorrection.NOT_APPLIED));
  }

  private static DayParameters day(int day, double albedo) {
    return new DayParameters(day, albedo, new Angstrom(1.2, 0.08), OptionalDouble.empty());
  }
}
