package ca.gc.cra.uvcalc.domain.result;

import java.util.Objects;

/**
 * <strong>What:</strong> Per-wavelength output of one corrected section.
 * <p><strong>Thread-safety:</strong> Immutable; arrays are defensively copied on the way in and out.</p>
 *
 * @param wavelengths wavelengths in nanometres
 * @param times sample times in minutes since midnight
 * @param rawEvents raw photon event counts as parsed
 * @param calibratedSpectrum calibrated, temperature-corrected irradiance
 * @param cosCorrectedSpectrum calibrated spectrum multiplied by the cosine correction (NaN factors count as 1)
 * @param cosCorrection cosine correction factors as computed, NaN values kept
 * @since 0.1.0
 */
public record Spectrum(
    double[] wavelengths,
    double[] times,
    double[] rawEvents,
    double[] calibratedSpectrum,
    double[] cosCorrectedSpectrum,
    double[] cosCorrection) {

  public Spectrum {
    int n = Objects.requireNonNull(wavelengths, "wavelengths").length;
    requireLength("times", times, n);
    requireLength("rawEvents", rawEvents, n);
    requireLength("calibratedSpectrum", calibratedSpectrum, n);
    requireLength("cosCorrectedSpectrum", cosCorrectedSpectrum, n);
    requireLength("cosCorrection", cosCorrection, n);
    wavelengths = wavelengths.clone();
    times = times.clone();
    rawEvents = rawEvents.clone();
    calibratedSpectrum = calibratedSpectrum.clone();
    cosCorrectedSpectrum = cosCorrectedSpectrum.clone();
    cosCorrection = cosCorrection.clone();
  }

  @Override
  public double[] wavelengths() {
    return wavelengths.clone();
  }

  @Override
  public double[] times() {
    return times.clone();
  }

  @Override
  public double[] rawEvents() {
    return rawEvents.clone();
  }

  @Override
  public double[] calibratedSpectrum() {
    return calibratedSpectrum.clone();
  }

  @Override
  public double[] cosCorrectedSpectrum() {
    return cosCorrectedSpectrum.clone();
  }

  @Override
  public double[] cosCorrection() {
    return cosCorrection.clone();
  }

  public int size() {
    return wavelengths.length;
  }

  private static void requireLength(String name, double[] values, int expected) {
    Objects.requireNonNull(values, name);
    if (values.length != expected) {
      throw new IllegalArgumentException(
          name + " has " + values.length + " values but " + expected + " wavelengths were given");
    }
  }
}
