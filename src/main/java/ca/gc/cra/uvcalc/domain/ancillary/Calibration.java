package ca.gc.cra.uvcalc.domain.ancillary;

import ca.gc.cra.uvcalc.domain.math.Interpolation;
import java.util.Objects;

/**
 * <strong>What:</strong> Instrument sensitivity per wavelength.
 * <p><strong>Role:</strong> Divides photon rates into calibrated irradiance during correction.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep samples sorted by wavelength.</li>
 *   <li>Interpolate linearly, extrapolating beyond the tabulated range.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; arrays are copied in and out.</p>
 *
 * @implNote Fewer than two points is treated as an empty calibration; a single point still answers every query
 * with its own value.
 * @since 0.1.0
 */
public final class Calibration {
  private final double[] wavelengths;
  private final double[] values;

  /**
   * @param wavelengths wavelengths in nanometres
   * @param values sensitivities, same length as {@code wavelengths}
   */
  public Calibration(double[] wavelengths, double[] values) {
    Objects.requireNonNull(wavelengths, "wavelengths");
    Objects.requireNonNull(values, "values");
    if (wavelengths.length != values.length) {
      throw new IllegalArgumentException("wavelengths and values must have the same length");
    }
    double[][] sorted = Series.sortByX(wavelengths, values);
    this.wavelengths = sorted[0];
    this.values = sorted[1];
  }

  public int size() {
    return wavelengths.length;
  }

  /**
   * @return {@code true} when fewer than two points are available for interpolation
   */
  public boolean isEmpty() {
    return wavelengths.length < 2;
  }

  /**
   * @param wavelength wavelength in nanometres
   * @return interpolated sensitivity
   * @throws IllegalStateException when the calibration has no points at all
   */
  public double interpolate(double wavelength) {
    if (wavelengths.length == 0) {
      throw new IllegalStateException("calibration has no points");
    }
    return Interpolation.linear(wavelengths, values, wavelength);
  }

  public double[] interpolate(double[] queries) {
    double[] out = new double[queries.length];
    for (int i = 0; i < queries.length; i++) {
      out[i] = interpolate(queries[i]);
    }
    return out;
  }

  public double[] wavelengths() {
    return wavelengths.clone();
  }

  public double[] values() {
    return values.clone();
  }
}
