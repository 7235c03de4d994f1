package ca.gc.cra.uvcalc.domain.ancillary;

import ca.gc.cra.uvcalc.domain.error.ValidationException;
import ca.gc.cra.uvcalc.domain.math.SmoothingSpline;
import java.util.Objects;

/**
 * <strong>What:</strong> Angular response function (ARF) of the diffuser, tabulated by solar zenith angle.
 * <p><strong>Why:</strong> The cosine correction needs the response at arbitrary angles, so the table is smoothed
 * once and evaluated continuously.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject tables whose angles are outside [0, 90] or not strictly increasing.</li>
 *   <li>Fit a smoothing spline over the angles expressed in radians.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class AngularResponse {
  private final double[] szas;
  private final double[] values;
  private final SmoothingSpline spline;

  /**
   * @param szas solar zenith angles in degrees, strictly increasing
   * @param values relative responses, same length as {@code szas}
   * @throws ValidationException when the table is not usable
   */
  public AngularResponse(double[] szas, double[] values) {
    Objects.requireNonNull(szas, "szas");
    Objects.requireNonNull(values, "values");
    if (szas.length != values.length) {
      throw new ValidationException("ARF angles and values must have the same length");
    }
    double[] radians = new double[szas.length];
    for (int i = 0; i < szas.length; i++) {
      if (szas[i] < 0 || szas[i] > 90) {
        throw new ValidationException("ARF angle " + szas[i] + " is outside [0, 90]");
      }
      if (i > 0 && !(szas[i] > szas[i - 1])) {
        throw new ValidationException(
            "ARF angles must be strictly increasing (" + szas[i - 1] + " then " + szas[i] + ")");
      }
      radians[i] = Math.toRadians(szas[i]);
    }
    this.szas = szas.clone();
    this.values = values.clone();
    this.spline = SmoothingSpline.fit(radians, this.values);
  }

  /**
   * Evaluates the smoothed response.
   *
   * @param thetaRadians zenith angle in radians
   * @return smoothed response
   */
  public double valueAt(double thetaRadians) {
    return spline.value(thetaRadians);
  }

  public double[] valuesAt(double[] thetaRadians) {
    return spline.values(thetaRadians);
  }

  public double[] szas() {
    return szas.clone();
  }

  public double[] values() {
    return values.clone();
  }

  public int size() {
    return szas.length;
  }
}
