package ca.gc.cra.uvcalc.application.pipeline;

import ca.gc.cra.uvcalc.domain.ancillary.AngularResponse;
import ca.gc.cra.uvcalc.domain.math.Integration;
import ca.gc.cra.uvcalc.domain.solver.SolverResult;
import java.util.Arrays;
import java.util.Objects;

/**
 * Cosine-correction factors derived from the angular response and the modelled irradiance components.
 *
 * <p>All angles handed to the ARF are in radians. Divisions by a zero global irradiance yield NaN factors, which
 * are returned as is.</p>
 */
public final class CosineCorrection {
  static final int DIFFUSE_INTEGRATION_POINTS = 160;

  static final String SZA = "sza";
  static final String DIRECT = "edir";
  static final String DIFFUSE = "edn";
  static final String GLOBAL = "eglo";

  private CosineCorrection() {
    // Utility
  }

  /**
   * Diffuse response {@code 2 * integral over [0, pi/2] of ARF(theta) sin(theta)}, evaluated with the trapezoidal
   * rule on {@value #DIFFUSE_INTEGRATION_POINTS} equally spaced angles.
   */
  public static double diffuseIntegral(AngularResponse arf) {
    Objects.requireNonNull(arf, "arf");
    double[] theta = Integration.linspace(0, Math.PI / 2, DIFFUSE_INTEGRATION_POINTS);
    double[] response = arf.valuesAt(theta);
    double[] integrand = new double[theta.length];
    for (int i = 0; i < theta.length; i++) {
      integrand[i] = response[i] * Math.sin(theta[i]);
    }
    return 2 * Integration.trapezoid(integrand, theta);
  }

  /** Uniform factor {@code 1 / diffuseIntegral} for an overcast sky. */
  public static double[] diffuseFactors(AngularResponse arf, int size) {
    double[] factors = new double[size];
    Arrays.fill(factors, 1 / diffuseIntegral(arf));
    return factors;
  }

  /**
   * Clear-sky factors {@code 1 / (d * Ediff/Eglo + (Edir/Eglo) * ARF(theta)/cos(theta))}, with {@code d} the
   * diffuse integral and {@code theta} the first solar zenith angle of the solver output.
   */
  public static double[] clearSkyFactors(AngularResponse arf, SolverResult solver) {
    Objects.requireNonNull(arf, "arf");
    double[] diffuse = solver.column(DIFFUSE);
    double[] direct = solver.column(DIRECT);
    double[] global = solver.column(GLOBAL);
    double theta = Math.toRadians(solver.column(SZA)[0]);
    double coscorDiff = diffuseIntegral(arf);
    double directResponse = arf.valueAt(theta) / Math.cos(theta);
    double[] factors = new double[diffuse.length];
    for (int i = 0; i < factors.length; i++) {
      factors[i] = 1 / (coscorDiff * (diffuse[i] / global[i]) + (direct[i] / global[i]) * directResponse);
    }
    return factors;
  }

  /**
   * Equivalent formulation {@code (Edir/Ediff + 1) / ((ARF(theta)/cos(theta)) * Edir/Ediff + d)}, kept to
   * cross-check {@link #clearSkyFactors(AngularResponse, SolverResult)}.
   */
  public static double[] alternateClearSkyFactors(AngularResponse arf, SolverResult solver) {
    Objects.requireNonNull(arf, "arf");
    double[] diffuse = solver.column(DIFFUSE);
    double[] direct = solver.column(DIRECT);
    double theta = Math.toRadians(solver.column(SZA)[0]);
    double coscorDiff = diffuseIntegral(arf);
    double directResponse = arf.valueAt(theta) / Math.cos(theta);
    double[] factors = new double[diffuse.length];
    for (int i = 0; i < factors.length; i++) {
      double ratio = direct[i] / diffuse[i];
      factors[i] = (ratio + 1) / (directResponse * ratio + coscorDiff);
    }
    return factors;
  }
}
