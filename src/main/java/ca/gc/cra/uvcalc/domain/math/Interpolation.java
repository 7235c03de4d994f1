package ca.gc.cra.uvcalc.domain.math;

import java.util.Arrays;

/**
 * <strong>What:</strong> One-dimensional interpolation kernels over ascending abscissae.
 * <p><strong>Role:</strong> Shared by the calibration, ozone and parameter series.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Linear interpolation, extrapolating with the outermost segments.</li>
 *   <li>Nearest-neighbour lookup; equidistant queries resolve to the lower point.</li>
 *   <li>Previous-value lookup; queries before the first point take the first value.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p>All methods require {@code xs} ascending, the same length as {@code ys} and non-empty. A single point yields
 * its value for every query.</p>
 *
 * @since 0.1.0
 */
public final class Interpolation {

  private Interpolation() {}

  public static double linear(double[] xs, double[] ys, double x) {
    requireShape(xs, ys);
    int n = xs.length;
    if (n == 1) {
      return ys[0];
    }
    int lower;
    if (x <= xs[0]) {
      lower = 0;
    } else if (x >= xs[n - 1]) {
      lower = n - 2;
    } else {
      lower = floorIndex(xs, x);
      if (lower == n - 1) {
        lower = n - 2;
      }
    }
    double x0 = xs[lower];
    double x1 = xs[lower + 1];
    if (x1 == x0) {
      return ys[lower];
    }
    return ys[lower] + (ys[lower + 1] - ys[lower]) * (x - x0) / (x1 - x0);
  }

  public static double[] linear(double[] xs, double[] ys, double[] queries) {
    double[] out = new double[queries.length];
    for (int i = 0; i < queries.length; i++) {
      out[i] = linear(xs, ys, queries[i]);
    }
    return out;
  }

  public static double nearest(double[] xs, double[] ys, double x) {
    requireShape(xs, ys);
    int n = xs.length;
    if (n == 1 || x <= xs[0]) {
      return ys[0];
    }
    if (x >= xs[n - 1]) {
      return ys[n - 1];
    }
    int lower = floorIndex(xs, x);
    if (xs[lower] == x) {
      return ys[lower];
    }
    double below = x - xs[lower];
    double above = xs[lower + 1] - x;
    return above < below ? ys[lower + 1] : ys[lower];
  }

  public static double previous(double[] xs, double[] ys, double x) {
    requireShape(xs, ys);
    if (x < xs[0]) {
      return ys[0];
    }
    return ys[floorIndex(xs, x)];
  }

  /**
   * Index of the last abscissa less than or equal to {@code x}; {@code x} must be at least {@code xs[0]}.
   */
  static int floorIndex(double[] xs, double x) {
    int idx = Arrays.binarySearch(xs, x);
    if (idx >= 0) {
      while (idx + 1 < xs.length && xs[idx + 1] == x) {
        idx++;
      }
      return idx;
    }
    return -idx - 2;
  }

  private static void requireShape(double[] xs, double[] ys) {
    if (xs.length == 0) {
      throw new IllegalArgumentException("interpolation requires at least one point");
    }
    if (xs.length != ys.length) {
      throw new IllegalArgumentException(
          "xs and ys must have the same length (" + xs.length + " != " + ys.length + ")");
    }
  }
}
