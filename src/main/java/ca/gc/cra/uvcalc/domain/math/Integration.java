package ca.gc.cra.uvcalc.domain.math;

/**
 * Numerical integration helpers.
 */
public final class Integration {

  private Integration() {}

  /**
   * Trapezoidal rule over sampled values.
   *
   * @param y ordinates
   * @param x abscissae, same length as {@code y}
   * @return integral estimate; {@code 0} for fewer than two points
   */
  public static double trapezoid(double[] y, double[] x) {
    if (y.length != x.length) {
      throw new IllegalArgumentException("x and y must have the same length");
    }
    double sum = 0;
    for (int i = 1; i < x.length; i++) {
      sum += (x[i] - x[i - 1]) * (y[i] + y[i - 1]) / 2.0;
    }
    return sum;
  }

  /**
   * Evenly spaced values over a closed interval, both ends included.
   *
   * @param start first value
   * @param end last value
   * @param count number of values; must be positive
   * @return array of {@code count} values
   */
  public static double[] linspace(double start, double end, int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("count must be positive");
    }
    double[] out = new double[count];
    if (count == 1) {
      out[0] = start;
      return out;
    }
    double step = (end - start) / (count - 1);
    for (int i = 0; i < count; i++) {
      out[i] = start + i * step;
    }
    out[count - 1] = end;
    return out;
  }
}
