package ca.gc.cra.uvcalc.domain.math;

import ca.gc.cra.uvcalc.domain.error.ValidationException;
import java.util.Objects;

/**
 * <strong>What:</strong> Cubic smoothing spline with residual budget {@code s = m} (m = number of points, unit
 * weights).
 * <p><strong>Why:</strong> The cosine correction integrates the angular response continuously, so sampled angular
 * response tables are smoothed before evaluation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return the least-squares cubic polynomial when its residual sum of squares already fits the budget.</li>
 *   <li>Otherwise fit a natural cubic smoothing spline (Reinsch form) whose penalty weight is chosen so the
 *   residual sum of squares equals the budget.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once fitted.</p>
 *
 * @since 0.1.0
 */
public final class SmoothingSpline {
  private static final int MIN_POINTS = 4;
  private static final int MAX_BISECTIONS = 200;

  private final double[] polynomial;
  private final double center;
  private final double scale;
  private final double[] knots;
  private final double[] fitted;
  private final double[] secondDerivatives;

  private SmoothingSpline(double[] polynomial, double center, double scale) {
    this.polynomial = polynomial;
    this.center = center;
    this.scale = scale;
    this.knots = null;
    this.fitted = null;
    this.secondDerivatives = null;
  }

  private SmoothingSpline(double[] knots, double[] fitted, double[] secondDerivatives) {
    this.polynomial = null;
    this.center = 0;
    this.scale = 1;
    this.knots = knots;
    this.fitted = fitted;
    this.secondDerivatives = secondDerivatives;
  }

  /**
   * Fits a smoothing spline through the given samples.
   *
   * @param x strictly increasing abscissae
   * @param y ordinates, same length as {@code x}
   * @return fitted spline
   * @throws ValidationException when fewer than four points are given or {@code x} is not strictly increasing
   */
  public static SmoothingSpline fit(double[] x, double[] y) {
    Objects.requireNonNull(x, "x");
    Objects.requireNonNull(y, "y");
    if (x.length != y.length) {
      throw new ValidationException("x and y must have the same length");
    }
    if (x.length < MIN_POINTS) {
      throw new ValidationException("smoothing spline requires at least " + MIN_POINTS + " points");
    }
    for (int i = 1; i < x.length; i++) {
      if (!(x[i] > x[i - 1])) {
        throw new ValidationException(
            "abscissae must be strictly increasing (x[" + (i - 1) + "]=" + x[i - 1] + ", x[" + i + "]=" + x[i] + ")");
      }
    }
    double budget = x.length;
    double center = (x[0] + x[x.length - 1]) / 2.0;
    double scale = (x[x.length - 1] - x[0]) / 2.0;
    double[] coefficients = leastSquaresCubic(x, y, center, scale);
    SmoothingSpline cubic = new SmoothingSpline(coefficients, center, scale);
    if (cubic.residualSumOfSquares(x, y) <= budget) {
      return cubic;
    }
    return reinsch(x.clone(), y.clone(), budget);
  }

  public double value(double x) {
    if (polynomial != null) {
      double u = (x - center) / scale;
      return polynomial[0] + u * (polynomial[1] + u * (polynomial[2] + u * polynomial[3]));
    }
    return evaluateNatural(x);
  }

  public double[] values(double[] xs) {
    double[] out = new double[xs.length];
    for (int i = 0; i < xs.length; i++) {
      out[i] = value(xs[i]);
    }
    return out;
  }

  /**
   * @return {@code true} when the fit degenerated to a single cubic polynomial
   */
  public boolean isPolynomial() {
    return polynomial != null;
  }

  double residualSumOfSquares(double[] x, double[] y) {
    double sum = 0;
    for (int i = 0; i < x.length; i++) {
      double r = y[i] - value(x[i]);
      sum += r * r;
    }
    return sum;
  }

  private static double[] leastSquaresCubic(double[] x, double[] y, double center, double scale) {
    double[][] normal = new double[4][4];
    double[] rhs = new double[4];
    for (int i = 0; i < x.length; i++) {
      double u = (x[i] - center) / scale;
      double[] powers = {1, u, u * u, u * u * u};
      for (int r = 0; r < 4; r++) {
        rhs[r] += powers[r] * y[i];
        for (int c = 0; c < 4; c++) {
          normal[r][c] += powers[r] * powers[c];
        }
      }
    }
    return solve(normal, rhs);
  }

  private static SmoothingSpline reinsch(double[] x, double[] y, double budget) {
    int n = x.length;
    int m = n - 2;
    double[] h = new double[n - 1];
    for (int i = 0; i < n - 1; i++) {
      h[i] = x[i + 1] - x[i];
    }
    // Q is n x (n-2); column j belongs to interior knot j+1.
    double[][] q = new double[n][m];
    double[][] r = new double[m][m];
    for (int j = 0; j < m; j++) {
      int k = j + 1;
      q[k - 1][j] = 1 / h[k - 1];
      q[k][j] = -1 / h[k - 1] - 1 / h[k];
      q[k + 1][j] = 1 / h[k];
      r[j][j] = (h[k - 1] + h[k]) / 3.0;
      if (j + 1 < m) {
        r[j][j + 1] = h[k] / 6.0;
        r[j + 1][j] = h[k] / 6.0;
      }
    }
    double[][] qtq = new double[m][m];
    for (int a = 0; a < m; a++) {
      for (int b = 0; b < m; b++) {
        double sum = 0;
        for (int i = 0; i < n; i++) {
          sum += q[i][a] * q[i][b];
        }
        qtq[a][b] = sum;
      }
    }
    double[] qty = new double[m];
    for (int j = 0; j < m; j++) {
      double sum = 0;
      for (int i = 0; i < n; i++) {
        sum += q[i][j] * y[i];
      }
      qty[j] = sum;
    }

    double lowLog = -12;
    double highLog = 12;
    while (rss(lowLog, q, r, qtq, qty) > budget && lowLog > -60) {
      lowLog -= 6;
    }
    while (rss(highLog, q, r, qtq, qty) < budget && highLog < 60) {
      highLog += 6;
    }
    for (int i = 0; i < MAX_BISECTIONS; i++) {
      double mid = (lowLog + highLog) / 2.0;
      double value = rss(mid, q, r, qtq, qty);
      if (Math.abs(value - budget) <= 1e-12 * budget) {
        lowLog = mid;
        highLog = mid;
        break;
      }
      if (value < budget) {
        lowLog = mid;
      } else {
        highLog = mid;
      }
    }
    double lambda = Math.pow(10, (lowLog + highLog) / 2.0);
    double[] gamma = solveGamma(lambda, r, qtq, qty);
    double[] g = new double[n];
    for (int i = 0; i < n; i++) {
      double qg = 0;
      for (int j = 0; j < m; j++) {
        qg += q[i][j] * gamma[j];
      }
      g[i] = y[i] - lambda * qg;
    }
    double[] full = new double[n];
    System.arraycopy(gamma, 0, full, 1, m);
    return new SmoothingSpline(x, g, full);
  }

  private static double rss(double logLambda, double[][] q, double[][] r, double[][] qtq, double[] qty) {
    double lambda = Math.pow(10, logLambda);
    double[] gamma = solveGamma(lambda, r, qtq, qty);
    double sum = 0;
    for (double[] row : q) {
      double qg = 0;
      for (int j = 0; j < gamma.length; j++) {
        qg += row[j] * gamma[j];
      }
      double residual = lambda * qg;
      sum += residual * residual;
    }
    return sum;
  }

  private static double[] solveGamma(double lambda, double[][] r, double[][] qtq, double[] qty) {
    int m = qty.length;
    double[][] system = new double[m][m];
    for (int a = 0; a < m; a++) {
      for (int b = 0; b < m; b++) {
        system[a][b] = r[a][b] + lambda * qtq[a][b];
      }
    }
    return solve(system, qty.clone());
  }

  private double evaluateNatural(double t) {
    int n = knots.length;
    if (t <= knots[0]) {
      double h = knots[1] - knots[0];
      double slope = (fitted[1] - fitted[0]) / h - h * secondDerivatives[1] / 6.0;
      return fitted[0] + slope * (t - knots[0]);
    }
    if (t >= knots[n - 1]) {
      double h = knots[n - 1] - knots[n - 2];
      double slope = (fitted[n - 1] - fitted[n - 2]) / h + h * secondDerivatives[n - 2] / 6.0;
      return fitted[n - 1] + slope * (t - knots[n - 1]);
    }
    int i = Math.min(Interpolation.floorIndex(knots, t), n - 2);
    double h = knots[i + 1] - knots[i];
    double left = t - knots[i];
    double right = knots[i + 1] - t;
    double linear = (left * fitted[i + 1] + right * fitted[i]) / h;
    double curvature = left * right / 6.0
        * ((1 + left / h) * secondDerivatives[i + 1] + (1 + right / h) * secondDerivatives[i]);
    return linear - curvature;
  }

  /** Gaussian elimination with partial pivoting; overwrites its arguments. */
  private static double[] solve(double[][] a, double[] b) {
    int n = b.length;
    for (int col = 0; col < n; col++) {
      int pivot = col;
      for (int row = col + 1; row < n; row++) {
        if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
          pivot = row;
        }
      }
      if (a[pivot][col] == 0) {
        throw new ValidationException("singular system while fitting smoothing spline");
      }
      double[] tmpRow = a[col];
      a[col] = a[pivot];
      a[pivot] = tmpRow;
      double tmp = b[col];
      b[col] = b[pivot];
      b[pivot] = tmp;
      for (int row = col + 1; row < n; row++) {
        double factor = a[row][col] / a[col][col];
        if (factor == 0) {
          continue;
        }
        for (int k = col; k < n; k++) {
          a[row][k] -= factor * a[col][k];
        }
        b[row] -= factor * b[col];
      }
    }
    double[] x = new double[n];
    for (int row = n - 1; row >= 0; row--) {
      double sum = b[row];
      for (int k = row + 1; k < n; k++) {
        sum -= a[row][k] * x[k];
      }
      x[row] = sum / a[row][row];
    }
    return x;
  }
}
