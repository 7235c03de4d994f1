package ca.gc.cra.uvcalc.domain.ancillary;

import java.util.Arrays;
import java.util.Comparator;

/** Array helpers shared by the ancillary series. */
final class Series {

  private Series() {}

  /**
   * Stable sort of paired arrays by abscissa.
   *
   * @return {@code [sortedXs, sortedYs]}
   */
  static double[][] sortByX(double[] xs, double[] ys) {
    Integer[] order = new Integer[xs.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, Comparator.comparingDouble(i -> xs[i]));
    double[] sortedX = new double[xs.length];
    double[] sortedY = new double[ys.length];
    for (int i = 0; i < order.length; i++) {
      sortedX[i] = xs[order[i]];
      sortedY[i] = ys[order[i]];
    }
    return new double[][] {sortedX, sortedY};
  }
}
