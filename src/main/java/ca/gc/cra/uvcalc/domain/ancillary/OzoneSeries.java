package ca.gc.cra.uvcalc.domain.ancillary;

import ca.gc.cra.uvcalc.domain.math.Interpolation;
import java.util.Objects;

/**
 * Total ozone column through the day, already quality-filtered by its source.
 *
 * <p>Queries resolve to the nearest measurement; a query exactly between two measurements takes the earlier
 * one.</p>
 *
 * @since 0.1.0
 */
public final class OzoneSeries {
  private static final OzoneSeries EMPTY = new OzoneSeries(new double[0], new double[0]);

  private final double[] times;
  private final double[] values;

  /**
   * @param times minutes since midnight
   * @param values ozone column in Dobson units
   */
  public OzoneSeries(double[] times, double[] values) {
    Objects.requireNonNull(times, "times");
    Objects.requireNonNull(values, "values");
    if (times.length != values.length) {
      throw new IllegalArgumentException("times and values must have the same length");
    }
    double[][] sorted = Series.sortByX(times, values);
    this.times = sorted[0];
    this.values = sorted[1];
  }

  public static OzoneSeries empty() {
    return EMPTY;
  }

  /**
   * @param time minutes since midnight
   * @param defaultValue value returned when the series is empty
   * @return nearest ozone value, or {@code defaultValue}
   */
  public double interpolate(double time, double defaultValue) {
    if (times.length == 0) {
      return defaultValue;
    }
    return Interpolation.nearest(times, values, time);
  }

  public boolean isEmpty() {
    return times.length == 0;
  }

  public int size() {
    return times.length;
  }
}
