package ca.gc.cra.uvcalc.domain.ancillary;

import ca.gc.cra.uvcalc.domain.math.Interpolation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Day-indexed albedo, aerosol and cloud-cover parameters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Albedo and aerosol use the value of the latest recorded day not after the query; days before the first
 *   record take the first record's values.</li>
 *   <li>Cloud cover is only reported for an exactly matching day.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class ParameterSeries {
  private static final ParameterSeries EMPTY = new ParameterSeries(List.of());

  private final List<DayParameters> days;
  private final double[] dayIndex;
  private final double[] albedos;
  private final double[] alphas;
  private final double[] betas;

  public ParameterSeries(List<DayParameters> days) {
    List<DayParameters> sorted = new ArrayList<>(Objects.requireNonNull(days, "days"));
    sorted.sort(Comparator.comparingInt(DayParameters::day));
    this.days = List.copyOf(sorted);
    int n = sorted.size();
    this.dayIndex = new double[n];
    this.albedos = new double[n];
    this.alphas = new double[n];
    this.betas = new double[n];
    for (int i = 0; i < n; i++) {
      DayParameters p = sorted.get(i);
      dayIndex[i] = p.day();
      albedos[i] = p.albedo();
      alphas[i] = p.aerosol().alpha();
      betas[i] = p.aerosol().beta();
    }
  }

  public static ParameterSeries empty() {
    return EMPTY;
  }

  public double interpolateAlbedo(int day, double defaultValue) {
    if (days.isEmpty()) {
      return defaultValue;
    }
    return Interpolation.previous(dayIndex, albedos, day);
  }

  public Angstrom interpolateAerosol(int day, Angstrom defaultValue) {
    if (days.isEmpty()) {
      return defaultValue;
    }
    return new Angstrom(
        Interpolation.previous(dayIndex, alphas, day),
        Interpolation.previous(dayIndex, betas, day));
  }

  /**
   * @param day day of year
   * @return cloud cover recorded for exactly that day, or empty
   */
  public OptionalDouble cloudCover(int day) {
    for (DayParameters p : days) {
      if (p.day() == day) {
        return p.cloudCover();
      }
    }
    return OptionalDouble.empty();
  }

  public List<DayParameters> days() {
    return days;
  }

  public boolean isEmpty() {
    return days.isEmpty();
  }
}
