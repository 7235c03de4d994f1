package ca.gc.cra.uvcalc.domain.measurement;

/**
 * One raw spectral sample.
 *
 * @param time minutes since midnight
 * @param wavelength wavelength in nanometres
 * @param step grating step count
 * @param events photon event count; averaged samples may be fractional
 * @since 0.1.0
 */
public record RawSample(double time, double wavelength, double step, double events) {

  /**
   * @return {@code 0} when no events were counted, {@code 1/sqrt(events)} otherwise
   */
  public double std() {
    return stdOf(events);
  }

  /**
   * Relative standard deviation of a Poisson count.
   *
   * @param events event count
   * @return {@code 0} when {@code events == 0}, {@code 1/sqrt(events)} otherwise
   */
  public static double stdOf(double events) {
    if (events == 0) {
      return 0;
    }
    return 1 / Math.sqrt(events);
  }
}
