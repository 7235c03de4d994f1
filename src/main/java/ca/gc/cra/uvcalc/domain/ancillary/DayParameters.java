package ca.gc.cra.uvcalc.domain.ancillary;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Atmospheric parameters recorded for one day of the year. Albedo and aerosol are already carried
 * forward from earlier days when the source left them blank.
 *
 * @param day day of year, January 1st is 1
 * @param albedo surface albedo
 * @param aerosol Ångström parameters
 * @param cloudCover cloud cover fraction, empty when the day has no observation
 */
public record DayParameters(int day, double albedo, Angstrom aerosol, OptionalDouble cloudCover) {
  public DayParameters {
    Objects.requireNonNull(aerosol, "aerosol");
    cloudCover = Objects.requireNonNullElse(cloudCover, OptionalDouble.empty());
  }
}
