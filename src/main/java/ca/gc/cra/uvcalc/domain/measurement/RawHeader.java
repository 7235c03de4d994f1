package ca.gc.cra.uvcalc.domain.measurement;

import java.time.LocalDate;
import java.util.Objects;

/**
 * <strong>What:</strong> Acquisition metadata of one measurement section.
 * <p><strong>Role:</strong> Parsed from a header line (file source) or a header array (network source) and read by
 * the correction pipeline.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param typeCode two-letter scan type (for example {@code ux})
 * @param integrationTime integration time per sample in seconds
 * @param deadTime photomultiplier dead time in seconds
 * @param cycles number of measurement cycles
 * @param date measurement date
 * @param place station name; may contain several words
 * @param position station coordinates
 * @param temperature instrument temperature in degrees Celsius
 * @param pressure surface pressure in hPa
 * @param dark dark count subtracted from raw events
 * @param source raw header line or request URL the header was read from
 * @since 0.1.0
 */
public record RawHeader(
    String typeCode,
    double integrationTime,
    double deadTime,
    int cycles,
    LocalDate date,
    String place,
    Position position,
    double temperature,
    double pressure,
    double dark,
    String source) {

  public RawHeader {
    Objects.requireNonNull(typeCode, "typeCode");
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(place, "place");
    Objects.requireNonNull(position, "position");
    source = Objects.requireNonNullElse(source, "");
  }

  /**
   * Returns a copy of this header carrying a different dark count.
   *
   * @param newDark replacement dark count
   * @return new header instance
   */
  public RawHeader withDark(double newDark) {
    return new RawHeader(
        typeCode,
        integrationTime,
        deadTime,
        cycles,
        date,
        place,
        position,
        temperature,
        pressure,
        newDark,
        source);
  }
}
