package ca.gc.cra.uvcalc.config;

import ca.gc.cra.uvcalc.domain.error.ValidationException;
import java.util.Locale;

/**
 * Origin of a data set: local instrument files or the EUBREWNET network service.
 */
public enum DataSourceKind {
  FILES,
  EUBREWNET;

  /**
   * Parses a configuration value, case-insensitively.
   *
   * @param key configuration key used in diagnostics
   * @param raw configured value; blank selects {@code defaultValue}
   * @param defaultValue fallback for blank values
   * @return parsed kind
   * @throws ValidationException for unknown values
   */
  public static DataSourceKind parse(String key, String raw, DataSourceKind defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return DataSourceKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ValidationException(key + " must be FILES or EUBREWNET (was " + raw + ")", ex);
    }
  }
}
