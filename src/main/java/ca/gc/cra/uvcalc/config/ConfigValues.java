package ca.gc.cra.uvcalc.config;

import ca.gc.cra.uvcalc.domain.error.ValidationException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Typed accessors over flattened configuration maps. Blank values fall back to the supplied default.
 */
final class ConfigValues {

  private ConfigValues() {}

  static String string(Map<String, String> options, String key, String defaultValue) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? defaultValue : raw.trim();
  }

  static double decimal(Map<String, String> options, String key, double defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      double value = Double.parseDouble(raw.trim());
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new ValidationException(key + " must be a finite number (was " + raw + ")");
      }
      return value;
    } catch (NumberFormatException ex) {
      throw new ValidationException(key + " must be a number (was " + raw + ")", ex);
    }
  }

  static int integer(Map<String, String> options, String key, int defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new ValidationException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  static boolean bool(Map<String, String> options, String key, boolean defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new ValidationException(key + " must be true or false (was " + raw + ")");
    };
  }

  static Duration seconds(Map<String, String> options, String key, Duration defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    double seconds = decimal(options, key, 0);
    if (seconds <= 0) {
      throw new ValidationException(key + " must be positive (was " + raw + ")");
    }
    return Duration.ofMillis(Math.round(seconds * 1000));
  }
}
