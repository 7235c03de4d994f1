package ca.gc.cra.uvcalc.validation;

import java.util.Objects;

/**
 * Validation utilities for identifiers such as instrument ids and data source labels.
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      if (Character.isISOControl(trimmed.charAt(i))) {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
    }
    return trimmed;
  }

  private static String message(String name, String detail) {
    return (name == null || name.isBlank() ? "value" : name) + " " + detail;
  }
}
