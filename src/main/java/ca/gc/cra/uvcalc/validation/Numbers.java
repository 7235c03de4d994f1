package ca.gc.cra.uvcalc.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration records and file parsers.
 * <p><strong>Why:</strong> Rejects impossible pool sizes, angles or columns before any worker starts.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} when validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name used in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating-point value is finite and within an inclusive range.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite or outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (Double.isNaN(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
