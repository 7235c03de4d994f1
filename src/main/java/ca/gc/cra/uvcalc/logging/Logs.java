package ca.gc.cra.uvcalc.logging;

import java.util.Objects;

/**
 * <strong>What:</strong> Helpers that keep instrument data excerpts readable in logs and error messages.
 * <p><strong>Why:</strong> Malformed lines and solver stderr can be arbitrarily long.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates text to at most {@code maxChars} characters, noting the original length.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxChars maximum characters kept; must be positive
   * @return the original value when short enough, otherwise a truncated copy with a length suffix
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    return value.substring(0, maxChars) + "... (truncated, " + maxChars + " of " + value.length() + ")";
  }

  /**
   * Makes control characters visible so CR/LF artefacts in instrument lines show up in logs.
   */
  public static String printable(String value) {
    Objects.requireNonNull(value, "value");
    StringBuilder out = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\r' -> out.append("\\r");
        case '\n' -> out.append("\\n");
        case '\t' -> out.append("\\t");
        default -> {
          if (Character.isISOControl(c)) {
            out.append(String.format("\\x%02X", (int) c));
          } else {
            out.append(c);
          }
        }
      }
    }
    return out.toString();
  }
}
