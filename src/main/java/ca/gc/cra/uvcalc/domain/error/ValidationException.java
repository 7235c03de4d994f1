package ca.gc.cra.uvcalc.domain.error;

/**
 * Raised for invalid configuration or invalid requests, such as a solver request without outputs or
 * an angular response table whose angles do not increase.
 *
 * @since 0.1.0
 */
public class ValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
