package ca.gc.cra.uvcalc.domain.error;

/**
 * Raised when the external radiative-transfer solver fails or produces unusable output.
 *
 * <p>Fatal for the section being processed only; other sections of the batch are unaffected unless
 * the scheduler aborts the batch.</p>
 *
 * @since 0.1.0
 */
public class SolverException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public SolverException(String message) {
    super(message);
  }

  public SolverException(String message, Throwable cause) {
    super(message, cause);
  }
}
