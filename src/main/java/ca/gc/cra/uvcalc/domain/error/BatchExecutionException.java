package ca.gc.cra.uvcalc.domain.error;

/**
 * <strong>What:</strong> Checked failure of a whole calculation batch.
 * <p><strong>Why:</strong> Batches are all-or-nothing; callers must handle the abort explicitly.</p>
 * <p><strong>Role:</strong> Thrown by the job scheduler after it has cancelled outstanding work.</p>
 * <p>The cause carries the original job failure (format, solver or I/O error) unchanged.</p>
 *
 * @since 0.1.0
 */
public class BatchExecutionException extends Exception {
  private static final long serialVersionUID = 1L;

  public BatchExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
