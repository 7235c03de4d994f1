package ca.gc.cra.uvcalc.domain.error;

/**
 * Batch failure caused by a job or input initialization exceeding its time budget.
 *
 * @since 0.1.0
 */
public class ExecutionTimeoutException extends BatchExecutionException {
  private static final long serialVersionUID = 1L;

  public ExecutionTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
