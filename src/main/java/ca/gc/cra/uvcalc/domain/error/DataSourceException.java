package ca.gc.cra.uvcalc.domain.error;

/**
 * Raised when a network-backed data source cannot deliver its records (HTTP error status, transport
 * failure, unexpected document shape).
 *
 * @since 0.1.0
 */
public class DataSourceException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public DataSourceException(String message) {
    super(message);
  }

  public DataSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
