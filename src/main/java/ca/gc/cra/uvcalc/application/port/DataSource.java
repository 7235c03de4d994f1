package ca.gc.cra.uvcalc.application.port;

import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import java.io.IOException;

/**
 * <strong>What:</strong> Capability port delivering one kind of domain record set (UV sections, calibration, ozone,
 * angular response, parameters, instrument model).
 * <p><strong>Why:</strong> File-backed and network-backed providers are interchangeable and chosen by configuration;
 * the calculation input only depends on this port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return a fully parsed, immutable record set.</li>
 *   <li>Report substituted defaults through the supplied warning sink instead of failing.</li>
 *   <li>Fail loudly with a format error when present data is malformed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called once per calculation input from a single thread.</p>
 *
 * @param <T> domain record set type
 * @since 0.1.0
 */
@FunctionalInterface
public interface DataSource<T> {
  /**
   * Loads the record set.
   *
   * @param warnings sink for recoverable problems (missing optional file, defaults applied)
   * @return the loaded records; never {@code null}
   * @throws IOException when the underlying file or connection cannot be read
   */
  T fetch(WarningSink warnings) throws IOException;
}
