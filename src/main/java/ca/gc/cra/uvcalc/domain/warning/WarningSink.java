package ca.gc.cra.uvcalc.domain.warning;

/**
 * <strong>What:</strong> Receives recoverable warnings raised while loading or correcting data.
 * <p><strong>Why:</strong> Operators audit which defaults replaced missing ancillary data; warnings therefore travel
 * with the calculation instead of living in global state.</p>
 * <p><strong>Role:</strong> Passed explicitly to parsers, data sources and the correction pipeline.</p>
 * <p><strong>Thread-safety:</strong> Implementations decide; {@link WarningBuffer} is confined to one thread.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface WarningSink {
  /**
   * Records a warning message.
   *
   * @param message operator-facing text; must not be {@code null}
   */
  void warn(String message);

  /** Sink that drops every warning. */
  WarningSink IGNORE = message -> {};
}
