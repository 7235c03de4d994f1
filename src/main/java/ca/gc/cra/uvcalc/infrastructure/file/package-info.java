/**
 * File-backed data sources for raw UV measurements and ancillary instrument data.
 *
 * <p><strong>Purpose:</strong> Turn the instrument's text files (UV, UVR, ARF, B and parameter files) into domain
 * values, and discover those files on disk.</p>
 * <p><strong>Pipeline role:</strong> Implementations of {@link ca.gc.cra.uvcalc.application.port.DataSource}
 * consumed lazily by {@link ca.gc.cra.uvcalc.application.input.CalculationInput}.</p>
 * <p><strong>Concurrency:</strong> Sources hold only immutable paths and settings; each fetch opens its own
 * reader.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.infrastructure.file;
