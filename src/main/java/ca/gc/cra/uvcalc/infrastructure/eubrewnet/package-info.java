/**
 * EUBREWNET network data sources.
 *
 * <p><strong>Purpose:</strong> Fetch UV scans, calibrations and ozone observations from the EUBREWNET service
 * when the configuration selects it over local files.</p>
 * <p><strong>Pipeline role:</strong> Alternative {@link ca.gc.cra.uvcalc.application.port.DataSource}
 * implementations; the rest of the calculation cannot tell them apart from the file-backed ones.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.uvcalc.infrastructure.eubrewnet.EubrewnetClient} is shared
 * across inputs; sources are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.infrastructure.eubrewnet;
