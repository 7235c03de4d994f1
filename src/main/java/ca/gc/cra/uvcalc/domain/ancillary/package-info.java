/**
 * <strong>Purpose:</strong> Ancillary data consumed by the correction pipeline: calibration, angular response, ozone,
 * atmospheric parameters and instrument model lookups.
 * <p><strong>Pipeline role:</strong> Loaded once per calculation input by data sources, queried by every section
 * job of that input.
 * <p><strong>Concurrency:</strong> Immutable value types.
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.domain.ancillary;
