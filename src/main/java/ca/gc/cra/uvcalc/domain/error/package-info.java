/**
 * <strong>Purpose:</strong> Exception taxonomy for the irradiance correction core.
 * <p><strong>Pipeline role:</strong> Format and validation errors stop a calculation input, solver errors stop
 * one section, batch errors abort the scheduler run.
 * <p><strong>Concurrency:</strong> Immutable exception types; safe to rethrow across worker threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.domain.error;
