/**
 * <strong>Purpose:</strong> Ports between the calculation core and its collaborators (data sources, solver, progress,
 * metrics, clock).
 * <p><strong>Pipeline role:</strong> Application boundary; infrastructure adapters implement these interfaces.
 * <p><strong>Concurrency:</strong> Solver, metrics and progress ports are called from worker threads; data sources
 * are called once per calculation input.
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.application.port;
