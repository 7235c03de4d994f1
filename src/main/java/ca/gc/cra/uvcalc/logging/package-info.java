/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound excerpts before emission.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for parsers, the solver adapter and the scheduler.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.logging;
