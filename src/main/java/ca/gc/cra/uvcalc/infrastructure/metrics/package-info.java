/**
 * OpenTelemetry implementation of the metrics port.
 *
 * <p><strong>Purpose:</strong> Export scheduler and solver counters and latency histograms.</p>
 * <p><strong>Pipeline role:</strong> Wired by {@link ca.gc.cra.uvcalc.config.CompositionRoot} when
 * {@code metricsExporter=otlp}; otherwise the adapter runs on a noop meter.</p>
 * <p><strong>Concurrency:</strong> Instruments are created once per key in concurrent maps and are thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.infrastructure.metrics;
