/**
 * <strong>Purpose:</strong> Raw spectroradiometer measurement model (headers, samples, sections).
 * <p><strong>Pipeline role:</strong> Output of the raw file parser and network UV source, input of the correction
 * pipeline.
 * <p><strong>Concurrency:</strong> Immutable records shared freely between worker threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.domain.measurement;
