/**
 * Section correction and batch scheduling.
 *
 * <p><strong>Purpose:</strong> Convert raw counts into calibrated, cosine-corrected spectra and run those conversions
 * in parallel.</p>
 * <p><strong>Pipeline role:</strong> {@link ca.gc.cra.uvcalc.application.pipeline.JobScheduler} expands inputs into
 * {@link ca.gc.cra.uvcalc.application.pipeline.CalculationJob}s, each of which runs one
 * {@link ca.gc.cra.uvcalc.application.pipeline.CorrectionPipeline} step and yields a
 * {@link ca.gc.cra.uvcalc.application.pipeline.Result}.</p>
 * <p><strong>Concurrency:</strong> Jobs share their input read-only; the scheduler owns a fresh worker pool per
 * batch and cancels it as a whole on the first failure.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.application.pipeline;
