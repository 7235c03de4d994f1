/**
 * Per-day calculation inputs.
 *
 * <p><strong>Purpose:</strong> Bundle the sections of one instrument-day with the ancillary data they are
 * corrected against.</p>
 * <p><strong>Pipeline role:</strong> Built by {@link ca.gc.cra.uvcalc.config.CompositionRoot}, initialized and
 * expanded into jobs by {@link ca.gc.cra.uvcalc.application.pipeline.JobScheduler}.</p>
 * <p><strong>Concurrency:</strong> Inputs are shared by all jobs of the day; cached values are loaded once and read
 * without locking afterwards.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.application.input;
